/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.alipay.sofa.raftstore.option;

import com.alipay.sofa.raftstore.rpc.FileClientService;
import com.alipay.sofa.raftstore.storage.StorageMetrics;
import com.alipay.sofa.raftstore.util.TimerManager;

/**
 * Snapshot copier options.
 */
public class SnapshotCopierOptions {

    private FileClientService fileClientService;
    private TimerManager      timerManager;
    private StorageOptions    storageOptions;
    private CopyOptions       copyOptions;
    private StorageMetrics    metrics;

    public SnapshotCopierOptions() {
        super();
    }

    public SnapshotCopierOptions(final FileClientService fileClientService, final TimerManager timerManager,
                                 final StorageOptions storageOptions, final CopyOptions copyOptions) {
        super();
        this.fileClientService = fileClientService;
        this.timerManager = timerManager;
        this.storageOptions = storageOptions;
        this.copyOptions = copyOptions;
    }

    public FileClientService getFileClientService() {
        return this.fileClientService;
    }

    public void setFileClientService(final FileClientService fileClientService) {
        this.fileClientService = fileClientService;
    }

    public TimerManager getTimerManager() {
        return this.timerManager;
    }

    public void setTimerManager(final TimerManager timerManager) {
        this.timerManager = timerManager;
    }

    public StorageOptions getStorageOptions() {
        return this.storageOptions;
    }

    public void setStorageOptions(final StorageOptions storageOptions) {
        this.storageOptions = storageOptions;
    }

    public CopyOptions getCopyOptions() {
        return this.copyOptions;
    }

    public void setCopyOptions(final CopyOptions copyOptions) {
        this.copyOptions = copyOptions;
    }

    public StorageMetrics getMetrics() {
        return this.metrics;
    }

    public void setMetrics(final StorageMetrics metrics) {
        this.metrics = metrics;
    }
}
