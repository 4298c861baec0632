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
package com.alipay.sofa.raftstore.storage.snapshot.local;

import java.util.Set;

import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.storage.snapshot.Snapshot;

/**
 * Describe the Snapshot on another machine, only its metadata table is local.
 */
public class LocalSnapshot extends Snapshot {

    private final LocalSnapshotMetaTable metaTable;

    public LocalSnapshot(final boolean syncMeta) {
        this.metaTable = new LocalSnapshotMetaTable(syncMeta);
    }

    public LocalSnapshotMetaTable getMetaTable() {
        return this.metaTable;
    }

    /**
     * A remote snapshot has no local path.
     */
    @Override
    public String getPath() {
        throw new UnsupportedOperationException("A remote snapshot has no local path");
    }

    @Override
    public Set<String> listFiles() {
        return this.metaTable.listFiles();
    }

    @Override
    public LocalFileMeta getFileMeta(final String fileName) {
        return this.metaTable.getFileMeta(fileName);
    }
}
