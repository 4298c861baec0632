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
package com.alipay.sofa.raftstore.storage.snapshot;

import java.io.Closeable;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.alipay.sofa.raftstore.error.RaftError;

/**
 * Snapshot reader.
 */
public abstract class SnapshotReader extends Snapshot implements Closeable {

    /**
     * Load the snapshot metadata, null if none was saved.
     */
    public abstract SnapshotMeta load();

    /**
     * Checks that the snapshot metadata can be loaded.
     *
     * @return OK, or ENOENT when no metadata was saved
     */
    public Status loadMeta() {
        if (load() == null) {
            return new Status(RaftError.ENOENT, "No snapshot meta in %s", getPath());
        }
        return Status.OK();
    }

    /**
     * Generate uri for other peers to copy this snapshot.
     *
     * @return the uri, or an empty string if some error has occurred
     */
    public abstract String generateURIForCopy();
}
