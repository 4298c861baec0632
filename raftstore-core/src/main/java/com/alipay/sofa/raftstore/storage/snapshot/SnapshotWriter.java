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
import java.io.IOException;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.google.protobuf.Message;

/**
 * Snapshot writer.
 */
public abstract class SnapshotWriter extends Snapshot implements Closeable {

    /**
     * Save a snapshot metadata, once per writer.
     *
     * @param meta snapshot metadata
     * @return OK, or EBUSY if the meta was already saved
     */
    public abstract Status saveMeta(final SnapshotMeta meta);

    /**
     * Adds a snapshot file without metadata.
     *
     * @param fileName file name
     * @return OK, or EEXISTS if the file is already in the snapshot
     */
    public Status addFile(final String fileName) {
        return addFile(fileName, null);
    }

    /**
     * Adds a snapshot file with metadata.
     *
     * @param fileName file name
     * @param fileMeta file metadata, may be null
     * @return OK, or EEXISTS if the file is already in the snapshot
     */
    public abstract Status addFile(final String fileName, final Message fileMeta);

    /**
     * Remove a snapshot file, removing an absent file succeeds.
     *
     * @param fileName file name
     */
    public abstract Status removeFile(final String fileName);

    /**
     * Close the writer, publishing the snapshot if it succeeded.
     *
     * @param keepDataOnError whether to keep data when error happens.
     * @throws IOException if the snapshot could not be published
     */
    public abstract void close(final boolean keepDataOnError) throws IOException;

    @Override
    public void close() throws IOException {
        close(false);
    }
}
