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
package com.alipay.sofa.raftstore.storage;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotCopier;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotReader;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotWriter;

/**
 * Snapshot storage.
 */
public interface SnapshotStorage extends Storage<SnapshotStorage> {

    /**
     * Set filterBeforeCopyRemote to be true. When true, files of the local
     * snapshot are reused before copying from remote.
     *
     * @throws UnsupportedOperationException if the backend does not support it
     */
    default Status setFilterBeforeCopyRemote() {
        throw new UnsupportedOperationException(getClass().getName() + " doesn't support filter before copy remote");
    }

    /**
     * Replaces the file system used for snapshot files.
     *
     * @throws UnsupportedOperationException if the backend does not support it
     */
    default Status setFileSystemAdaptor(final FileSystemAdaptor fs) {
        throw new UnsupportedOperationException(getClass().getName() + " doesn't support file system adaptor");
    }

    /**
     * Configure a SnapshotThrottle.
     *
     * @throws UnsupportedOperationException if the backend does not support it
     */
    default Status setSnapshotThrottle(final SnapshotThrottle snapshotThrottle) {
        throw new UnsupportedOperationException(getClass().getName() + " doesn't support snapshot throttle");
    }

    Status init();

    void shutdown();

    /**
     * Create a snapshot writer, null if another writer is in use or on failure.
     */
    SnapshotWriter create();

    /**
     * Publishes the writer's snapshot as the newest generation when it
     * succeeded, discards it otherwise.
     */
    Status close(final SnapshotWriter writer);

    /**
     * Like {@link #close(SnapshotWriter)}, leaving a failed writer's files in place when
     * {@code keepDataOnError} is set.
     */
    Status close(final SnapshotWriter writer, final boolean keepDataOnError);

    /**
     * Open a reader on the latest snapshot, null if there is none.
     */
    SnapshotReader open();

    Status close(final SnapshotReader reader);

    /**
     * Copy data from remote uri and open it. Blocks until the copy ends.
     *
     * @param uri remote uri
     * @return a SnapshotReader instance, null on failure
     */
    SnapshotReader copyFrom(final String uri);

    /**
     * Starts a copy job to copy data from remote uri.
     *
     * @param uri remote uri
     * @return a running SnapshotCopier instance, null if it can't be started
     */
    SnapshotCopier startToCopyFrom(final String uri);

    /**
     * Cancels the copier if still running, waits for it and releases it.
     */
    Status close(final SnapshotCopier copier);
}
