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
import java.util.concurrent.TimeUnit;

import com.alipay.sofa.raftstore.Status;

/**
 * Copy snapshot from the give resources.
 */
public abstract class SnapshotCopier implements Closeable {

    /**
     * Copy job states, the last three are terminal.
     */
    public enum State {
        PENDING, RUNNING, COMPLETED, CANCELLED, FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED || this == FAILED;
        }
    }

    /**
     * Outcome of the copy job.
     */
    public abstract Status status();

    public abstract State getState();

    /**
     * Start to copy.
     */
    public abstract void start();

    /**
     * Cancel the copy job, ignored once the job is finished.
     */
    public abstract void cancel();

    /**
     * Block the thread until this copy job finishes, or some error occurs.
     * @throws InterruptedException if the current thread is interrupted
     *         while waiting
     */
    public abstract void join() throws InterruptedException;

    /**
     * Waits at most the given time for the copy job to finish.
     *
     * @return true if the job finished
     */
    public abstract boolean join(final long timeout, final TimeUnit unit) throws InterruptedException;

    /**
     * Get the the SnapshotReader which represents the copied Snapshot, null
     * unless the job completed. The caller owns the returned reader.
     */
    public abstract SnapshotReader getReader();
}
