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

import java.util.List;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.conf.ConfigurationManager;
import com.alipay.sofa.raftstore.entity.LogEntry;

/**
 * Log entry storage service.
 */
public interface LogStorage extends Storage<LogStorage> {

    /**
     * Opens the storage and checks its consistency. Configuration entries
     * found in the log are replayed into the given manager in increasing
     * index order.
     *
     * @param confManager membership tracker, may be null
     * @return OK, or ECORRUPTED/EIO on a damaged log
     */
    Status init(final ConfigurationManager confManager);

    /**
     * Releases the resources held by the storage.
     */
    void shutdown();

    /**
     * Returns first log index in log.
     */
    long getFirstLogIndex();

    /**
     * Returns last log index in log.
     */
    long getLastLogIndex();

    /**
     * Get logEntry by index, null if out of range.
     */
    LogEntry getEntry(final long index);

    /**
     * Get logEntry's term by index, 0 if out of range.
     */
    long getTerm(final long index);

    /**
     * Append entry to log. The entry index must be last log index + 1.
     */
    Status appendEntry(final LogEntry entry);

    /**
     * Append entries to log, return append success number.
     */
    int appendEntries(final List<LogEntry> entries);

    /**
     * Delete logs from storage's head, [first_log_index, first_index_kept) will
     * be discarded.
     */
    Status truncatePrefix(final long firstIndexKept);

    /**
     * Delete uncommitted logs from storage's tail, (last_index_kept, last_log_index]
     * will be discarded.
     */
    Status truncateSuffix(final long lastIndexKept);

    /**
     * Drop all the existing logs and reset next log index to |next_log_index|.
     * This function is called after installing snapshot from leader.
     */
    Status reset(final long nextLogIndex);
}
