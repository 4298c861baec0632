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
package com.alipay.sofa.raftstore.storage.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.conf.ConfigurationManager;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.storage.LogStorage;
import com.alipay.sofa.raftstore.storage.registry.StorageUri;

/**
 * Volatile log storage keeping entries in memory. Entries are copied on the way
 * in and out, so callers never share state with the stored log.
 * URI: {@code memory://[name]}.
 */
public class MemoryLogStorage implements LogStorage {

    private static final Logger   LOG           = LoggerFactory.getLogger(MemoryLogStorage.class);

    private final List<LogEntry>  entries       = new ArrayList<>();
    private final ReadWriteLock   readWriteLock = new ReentrantReadWriteLock();
    private final Lock            readLock      = this.readWriteLock.readLock();
    private final Lock            writeLock     = this.readWriteLock.writeLock();
    private final String          name;

    private long                  firstLogIndex = 1;

    public MemoryLogStorage() {
        this("");
    }

    public MemoryLogStorage(final String name) {
        this.name = name;
    }

    @Override
    public LogStorage newInstance(final String uri) {
        return new MemoryLogStorage(StorageUri.parse(uri).getPath());
    }

    @Override
    public Status init(final ConfigurationManager confManager) {
        LOG.info("MemoryLogStorage {} initialized.", this.name);
        return Status.OK();
    }

    @Override
    public void shutdown() {
        this.writeLock.lock();
        try {
            this.entries.clear();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public long getFirstLogIndex() {
        this.readLock.lock();
        try {
            return this.firstLogIndex;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public long getLastLogIndex() {
        this.readLock.lock();
        try {
            return lastLogIndex();
        } finally {
            this.readLock.unlock();
        }
    }

    private long lastLogIndex() {
        return this.firstLogIndex + this.entries.size() - 1;
    }

    @Override
    public LogEntry getEntry(final long index) {
        this.readLock.lock();
        try {
            if (index < this.firstLogIndex || index > lastLogIndex()) {
                return null;
            }
            return this.entries.get((int) (index - this.firstLogIndex)).copy();
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public long getTerm(final long index) {
        this.readLock.lock();
        try {
            if (index < this.firstLogIndex || index > lastLogIndex()) {
                return 0;
            }
            return this.entries.get((int) (index - this.firstLogIndex)).getId().getTerm();
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public Status appendEntry(final LogEntry entry) {
        if (entry == null || entry.getId() == null) {
            return new Status(RaftError.EINVAL, "Null log entry");
        }
        this.writeLock.lock();
        try {
            final long expectedIndex = lastLogIndex() + 1;
            if (entry.getId().getIndex() != expectedIndex) {
                return new Status(RaftError.EINVAL, "Expect log index %d but got %d", expectedIndex, entry.getId()
                    .getIndex());
            }
            this.entries.add(entry.copy());
            return Status.OK();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public int appendEntries(final List<LogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        this.writeLock.lock();
        try {
            int count = 0;
            for (final LogEntry entry : entries) {
                if (entry == null || entry.getId() == null || entry.getId().getIndex() != lastLogIndex() + 1) {
                    break;
                }
                this.entries.add(entry.copy());
                count++;
            }
            return count;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status truncatePrefix(final long firstIndexKept) {
        this.writeLock.lock();
        try {
            if (firstIndexKept <= this.firstLogIndex) {
                return Status.OK();
            }
            final long lastIndex = lastLogIndex();
            if (firstIndexKept > lastIndex + 1) {
                this.entries.clear();
            } else {
                this.entries.subList(0, (int) (firstIndexKept - this.firstLogIndex)).clear();
            }
            this.firstLogIndex = firstIndexKept;
            return Status.OK();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status truncateSuffix(final long lastIndexKept) {
        this.writeLock.lock();
        try {
            if (lastIndexKept >= lastLogIndex()) {
                return Status.OK();
            }
            if (lastIndexKept < this.firstLogIndex - 1) {
                return new Status(RaftError.EINVAL, "Last index kept %d is before first log index %d",
                    lastIndexKept, this.firstLogIndex);
            }
            this.entries.subList((int) (lastIndexKept + 1 - this.firstLogIndex), this.entries.size()).clear();
            return Status.OK();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status reset(final long nextLogIndex) {
        if (nextLogIndex <= 0) {
            return new Status(RaftError.EINVAL, "Invalid next log index %d", nextLogIndex);
        }
        this.writeLock.lock();
        try {
            this.entries.clear();
            this.firstLogIndex = nextLogIndex;
            return Status.OK();
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "MemoryLogStorage{name=" + this.name + '}';
    }
}
