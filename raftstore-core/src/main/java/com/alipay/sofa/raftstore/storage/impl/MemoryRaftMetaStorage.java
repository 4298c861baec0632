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

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.StableMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.storage.RaftMetaStorage;
import com.alipay.sofa.raftstore.storage.registry.StorageUri;

/**
 * Volatile raft meta storage. URI: {@code memory://[name]}.
 */
public class MemoryRaftMetaStorage implements RaftMetaStorage {

    private volatile StableMeta meta = StableMeta.EMPTY;

    @Override
    public RaftMetaStorage newInstance(final String uri) {
        StorageUri.parse(uri);
        return new MemoryRaftMetaStorage();
    }

    @Override
    public Status init() {
        return Status.OK();
    }

    @Override
    public void shutdown() {
    }

    @Override
    public synchronized Status setTerm(final long term) {
        if (term < this.meta.getTerm()) {
            return termBehind(term);
        }
        this.meta = this.meta.withTerm(term);
        return Status.OK();
    }

    @Override
    public long getTerm() {
        return this.meta.getTerm();
    }

    @Override
    public synchronized Status setVotedFor(final PeerId peerId) {
        this.meta = this.meta.withVotedFor(peerId);
        return Status.OK();
    }

    @Override
    public PeerId getVotedFor() {
        return this.meta.getVotedFor();
    }

    @Override
    public synchronized Status setTermAndVotedFor(final long term, final PeerId peerId) {
        if (term < this.meta.getTerm()) {
            return termBehind(term);
        }
        this.meta = new StableMeta(term, peerId);
        return Status.OK();
    }

    private Status termBehind(final long term) {
        return new Status(RaftError.EINVAL, "Term %d is behind current term %d", term, this.meta.getTerm());
    }

    @Override
    public StableMeta getStableMeta() {
        return this.meta;
    }

    @Override
    public String toString() {
        return "MemoryRaftMetaStorage [meta=" + this.meta + "]";
    }
}
