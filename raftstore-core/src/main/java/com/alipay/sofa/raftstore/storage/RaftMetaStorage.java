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
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.StableMeta;

/**
 * Raft metadata storage service: the current term and the vote cast in it.
 */
public interface RaftMetaStorage extends Storage<RaftMetaStorage> {

    Status init();

    void shutdown();

    /**
     * Set current term.
     */
    Status setTerm(final long term);

    /**
     * Get current term.
     */
    long getTerm();

    /**
     * Set voted for information.
     */
    Status setVotedFor(final PeerId peerId);

    /**
     * Get voted for information, the empty peer when no vote was cast.
     */
    PeerId getVotedFor();

    /**
     * Set term and voted for information.
     */
    Status setTermAndVotedFor(final long term, final PeerId peerId);

    /**
     * Returns term and voted for as one consistent pair.
     */
    StableMeta getStableMeta();
}
