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
package com.alipay.sofa.raftstore.entity;

/**
 * Immutable pair of the current term and the peer voted for in that term.
 * Stable storages publish it as a whole so a reader never sees a term from
 * one update paired with a vote from another.
 */
public final class StableMeta {

    public static final StableMeta EMPTY = new StableMeta(0, PeerId.emptyPeer());

    private final long             term;
    private final PeerId           votedFor;

    public StableMeta(final long term, final PeerId votedFor) {
        this.term = term;
        this.votedFor = votedFor == null ? PeerId.emptyPeer() : votedFor.copy();
    }

    public long getTerm() {
        return this.term;
    }

    /**
     * Returns a copy of the voted peer, the empty peer when no vote was cast.
     */
    public PeerId getVotedFor() {
        return this.votedFor.copy();
    }

    /**
     * Moving to another term clears the vote, which belongs to the old term.
     */
    public StableMeta withTerm(final long newTerm) {
        if (newTerm == this.term) {
            return this;
        }
        return new StableMeta(newTerm, PeerId.emptyPeer());
    }

    public StableMeta withVotedFor(final PeerId peerId) {
        return new StableMeta(this.term, peerId);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(this.term) + this.votedFor.hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StableMeta)) {
            return false;
        }
        final StableMeta other = (StableMeta) obj;
        return this.term == other.term && this.votedFor.equals(other.votedFor);
    }

    @Override
    public String toString() {
        return "StableMeta [term=" + this.term + ", votedFor=" + this.votedFor + "]";
    }
}
