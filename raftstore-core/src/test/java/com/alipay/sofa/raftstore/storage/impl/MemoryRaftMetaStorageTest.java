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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.StableMeta;
import com.alipay.sofa.raftstore.error.RaftError;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MemoryRaftMetaStorageTest {

    private MemoryRaftMetaStorage raftMetaStorage;

    @BeforeEach
    public void setup() {
        this.raftMetaStorage = new MemoryRaftMetaStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
    }

    @Test
    public void testGetAndSet() {
        assertEquals(0, this.raftMetaStorage.getTerm());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());
        assertTrue(this.raftMetaStorage.setTerm(5).isOk());
        assertTrue(this.raftMetaStorage.setVotedFor(new PeerId("localhost", 8081)).isOk());
        assertEquals(new StableMeta(5, new PeerId("localhost", 8081)), this.raftMetaStorage.getStableMeta());
    }

    @Test
    public void testNewTermClearsVote() {
        assertTrue(this.raftMetaStorage.setTermAndVotedFor(4, new PeerId("localhost", 8081)).isOk());
        assertTrue(this.raftMetaStorage.setTerm(4).isOk());
        assertEquals(new PeerId("localhost", 8081), this.raftMetaStorage.getVotedFor());
        assertTrue(this.raftMetaStorage.setTerm(5).isOk());
        assertEquals(5, this.raftMetaStorage.getTerm());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());
    }

    @Test
    public void testTermNeverGoesBack() {
        assertTrue(this.raftMetaStorage.setTermAndVotedFor(5, new PeerId("localhost", 8081)).isOk());
        assertEquals(RaftError.EINVAL, this.raftMetaStorage.setTerm(3).getRaftError());
        assertEquals(RaftError.EINVAL,
            this.raftMetaStorage.setTermAndVotedFor(4, new PeerId("localhost", 8082)).getRaftError());
        assertEquals(new StableMeta(5, new PeerId("localhost", 8081)), this.raftMetaStorage.getStableMeta());
    }

    @Test
    public void testVotedForCannotBeMutatedByCaller() {
        final PeerId peer = new PeerId("localhost", 8081);
        assertTrue(this.raftMetaStorage.setVotedFor(peer).isOk());
        assertTrue(peer.parse("localhost:9999"));
        assertEquals(new PeerId("localhost", 8081), this.raftMetaStorage.getVotedFor());
    }

    @Test
    public void testTermAndVoteAreReadTogether() throws Exception {
        // every write pairs term N with port 1000 + N
        final int rounds = 10_000;
        final AtomicBoolean done = new AtomicBoolean();
        final AtomicReference<StableMeta> torn = new AtomicReference<>();
        final CountDownLatch started = new CountDownLatch(1);
        final Thread reader = new Thread(() -> {
            started.countDown();
            while (!done.get()) {
                final StableMeta meta = this.raftMetaStorage.getStableMeta();
                if (meta.getTerm() > 0 && meta.getVotedFor().getPort() != 1000 + meta.getTerm()) {
                    torn.compareAndSet(null, meta);
                }
            }
        });
        reader.start();
        started.await();
        for (int i = 1; i <= rounds; i++) {
            assertTrue(this.raftMetaStorage.setTermAndVotedFor(i, new PeerId("localhost", 1000 + i)).isOk());
        }
        done.set(true);
        reader.join(10_000);
        assertNull(torn.get());
    }
}
