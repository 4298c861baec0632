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

import java.io.File;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.StableMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.RaftMetaStorage;
import com.alipay.sofa.raftstore.util.Utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LocalRaftMetaStorageTest {

    @TempDir
    Path                         tempDir;

    private String               path;
    private LocalRaftMetaStorage raftMetaStorage;

    @BeforeEach
    public void setup() {
        this.path = new File(this.tempDir.toFile(), "meta").getAbsolutePath();
        this.raftMetaStorage = newStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
    }

    @AfterEach
    public void teardown() {
        this.raftMetaStorage.shutdown();
    }

    private LocalRaftMetaStorage newStorage() {
        final StorageOptions opts = StorageOptions.defaults();
        opts.setEnableMetrics(true);
        return new LocalRaftMetaStorage(this.path, opts);
    }

    @Test
    public void testEmptyOnFirstInit() {
        assertEquals(0, this.raftMetaStorage.getTerm());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());
    }

    @Test
    public void testGetAndSetSurvivesRestart() {
        assertTrue(this.raftMetaStorage.setTerm(10).isOk());
        assertTrue(this.raftMetaStorage.setVotedFor(new PeerId("localhost", 8081)).isOk());
        assertEquals(10, this.raftMetaStorage.getTerm());
        assertEquals(new PeerId("localhost", 8081), this.raftMetaStorage.getVotedFor());

        this.raftMetaStorage.shutdown();
        this.raftMetaStorage = newStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
        assertEquals(10, this.raftMetaStorage.getTerm());
        assertEquals(new PeerId("localhost", 8081), this.raftMetaStorage.getVotedFor());
    }

    @Test
    public void testSetTermAndVotedFor() {
        assertTrue(this.raftMetaStorage.setTermAndVotedFor(3, new PeerId("localhost", 8082, 1)).isOk());
        final StableMeta meta = this.raftMetaStorage.getStableMeta();
        assertEquals(3, meta.getTerm());
        assertEquals(new PeerId("localhost", 8082, 1), meta.getVotedFor());

        assertTrue(this.raftMetaStorage.setTermAndVotedFor(4, PeerId.emptyPeer()).isOk());
        this.raftMetaStorage.shutdown();
        this.raftMetaStorage = newStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
        assertEquals(4, this.raftMetaStorage.getTerm());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());
    }

    @Test
    public void testNewTermClearsVoteAcrossRestart() {
        assertTrue(this.raftMetaStorage.setTermAndVotedFor(4, new PeerId("localhost", 8081)).isOk());
        assertTrue(this.raftMetaStorage.setTerm(5).isOk());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());

        this.raftMetaStorage.shutdown();
        this.raftMetaStorage = newStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
        assertEquals(5, this.raftMetaStorage.getTerm());
        assertTrue(this.raftMetaStorage.getVotedFor().isEmpty());
    }

    @Test
    public void testTermNeverGoesBack() {
        assertTrue(this.raftMetaStorage.setTermAndVotedFor(5, new PeerId("localhost", 8081)).isOk());
        assertEquals(RaftError.EINVAL, this.raftMetaStorage.setTerm(3).getRaftError());
        assertEquals(RaftError.EINVAL,
            this.raftMetaStorage.setTermAndVotedFor(4, new PeerId("localhost", 8082)).getRaftError());

        this.raftMetaStorage.shutdown();
        this.raftMetaStorage = newStorage();
        assertTrue(this.raftMetaStorage.init().isOk());
        assertEquals(new StableMeta(5, new PeerId("localhost", 8081)), this.raftMetaStorage.getStableMeta());
    }

    @Test
    public void testCorruptedFile() throws Exception {
        this.raftMetaStorage.shutdown();
        FileUtils.writeByteArrayToFile(new File(this.path, "raft_meta"), Utils.getBytes("not a raft meta"));
        this.raftMetaStorage = newStorage();
        assertEquals(RaftError.ECORRUPTED, this.raftMetaStorage.init().getRaftError());
    }

    @Test
    public void testAccessBeforeInit() {
        final LocalRaftMetaStorage storage = newStorage();
        assertThrows(IllegalStateException.class, storage::getTerm);
        assertThrows(IllegalStateException.class, () -> storage.setTerm(1));
    }

    @Test
    public void testPrototype() {
        final LocalRaftMetaStorage prototype = new LocalRaftMetaStorage();
        assertEquals(RaftError.EINVAL, prototype.init().getRaftError());
        assertThrows(IllegalArgumentException.class, () -> prototype.newInstance("local://"));
        final RaftMetaStorage instance = prototype.newInstance("local://" + this.path + "?sync_meta=false");
        assertTrue(instance.init().isOk());
        assertEquals(0, instance.getTerm());
        instance.shutdown();
    }

    @Test
    public void testSaveRecordsLatency() {
        assertTrue(this.raftMetaStorage.setTerm(2).isOk());
        assertEquals(1, this.raftMetaStorage.getMetrics().getMetricRegistry().histogram("save-raft-meta").getCount());
    }
}
