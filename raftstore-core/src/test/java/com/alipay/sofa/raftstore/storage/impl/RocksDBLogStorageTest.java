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
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.TestUtils;
import com.alipay.sofa.raftstore.conf.ConfigurationEntry;
import com.alipay.sofa.raftstore.conf.ConfigurationManager;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.codec.v1.LogEntryV1CodecFactory;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.LogStorage;
import com.alipay.sofa.raftstore.util.Utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RocksDBLogStorageTest extends BaseLogStorageTest {

    @TempDir
    Path   tempDir;

    String path;

    @Override
    protected LogStorage newLogStorage() {
        this.path = new File(this.tempDir.toFile(), "log").getAbsolutePath();
        return newStorage();
    }

    private RocksDBLogStorage newStorage() {
        final StorageOptions opts = StorageOptions.defaults();
        opts.setSync(false);
        opts.setEnableMetrics(true);
        return new RocksDBLogStorage(this.path, opts);
    }

    private Status restart(final ConfigurationManager manager) {
        this.logStorage.shutdown();
        this.logStorage = newStorage();
        return this.logStorage.init(manager);
    }

    @Test
    public void testEntriesSurviveRestart() {
        assertEquals(10, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 10)));
        assertTrue(restart(new ConfigurationManager()).isOk());
        assertEquals(1, this.logStorage.getFirstLogIndex());
        assertEquals(10, this.logStorage.getLastLogIndex());
        for (int i = 1; i <= 10; i++) {
            assertEquals("hello" + i, TestUtils.dataOf(this.logStorage.getEntry(i)));
        }
    }

    @Test
    public void testTruncatePrefixSurvivesRestart() {
        assertEquals(10, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 10)));
        assertTrue(this.logStorage.truncatePrefix(6).isOk());
        assertTrue(restart(new ConfigurationManager()).isOk());
        assertEquals(6, this.logStorage.getFirstLogIndex());
        assertEquals(10, this.logStorage.getLastLogIndex());
        assertNull(this.logStorage.getEntry(5));
    }

    @Test
    public void testTruncatePrefixOfWholeLogSurvivesRestart() {
        assertEquals(3, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 3)));
        assertTrue(this.logStorage.truncatePrefix(50).isOk());
        assertTrue(restart(new ConfigurationManager()).isOk());
        assertEquals(50, this.logStorage.getFirstLogIndex());
        assertEquals(49, this.logStorage.getLastLogIndex());
    }

    @Test
    public void testResetSurvivesRestart() {
        assertEquals(10, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 10)));
        assertTrue(this.logStorage.reset(200).isOk());
        assertTrue(restart(new ConfigurationManager()).isOk());
        assertEquals(200, this.logStorage.getFirstLogIndex());
        assertEquals(199, this.logStorage.getLastLogIndex());
        assertTrue(this.logStorage.appendEntry(TestUtils.mockEntry(200, 3)).isOk());
        assertTrue(restart(new ConfigurationManager()).isOk());
        assertEquals(200, this.logStorage.getLastLogIndex());
        assertEquals(3, this.logStorage.getTerm(200));
    }

    @Test
    public void testConfigurationReplayedOnInit() {
        assertTrue(this.logStorage.appendEntry(TestUtils.mockConfEntry(1, 1, "127.0.0.1:8081")).isOk());
        assertTrue(this.logStorage.appendEntry(TestUtils.mockEntry(2, 1)).isOk());
        assertTrue(this.logStorage.appendEntry(
            TestUtils.mockConfEntry(3, 1, "127.0.0.1:8081", "127.0.0.1:8082", "127.0.0.1:8083")).isOk());
        assertTrue(this.logStorage.appendEntry(TestUtils.mockEntry(4, 1)).isOk());

        final ConfigurationManager manager = new ConfigurationManager();
        assertTrue(restart(manager).isOk());
        assertEquals(2, manager.size());
        final ConfigurationEntry last = manager.getLastConfiguration();
        assertEquals(3, last.getId().getIndex());
        assertEquals(3, last.getConf().size());
        assertTrue(last.contains(PeerId.parsePeer("127.0.0.1:8082")));
        assertEquals(1, manager.get(2).getId().getIndex());
    }

    @Test
    public void testTruncatedConfigurationIsNotReplayed() {
        assertTrue(this.logStorage.appendEntry(TestUtils.mockConfEntry(1, 1, "127.0.0.1:8081")).isOk());
        assertTrue(this.logStorage.appendEntry(TestUtils.mockEntry(2, 1)).isOk());
        assertTrue(this.logStorage.truncatePrefix(2).isOk());

        final ConfigurationManager manager = new ConfigurationManager();
        assertTrue(restart(manager).isOk());
        assertEquals(0, manager.size());
    }

    @Test
    public void testChecksumMismatchDetectedOnInit() {
        assertTrue(this.logStorage.appendEntry(TestUtils.mockEntry(1, 1)).isOk());
        final LogEntry bad = TestUtils.mockEntry(2, 1);
        bad.setChecksum(bad.checksum() + 1);
        assertTrue(this.logStorage.appendEntry(bad).isOk());

        final Status st = restart(new ConfigurationManager());
        assertFalse(st.isOk());
        assertEquals(RaftError.ECORRUPTED, st.getRaftError());
    }

    @Test
    public void testGoodChecksumAccepted() {
        final LogEntry entry = TestUtils.mockEntry(1, 1);
        entry.setChecksum(entry.checksum());
        assertTrue(this.logStorage.appendEntry(entry).isOk());
        assertTrue(restart(new ConfigurationManager()).isOk());
        final LogEntry loaded = this.logStorage.getEntry(1);
        assertTrue(loaded.hasChecksum());
        assertFalse(loaded.isCorrupted());
    }

    @Test
    public void testGapDetectedOnInit() throws Exception {
        assertEquals(5, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 5)));
        this.logStorage.shutdown();
        tamper((db, handle) -> db.delete(handle, keyOf(3)));

        this.logStorage = newStorage();
        final Status st = this.logStorage.init(new ConfigurationManager());
        assertEquals(RaftError.ECORRUPTED, st.getRaftError());
    }

    @Test
    public void testUndecodableEntryDetectedOnInit() throws Exception {
        assertEquals(5, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 5)));
        this.logStorage.shutdown();
        tamper((db, handle) -> db.put(handle, keyOf(4), Utils.getBytes("garbage")));

        this.logStorage = newStorage();
        final Status st = this.logStorage.init(new ConfigurationManager());
        assertEquals(RaftError.ECORRUPTED, st.getRaftError());
    }

    @Test
    public void testIndexMismatchDetectedOnInit() throws Exception {
        assertEquals(5, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 5)));
        this.logStorage.shutdown();
        final byte[] encoded = LogEntryV1CodecFactory.getInstance().encoder().encode(TestUtils.mockEntry(9, 1));
        tamper((db, handle) -> db.put(handle, keyOf(2), encoded));

        this.logStorage = newStorage();
        assertEquals(RaftError.ECORRUPTED, this.logStorage.init(new ConfigurationManager()).getRaftError());
    }

    @Test
    public void testPathIsRegularFile() throws Exception {
        this.logStorage.shutdown();
        final File file = new File(this.tempDir.toFile(), "file");
        assertTrue(file.createNewFile());
        this.logStorage = new RocksDBLogStorage(file.getAbsolutePath(), StorageOptions.defaults());
        assertEquals(RaftError.EIO, this.logStorage.init(new ConfigurationManager()).getRaftError());
    }

    @Test
    public void testPrototype() {
        final RocksDBLogStorage prototype = new RocksDBLogStorage();
        assertEquals(RaftError.EINVAL, prototype.init(new ConfigurationManager()).getRaftError());
        assertThrows(IllegalArgumentException.class, () -> prototype.newInstance("rocksdb://"));

        final LogStorage instance = prototype.newInstance("rocksdb://" + this.path + "2?sync=false");
        assertTrue(instance instanceof RocksDBLogStorage);
        assertEquals(this.path + "2", ((RocksDBLogStorage) instance).getPath());
    }

    @Test
    public void testMetrics() {
        assertEquals(10, this.logStorage.appendEntries(TestUtils.mockEntries(1, 1, 10)));
        assertTrue(this.logStorage.truncatePrefix(3).isOk());
        final RocksDBLogStorage storage = (RocksDBLogStorage) this.logStorage;
        assertNotNull(storage.getMetrics().getMetrics().get("append-logs"));
        assertEquals(10, storage.getMetrics().getMetricRegistry().counter("append-logs-count").getCount());
        assertNotNull(storage.getMetrics().getMetrics().get("truncate-log-prefix"));
    }

    private interface DbAction {

        void apply(RocksDB db, ColumnFamilyHandle defaultHandle) throws Exception;
    }

    private static byte[] keyOf(final long index) {
        return new RocksDBLogStorage().getKeyBytes(index);
    }

    private void tamper(final DbAction action) throws Exception {
        final List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDBLogStorage.CONF_CF_NAME));
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
        final List<ColumnFamilyHandle> handles = new ArrayList<>();
        try (final DBOptions options = new DBOptions().setCreateIfMissing(true);
                final RocksDB db = RocksDB.open(options, this.path, descriptors, handles)) {
            try {
                action.apply(db, handles.get(1));
            } finally {
                for (final ColumnFamilyHandle handle : handles) {
                    handle.close();
                }
            }
        }
    }
}
