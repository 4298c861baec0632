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
package com.alipay.sofa.raftstore.storage.snapshot.local;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.io.PosixFileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.Snapshot;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotReader;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotWriter;
import com.alipay.sofa.raftstore.storage.snapshot.ThroughputSnapshotThrottle;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.google.protobuf.StringValue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LocalSnapshotStorageTest {

    @TempDir
    Path                         tempDir;

    private String               path;
    private LocalSnapshotStorage snapshotStorage;

    @BeforeEach
    public void setup() {
        this.path = new File(this.tempDir.toFile(), "snapshot").getAbsolutePath();
        this.snapshotStorage = newStorage();
        assertTrue(this.snapshotStorage.init().isOk());
    }

    @AfterEach
    public void teardown() {
        this.snapshotStorage.shutdown();
    }

    private LocalSnapshotStorage newStorage() {
        final StorageOptions opts = StorageOptions.defaults();
        opts.setSyncMeta(false);
        return new LocalSnapshotStorage(this.path, opts);
    }

    static SnapshotMeta meta(final long index, final long term) {
        return SnapshotMeta.newBuilder() //
            .setLastIncludedIndex(index) //
            .setLastIncludedTerm(term) //
            .addPeers("127.0.0.1:8081") //
            .build();
    }

    static void writeFile(final SnapshotWriter writer, final String name, final String content) throws IOException {
        FileUtils.writeStringToFile(new File(writer.getPath(), name), content, StandardCharsets.UTF_8);
    }

    private void saveSnapshot(final long index, final String... files) throws IOException {
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertNotNull(writer);
        assertTrue(writer.saveMeta(meta(index, 1)).isOk());
        for (final String file : files) {
            writeFile(writer, file, file + "@" + index);
            assertTrue(writer.addFile(file).isOk());
        }
        writer.close();
    }

    private File generationDir(final long index) {
        return new File(this.path, Snapshot.JRAFT_SNAPSHOT_PREFIX + index);
    }

    @Test
    public void testEmptyStorage() {
        assertEquals(0, this.snapshotStorage.getLastSnapshotIndex());
        assertNull(this.snapshotStorage.open());
    }

    @Test
    public void testWriteAndRead() throws Exception {
        saveSnapshot(10, "data", "sub/index");
        assertEquals(10, this.snapshotStorage.getLastSnapshotIndex());
        assertTrue(generationDir(10).isDirectory());
        assertFalse(new File(this.path, "temp").exists());

        final SnapshotReader reader = this.snapshotStorage.open();
        assertNotNull(reader);
        try {
            assertTrue(reader.loadMeta().isOk());
            assertEquals(10, reader.load().getLastIncludedIndex());
            assertEquals(2, reader.listFiles().size());
            assertTrue(reader.listFiles().contains("sub/index"));
            assertEquals("data@10",
                FileUtils.readFileToString(new File(reader.getPath(), "data"), StandardCharsets.UTF_8));
            assertNotNull(reader.getFileMeta("data"));
            assertNull(reader.getFileMeta("missing"));
        } finally {
            assertTrue(this.snapshotStorage.close(reader).isOk());
        }
    }

    @Test
    public void testNewGenerationReplacesOld() throws Exception {
        saveSnapshot(10, "data");
        saveSnapshot(20, "data");
        assertEquals(20, this.snapshotStorage.getLastSnapshotIndex());
        assertFalse(generationDir(10).exists());
        assertTrue(generationDir(20).exists());
    }

    @Test
    public void testOpenReaderKeepsRetiredGeneration() throws Exception {
        saveSnapshot(10, "data");
        final SnapshotReader reader = this.snapshotStorage.open();
        assertEquals(2, this.snapshotStorage.getRefs(10).get());

        saveSnapshot(20, "data");
        assertTrue(generationDir(10).exists());
        assertEquals("data@10", FileUtils.readFileToString(new File(reader.getPath(), "data"),
            StandardCharsets.UTF_8));

        reader.close();
        assertFalse(generationDir(10).exists());
        assertTrue(generationDir(20).exists());
        // closing twice is harmless
        reader.close();
        assertTrue(generationDir(20).exists());
    }

    @Test
    public void testRepublishDoesNotReplaceReadGeneration() throws Exception {
        saveSnapshot(10, "data");
        final SnapshotReader reader = this.snapshotStorage.open();
        assertNotNull(reader);
        saveSnapshot(20, "data");

        final SnapshotWriter writer = this.snapshotStorage.create();
        assertTrue(writer.saveMeta(meta(10, 1)).isOk());
        writeFile(writer, "data", "rewritten@10");
        assertTrue(writer.addFile("data").isOk());
        assertEquals(RaftError.EBUSY, this.snapshotStorage.close(writer).getRaftError());

        assertEquals(20, this.snapshotStorage.getLastSnapshotIndex());
        assertEquals("data@10", FileUtils.readFileToString(new File(reader.getPath(), "data"),
            StandardCharsets.UTF_8));
        assertEquals(1, this.snapshotStorage.getRefs(10).get());
        reader.close();
        assertFalse(generationDir(10).exists());
        assertTrue(generationDir(20).exists());
        assertNotNull(this.snapshotStorage.create());
    }

    @Test
    public void testConcurrentAddFile() throws Exception {
        final SnapshotWriter writer = this.snapshotStorage.create();
        final int threads = 8;
        final int filesPerThread = 100;
        final AtomicInteger duplicatesAccepted = new AtomicInteger();
        final CountDownLatch latch = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            final int id = t;
            new Thread(() -> {
                try {
                    for (int i = 0; i < filesPerThread; i++) {
                        writer.addFile("file-" + id + "-" + i);
                        if (writer.addFile("shared-" + i).isOk()) {
                            duplicatesAccepted.incrementAndGet();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            }).start();
        }
        assertTrue(latch.await(10, TimeUnit.SECONDS));
        assertEquals(filesPerThread, duplicatesAccepted.get());
        assertEquals(threads * filesPerThread + filesPerThread, writer.listFiles().size());
        assertTrue(writer.saveMeta(meta(5, 1)).isOk());
        assertTrue(this.snapshotStorage.close(writer).isOk());
    }

    @Test
    public void testOnlyOneWriter() throws Exception {
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertNotNull(writer);
        assertNull(this.snapshotStorage.create());
        assertTrue(writer.saveMeta(meta(5, 1)).isOk());
        writer.close();
        final SnapshotWriter next = this.snapshotStorage.create();
        assertNotNull(next);
        assertTrue(next.saveMeta(meta(6, 1)).isOk());
        assertTrue(this.snapshotStorage.close(next).isOk());
    }

    @Test
    public void testWriterMisuse() throws Exception {
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertTrue(writer.saveMeta(meta(5, 1)).isOk());
        assertEquals(RaftError.EBUSY, writer.saveMeta(meta(6, 1)).getRaftError());
        assertTrue(writer.addFile("a").isOk());
        assertEquals(RaftError.EEXISTS, writer.addFile("a").getRaftError());
        assertEquals(RaftError.EINVAL, writer.addFile(Snapshot.JRAFT_SNAPSHOT_META_FILE).getRaftError());
        assertTrue(writer.removeFile("a").isOk());
        assertTrue(writer.removeFile("never-added").isOk());
        assertTrue(writer.listFiles().isEmpty());
        writer.close();
    }

    @Test
    public void testCloseWithoutMetaPublishesNothing() throws Exception {
        saveSnapshot(10, "data");
        final SnapshotWriter writer = this.snapshotStorage.create();
        writeFile(writer, "data", "partial");
        assertTrue(writer.addFile("data").isOk());
        assertThrows(IOException.class, writer::close);
        assertEquals(10, this.snapshotStorage.getLastSnapshotIndex());
        assertFalse(new File(this.path, "temp").exists());
    }

    @Test
    public void testFailedWriterKeepsDataOnRequest() throws Exception {
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertTrue(writer.saveMeta(meta(10, 1)).isOk());
        writeFile(writer, "data", "partial");
        writer.setError(RaftError.EIO, "disk is gone");
        assertThrows(IOException.class, () -> writer.close(true));
        assertEquals(0, this.snapshotStorage.getLastSnapshotIndex());
        assertTrue(new File(this.path, "temp/data").exists());
    }

    @Test
    public void testSameIndexIsRejected() throws Exception {
        saveSnapshot(10, "data");
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertTrue(writer.saveMeta(meta(10, 1)).isOk());
        assertEquals(RaftError.EEXISTS, this.snapshotStorage.close(writer).getRaftError());
        assertEquals(10, this.snapshotStorage.getLastSnapshotIndex());
        assertTrue(generationDir(10).exists());
    }

    @Test
    public void testCloseUnknownWriter() throws Exception {
        final LocalSnapshotWriter stranger = new LocalSnapshotWriter(this.path + "/other", this.snapshotStorage,
            StorageOptions.defaults(), PosixFileSystemAdaptor.getInstance());
        assertEquals(RaftError.EINVAL, this.snapshotStorage.close(stranger).getRaftError());
    }

    @Test
    public void testInitKeepsNewestGeneration() throws Exception {
        saveSnapshot(7, "data");
        this.snapshotStorage.shutdown();
        assertTrue(new File(this.path, "snapshot_5").mkdirs());
        assertTrue(new File(this.path, "snapshot_bogus").mkdirs());
        assertTrue(new File(this.path, "temp").mkdirs());

        this.snapshotStorage = newStorage();
        assertTrue(this.snapshotStorage.init().isOk());
        assertEquals(7, this.snapshotStorage.getLastSnapshotIndex());
        assertFalse(new File(this.path, "snapshot_5").exists());
        assertFalse(new File(this.path, "temp").exists());
        assertTrue(new File(this.path, "snapshot_bogus").exists());

        final SnapshotReader reader = this.snapshotStorage.open();
        assertEquals(7, reader.load().getLastIncludedIndex());
        reader.close();
    }

    @Test
    public void testUserFileMetaKeepsCallerType() throws Exception {
        final SnapshotWriter writer = this.snapshotStorage.create();
        assertTrue(writer.saveMeta(meta(3, 1)).isOk());
        writeFile(writer, "data", "x");
        assertTrue(writer.addFile("data", StringValue.of("user-defined")).isOk());
        writeFile(writer, "plain", "y");
        assertTrue(writer.addFile("plain").isOk());
        writer.close();

        final SnapshotReader reader = this.snapshotStorage.open();
        try {
            assertEquals("user-defined", reader.getFileMeta("data", StringValue.getDefaultInstance()).getValue());
            assertEquals(StringValue.getDefaultInstance(), reader.getFileMeta("plain", StringValue.of("ignored")));
            assertEquals(StringValue.getDefaultInstance(), reader.getFileMeta("missing", StringValue.of("x")));
            assertTrue(reader.getFileMeta("plain", LocalFileMeta.getDefaultInstance()) instanceof LocalFileMeta);
        } finally {
            reader.close();
        }
    }

    @Test
    public void testGenerateUriForCopy() throws Exception {
        saveSnapshot(3, "data");
        SnapshotReader reader = this.snapshotStorage.open();
        assertEquals("", reader.generateURIForCopy());
        reader.close();

        this.snapshotStorage.setServerAddr(new Endpoint("127.0.0.1", 8081));
        reader = this.snapshotStorage.open();
        final String uri = reader.generateURIForCopy();
        assertTrue(uri.startsWith("remote://127.0.0.1:8081/"), uri);
        assertEquals(uri, reader.generateURIForCopy());
        reader.close();
        assertEquals("", reader.generateURIForCopy());
    }

    @Test
    public void testHooksAreSupported() {
        assertTrue(this.snapshotStorage.setSnapshotThrottle(new ThroughputSnapshotThrottle(1024, 1)).isOk());
        assertTrue(this.snapshotStorage.setFilterBeforeCopyRemote().isOk());
        assertTrue(this.snapshotStorage.isFilterBeforeCopyRemote());
    }

    @Test
    public void testPrototype() {
        final LocalSnapshotStorage prototype = new LocalSnapshotStorage();
        assertEquals(RaftError.EINVAL, prototype.init().getRaftError());
        final LocalSnapshotStorage instance = (LocalSnapshotStorage) prototype.newInstance("local://" + this.path
                                                                                          + "?filter_before_copy_remote=true");
        assertTrue(instance.isFilterBeforeCopyRemote());
        assertFalse(instance.hasServerAddr());
        assertEquals(this.path, instance.getPath());
    }
}
