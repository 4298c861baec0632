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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.entity.LocalStorageOutter.LocalSnapshotPbMeta;
import com.alipay.sofa.raftstore.entity.LocalStorageOutter.LocalSnapshotPbMeta.File;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.alipay.sofa.raftstore.storage.io.ProtoBufFile;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;

/**
 * Table to keep local snapshot metadata infos: the raft meta and the
 * per-file metadata, in insertion order.
 */
public class LocalSnapshotMetaTable {

    private static final Logger              LOG = LoggerFactory.getLogger(LocalSnapshotMetaTable.class);

    private final Map<String, LocalFileMeta> fileMap;
    private final boolean                    syncMeta;
    private SnapshotMeta                     meta;

    public LocalSnapshotMetaTable(final boolean syncMeta) {
        super();
        this.fileMap = new LinkedHashMap<>();
        this.syncMeta = syncMeta;
    }

    private LocalSnapshotPbMeta toPbMeta() {
        final LocalSnapshotPbMeta.Builder pbMetaBuilder = LocalSnapshotPbMeta.newBuilder();
        if (hasMeta()) {
            pbMetaBuilder.setMeta(this.meta);
        }
        for (final Map.Entry<String, LocalFileMeta> entry : this.fileMap.entrySet()) {
            final File.Builder fb = File.newBuilder() //
                .setName(entry.getKey()) //
                .setMeta(entry.getValue());
            pbMetaBuilder.addFiles(fb.build());
        }
        return pbMetaBuilder.build();
    }

    /**
     * Save metadata infos into byte buffer.
     */
    public synchronized ByteBuffer saveToByteBufferAsRemote() {
        return ByteBuffer.wrap(toPbMeta().toByteArray());
    }

    /**
     * Load metadata infos from byte buffer.
     */
    public synchronized boolean loadFromIoBufferAsRemote(final ByteBuffer buf) {
        if (buf == null) {
            LOG.error("Null buf to load.");
            return false;
        }
        try {
            final LocalSnapshotPbMeta pbMeta = LocalSnapshotPbMeta.parseFrom(ByteString.copyFrom(buf));
            return loadFromPbMeta(pbMeta);
        } catch (final InvalidProtocolBufferException e) {
            LOG.error("Fail to parse LocalSnapshotPbMeta from byte buffer", e);
            return false;
        }
    }

    /**
     * Adds a file metadata.
     */
    public synchronized boolean addFile(final String fileName, final LocalFileMeta meta) {
        return this.fileMap.putIfAbsent(fileName, meta) == null;
    }

    /**
     * Removes a file metadata.
     */
    public synchronized boolean removeFile(final String fileName) {
        return this.fileMap.remove(fileName) != null;
    }

    /**
     * Save metadata infos into file by path.
     */
    public boolean saveToFile(final String path) throws IOException {
        final LocalSnapshotPbMeta pbMeta;
        synchronized (this) {
            pbMeta = toPbMeta();
        }
        final ProtoBufFile pbFile = new ProtoBufFile(path);
        return pbFile.save(pbMeta, this.syncMeta);
    }

    /**
     * Returns true when has the snapshot metadata.
     */
    public synchronized boolean hasMeta() {
        return this.meta != null && this.meta.isInitialized();
    }

    /**
     * Get the file metadata by fileName, returns null when not found.
     */
    public synchronized LocalFileMeta getFileMeta(final String fileName) {
        return this.fileMap.get(fileName);
    }

    /**
     * Get all fileNames in this table.
     */
    public synchronized Set<String> listFiles() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(this.fileMap.keySet()));
    }

    public synchronized void setMeta(final SnapshotMeta meta) {
        this.meta = meta;
    }

    public synchronized SnapshotMeta getMeta() {
        return this.meta;
    }

    /**
     * Load metadata infos from a file by path.
     */
    public boolean loadFromFile(final String path) throws IOException {
        final ProtoBufFile pbFile = new ProtoBufFile(path);
        final LocalSnapshotPbMeta pbMeta = pbFile.load();
        if (pbMeta == null) {
            LOG.error("Fail to load meta from {}.", path);
            return false;
        }
        return loadFromPbMeta(pbMeta);
    }

    private synchronized boolean loadFromPbMeta(final LocalSnapshotPbMeta pbMeta) {
        if (pbMeta.hasMeta()) {
            this.meta = pbMeta.getMeta();
        } else {
            this.meta = null;
        }
        this.fileMap.clear();
        for (final File f : pbMeta.getFilesList()) {
            this.fileMap.put(f.getName(), f.getMeta());
        }
        return true;
    }
}
