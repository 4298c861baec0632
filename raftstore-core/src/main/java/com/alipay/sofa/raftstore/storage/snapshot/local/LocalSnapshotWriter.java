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
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotWriter;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;

/**
 * Snapshot writer to a temp directory of a {@link LocalSnapshotStorage}.
 * The manifest is guarded by the writer's monitor.
 */
public class LocalSnapshotWriter extends SnapshotWriter {

    private static final Logger          LOG = LoggerFactory.getLogger(LocalSnapshotWriter.class);

    private final LocalSnapshotMetaTable metaTable;
    private final String                 path;
    private final LocalSnapshotStorage   snapshotStorage;
    private final StorageOptions         opts;
    private final FileSystemAdaptor      fs;
    private boolean                      metaSaved;

    public LocalSnapshotWriter(final String path, final LocalSnapshotStorage snapshotStorage,
                               final StorageOptions opts, final FileSystemAdaptor fs) {
        super();
        this.snapshotStorage = snapshotStorage;
        this.path = path;
        this.opts = opts;
        this.fs = fs;
        this.metaTable = new LocalSnapshotMetaTable(opts.isSyncMeta());
    }

    /**
     * Creates the directory, loading the manifest it may already hold.
     */
    public boolean init() {
        if (!this.fs.createDirectory(this.path, this.opts.isCreateParentDirectories())) {
            LOG.error("Fail to create directory {}.", this.path);
            setError(RaftError.EIO, "Fail to create directory %s", this.path);
            return false;
        }
        final String metaPath = this.path + File.separator + JRAFT_SNAPSHOT_META_FILE;
        if (this.fs.pathExists(metaPath)) {
            try {
                if (!this.metaTable.loadFromFile(metaPath)) {
                    setError(RaftError.EIO, "Fail to load meta from %s", metaPath);
                    return false;
                }
            } catch (final IOException e) {
                LOG.error("Fail to load snapshot meta from {}.", metaPath, e);
                setError(RaftError.EIO, "Fail to load snapshot meta from %s", metaPath);
                return false;
            }
        }
        return true;
    }

    public synchronized long getSnapshotIndex() {
        return this.metaTable.hasMeta() ? this.metaTable.getMeta().getLastIncludedIndex() : 0;
    }

    public synchronized boolean hasMeta() {
        return this.metaTable.hasMeta();
    }

    /**
     * Persists the manifest.
     */
    public synchronized boolean sync() throws IOException {
        return this.metaTable.saveToFile(this.path + File.separator + JRAFT_SNAPSHOT_META_FILE);
    }

    LocalSnapshotStorage getSnapshotStorage() {
        return this.snapshotStorage;
    }

    @Override
    public synchronized Status saveMeta(final SnapshotMeta meta) {
        if (this.metaSaved) {
            return new Status(RaftError.EBUSY, "Snapshot meta of %s is already saved", this.path);
        }
        if (meta == null || !meta.isInitialized()) {
            return new Status(RaftError.EINVAL, "Invalid snapshot meta");
        }
        this.metaTable.setMeta(meta);
        this.metaSaved = true;
        return Status.OK();
    }

    @Override
    public synchronized Status addFile(final String fileName, final Message fileMeta) {
        if (StringUtils.isBlank(fileName) || JRAFT_SNAPSHOT_META_FILE.equals(fileName)) {
            return new Status(RaftError.EINVAL, "Invalid snapshot file name '%s'", fileName);
        }
        final LocalFileMeta meta;
        if (fileMeta == null) {
            meta = LocalFileMeta.getDefaultInstance();
        } else if (fileMeta instanceof LocalFileMeta) {
            meta = (LocalFileMeta) fileMeta;
        } else {
            try {
                meta = LocalFileMeta.parseFrom(fileMeta.toByteString());
            } catch (final InvalidProtocolBufferException e) {
                LOG.error("Fail to convert file meta {} of {}.", fileMeta.getDescriptorForType().getFullName(),
                    fileName, e);
                return new Status(RaftError.EINVAL, "Unsupported file meta %s for %s", fileMeta
                    .getDescriptorForType().getFullName(), fileName);
            }
        }
        if (!this.metaTable.addFile(fileName, meta)) {
            return new Status(RaftError.EEXISTS, "File %s already exists in snapshot", fileName);
        }
        return Status.OK();
    }

    @Override
    public synchronized Status removeFile(final String fileName) {
        this.metaTable.removeFile(fileName);
        return Status.OK();
    }

    @Override
    public void close(final boolean keepDataOnError) throws IOException {
        final Status st = this.snapshotStorage.close(this, keepDataOnError);
        if (!st.isOk()) {
            throw new IOException("Fail to close snapshot writer " + this.path + ": " + st);
        }
    }

    @Override
    public String getPath() {
        return this.path;
    }

    @Override
    public synchronized Set<String> listFiles() {
        return this.metaTable.listFiles();
    }

    @Override
    public synchronized LocalFileMeta getFileMeta(final String fileName) {
        return this.metaTable.getFileMeta(fileName);
    }
}
