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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.FileService;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotReader;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.OnlyForTest;

/**
 * Snapshot reader on a published local snapshot. It holds a reference on
 * its generation until closed.
 */
public class LocalSnapshotReader extends SnapshotReader {

    private static final Logger          LOG = LoggerFactory.getLogger(LocalSnapshotReader.class);

    /** Generated reader id*/
    private long                         readerId;
    /** remote peer addr */
    private final Endpoint               addr;
    private final LocalSnapshotMetaTable metaTable;
    private final String                 path;
    private final long                   snapshotIndex;
    private final LocalSnapshotStorage   snapshotStorage;
    private final SnapshotThrottle       snapshotThrottle;
    private final FileSystemAdaptor      fs;
    private boolean                      closed;

    public LocalSnapshotReader(final LocalSnapshotStorage snapshotStorage, final SnapshotThrottle snapshotThrottle,
                               final Endpoint addr, final StorageOptions opts, final FileSystemAdaptor fs,
                               final String path, final long snapshotIndex) {
        super();
        this.snapshotStorage = snapshotStorage;
        this.snapshotThrottle = snapshotThrottle;
        this.addr = addr;
        this.path = path;
        this.snapshotIndex = snapshotIndex;
        this.fs = fs;
        this.readerId = 0;
        this.metaTable = new LocalSnapshotMetaTable(opts.isSyncMeta());
    }

    @OnlyForTest
    long getReaderId() {
        return this.readerId;
    }

    public long getSnapshotIndex() {
        return this.snapshotIndex;
    }

    public boolean init() {
        if (!this.fs.directoryExists(this.path)) {
            LOG.error("No such path {} for snapshot reader.", this.path);
            setError(RaftError.ENOENT, "No such path %s for snapshot reader", this.path);
            return false;
        }
        final String metaPath = this.path + File.separator + JRAFT_SNAPSHOT_META_FILE;
        try {
            if (!this.metaTable.loadFromFile(metaPath)) {
                setError(RaftError.ENOENT, "No snapshot meta in %s", this.path);
                return false;
            }
            return true;
        } catch (final IOException e) {
            LOG.error("Fail to load snapshot meta {}.", metaPath, e);
            setError(RaftError.EIO, "Fail to load snapshot meta from path %s", metaPath);
            return false;
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (this) {
            if (this.closed) {
                return;
            }
            this.closed = true;
            destroyReaderInFileService();
        }
        this.snapshotStorage.unref(this.snapshotIndex);
    }

    @Override
    public SnapshotMeta load() {
        if (this.metaTable.hasMeta()) {
            return this.metaTable.getMeta();
        }
        return null;
    }

    @Override
    public synchronized String generateURIForCopy() {
        if (this.closed) {
            LOG.error("Snapshot reader {} is closed.", this.path);
            return "";
        }
        if (this.addr == null || this.addr.isAny()) {
            LOG.error("Address is not specified");
            return "";
        }
        if (this.readerId == 0) {
            final SnapshotFileReader reader = new SnapshotFileReader(this.path, this.snapshotThrottle, this.fs);
            reader.setMetaTable(this.metaTable);
            if (!reader.open()) {
                LOG.error("Open snapshot {} failed.", this.path);
                return "";
            }
            this.readerId = FileService.getInstance().addReader(reader);
            if (this.readerId < 0) {
                LOG.error("Fail to add reader to file_service.");
                this.readerId = 0;
                return "";
            }
        }

        return String.format(REMOTE_SNAPSHOT_URI_SCHEME + "%s/%d", this.addr.toString(), this.readerId);
    }

    private void destroyReaderInFileService() {
        if (this.readerId > 0) {
            FileService.getInstance().removeReader(this.readerId);
            this.readerId = 0;
        } else {
            if (this.readerId != 0) {
                LOG.warn("Ignore destroy invalid readerId: {}", this.readerId);
            }
        }
    }

    @Override
    public String getPath() {
        return this.path;
    }

    @Override
    public Set<String> listFiles() {
        return this.metaTable.listFiles();
    }

    @Override
    public LocalFileMeta getFileMeta(final String fileName) {
        return this.metaTable.getFileMeta(fileName);
    }
}
