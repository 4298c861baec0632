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
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.LocalStorageOutter.StablePBMeta;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.StableMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.RaftMetaStorage;
import com.alipay.sofa.raftstore.storage.StorageMetrics;
import com.alipay.sofa.raftstore.storage.io.ProtoBufFile;
import com.alipay.sofa.raftstore.storage.registry.StorageUri;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Raft meta storage kept in a protobuf file under a local directory.
 * Readers see the term and vote of one consistent record; writers are
 * serialized. URI: {@code local://path[?sync_meta=true|false]}.
 */
public class LocalRaftMetaStorage implements RaftMetaStorage {

    private static final Logger  LOG        = LoggerFactory.getLogger(LocalRaftMetaStorage.class);
    private static final String  RAFT_META  = "raft_meta";
    private static final String  PROBE_FILE = "raft_meta.probe";

    private final String         path;
    private final StorageOptions opts;
    private final StorageMetrics metrics;
    private volatile boolean     isInited;
    private volatile StableMeta  meta       = StableMeta.EMPTY;

    /**
     * Creates a prototype for the backend registry.
     */
    public LocalRaftMetaStorage() {
        this(null, StorageOptions.defaults());
    }

    public LocalRaftMetaStorage(final String path, final StorageOptions opts) {
        super();
        this.path = path;
        this.opts = opts;
        this.metrics = new StorageMetrics(opts.isEnableMetrics());
    }

    @Override
    public RaftMetaStorage newInstance(final String uri) {
        final StorageUri parsed = StorageUri.parse(uri);
        if (StringUtils.isBlank(parsed.getPath())) {
            throw new IllegalArgumentException("Missing path in raft meta storage uri: " + uri);
        }
        return new LocalRaftMetaStorage(parsed.getPath(), StorageOptions.defaults().withParams(parsed.getParams()));
    }

    public StorageMetrics getMetrics() {
        return this.metrics;
    }

    @Override
    public synchronized Status init() {
        if (this.isInited) {
            LOG.warn("Raft meta storage is already inited.");
            return Status.OK();
        }
        if (this.path == null) {
            return new Status(RaftError.EINVAL, "LocalRaftMetaStorage prototype can't be initialized");
        }
        final File dir = new File(this.path);
        try {
            if (this.opts.isCreateParentDirectories()) {
                FileUtils.forceMkdir(dir);
            } else if (!dir.isDirectory()) {
                Files.createDirectory(dir.toPath());
            }
        } catch (final IOException e) {
            LOG.error("Fail to mkdir {}", this.path, e);
            return new Status(RaftError.EIO, "Fail to create directory %s", this.path);
        }
        final Status st = probeAtomicMove(dir);
        if (!st.isOk()) {
            return st;
        }
        final Status loaded = load();
        if (loaded.isOk()) {
            this.isInited = true;
        }
        return loaded;
    }

    /**
     * Durable updates rely on renaming a temp file over the record.
     */
    private Status probeAtomicMove(final File dir) {
        final File probe = new File(dir, PROBE_FILE);
        final File target = new File(dir, PROBE_FILE + ".moved");
        try {
            FileUtils.writeByteArrayToFile(probe, Utils.getBytes("probe"));
            Utils.atomicMoveFile(probe, target, false);
            return Status.OK();
        } catch (final AtomicMoveNotSupportedException e) {
            LOG.error("File system of {} doesn't support atomic rename.", this.path, e);
            return new Status(RaftError.ENOTSUP, "Atomic rename is not supported under %s", this.path);
        } catch (final IOException e) {
            LOG.error("Fail to probe atomic rename in {}.", this.path, e);
            return new Status(RaftError.EIO, "Fail to probe atomic rename under %s", this.path);
        } finally {
            FileUtils.deleteQuietly(probe);
            FileUtils.deleteQuietly(target);
        }
    }

    private Status load() {
        final ProtoBufFile pbFile = newPbFile();
        try {
            final StablePBMeta pbMeta = pbFile.load();
            if (pbMeta == null) {
                this.meta = StableMeta.EMPTY;
                return Status.OK();
            }
            final PeerId votedFor = PeerId.emptyPeer();
            if (StringUtils.isNotEmpty(pbMeta.getVotedfor()) && !votedFor.parse(pbMeta.getVotedfor())) {
                LOG.error("Bad votedFor {} in raft meta {}.", pbMeta.getVotedfor(), this.path);
                return new Status(RaftError.ECORRUPTED, "Bad votedFor in raft meta %s", this.path);
            }
            this.meta = new StableMeta(pbMeta.getTerm(), votedFor);
            LOG.info("Loaded raft meta, path={}, term={}, votedFor={}.", this.path, pbMeta.getTerm(), votedFor);
            return Status.OK();
        } catch (final ClassCastException e) {
            LOG.error("Unexpected message in raft meta storage {}.", this.path, e);
            return new Status(RaftError.ECORRUPTED, "Unexpected message in raft meta %s", this.path);
        } catch (final IOException e) {
            LOG.error("Fail to load raft meta storage {}.", this.path, e);
            return new Status(RaftError.ECORRUPTED, "Fail to load raft meta %s: %s", this.path, e.getMessage());
        }
    }

    private ProtoBufFile newPbFile() {
        return new ProtoBufFile(this.path + File.separator + RAFT_META);
    }

    private Status save(final StableMeta newMeta) {
        final long start = Utils.monotonicMs();
        final StablePBMeta pbMeta = StablePBMeta.newBuilder() //
            .setTerm(newMeta.getTerm()) //
            .setVotedfor(newMeta.getVotedFor().toString()) //
            .build();
        final ProtoBufFile pbFile = newPbFile();
        try {
            if (!pbFile.save(pbMeta, this.opts.isSyncMeta())) {
                return new Status(RaftError.EIO, "Fail to save raft meta, path=%s", this.path);
            }
            this.meta = newMeta;
            return Status.OK();
        } catch (final IOException e) {
            LOG.error("Fail to save raft meta, path={}.", this.path, e);
            return new Status(RaftError.EIO, "Fail to save raft meta, path=%s", this.path);
        } finally {
            final long cost = Utils.monotonicMs() - start;
            this.metrics.recordLatency("save-raft-meta", cost);
            LOG.info("Save raft meta, path={}, term={}, votedFor={}, cost time={} ms", this.path, newMeta.getTerm(),
                newMeta.getVotedFor(), cost);
        }
    }

    @Override
    public synchronized void shutdown() {
        this.isInited = false;
    }

    private void checkState() {
        if (!this.isInited) {
            throw new IllegalStateException("LocalRaftMetaStorage not initialized");
        }
    }

    @Override
    public synchronized Status setTerm(final long term) {
        checkState();
        if (term < this.meta.getTerm()) {
            return termBehind(term);
        }
        return save(this.meta.withTerm(term));
    }

    @Override
    public long getTerm() {
        checkState();
        return this.meta.getTerm();
    }

    @Override
    public synchronized Status setVotedFor(final PeerId peerId) {
        checkState();
        return save(this.meta.withVotedFor(peerId));
    }

    @Override
    public PeerId getVotedFor() {
        checkState();
        return this.meta.getVotedFor();
    }

    @Override
    public synchronized Status setTermAndVotedFor(final long term, final PeerId peerId) {
        checkState();
        if (term < this.meta.getTerm()) {
            return termBehind(term);
        }
        return save(new StableMeta(term, peerId));
    }

    private Status termBehind(final long term) {
        LOG.warn("Reject term {} behind current term {}, path={}.", term, this.meta.getTerm(), this.path);
        return new Status(RaftError.EINVAL, "Term %d is behind current term %d", term, this.meta.getTerm());
    }

    @Override
    public StableMeta getStableMeta() {
        checkState();
        return this.meta;
    }

    @Override
    public String toString() {
        return "LocalRaftMetaStorage [path=" + this.path + ", meta=" + this.meta + "]";
    }
}
