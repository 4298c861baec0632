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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.CopyOptions;
import com.alipay.sofa.raftstore.option.SnapshotCopierOptions;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.rpc.LocalFileClientService;
import com.alipay.sofa.raftstore.storage.SnapshotStorage;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.StorageMetrics;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.io.PosixFileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.registry.StorageUri;
import com.alipay.sofa.raftstore.storage.snapshot.Snapshot;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotCopier;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotReader;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotWriter;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.OnlyForTest;
import com.alipay.sofa.raftstore.util.Requires;
import com.alipay.sofa.raftstore.util.TimerManager;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Snapshot storage based on local file storage. Each published snapshot is
 * a {@code snapshot_<index>} directory; writers work in {@code temp}.
 * Generations are reference counted, the newest one holds a reference and
 * so does every open reader.
 * URI: {@code local://path[?addr=ip:port&sync_meta=true&filter_before_copy_remote=false]}.
 */
public class LocalSnapshotStorage implements SnapshotStorage {

    private static final Logger                      LOG                     = LoggerFactory
                                                                                 .getLogger(LocalSnapshotStorage.class);

    public static final String                       ADDR_PARAM              = "addr";
    public static final String                       FILTER_BEFORE_COPY_PARAM = "filter_before_copy_remote";

    private static final String                      TEMP_PATH               = "temp";
    private final ConcurrentMap<Long, AtomicInteger> refMap                  = new ConcurrentHashMap<>();
    private final String                             path;
    private final StorageOptions                     opts;
    private final StorageMetrics                     metrics;
    private volatile Endpoint                        addr;
    private volatile boolean                         filterBeforeCopyRemote;
    private long                                     lastSnapshotIndex;
    private LocalSnapshotWriter                      activeWriter;
    private final Lock                               lock;
    private volatile SnapshotThrottle                snapshotThrottle;
    private volatile FileSystemAdaptor               fs                      = PosixFileSystemAdaptor
                                                                                 .getInstance();
    private volatile SnapshotCopierOptions           copierOptions;

    /**
     * Creates a prototype for the backend registry.
     */
    public LocalSnapshotStorage() {
        this(null, StorageOptions.defaults());
    }

    public LocalSnapshotStorage(final String path, final StorageOptions opts) {
        super();
        this.path = path;
        this.opts = opts;
        this.metrics = new StorageMetrics(opts.isEnableMetrics());
        this.lastSnapshotIndex = 0;
        this.lock = new ReentrantLock();
    }

    @Override
    public SnapshotStorage newInstance(final String uri) {
        final StorageUri parsed = StorageUri.parse(uri);
        if (StringUtils.isBlank(parsed.getPath())) {
            throw new IllegalArgumentException("Missing path in snapshot storage uri: " + uri);
        }
        final LocalSnapshotStorage storage = new LocalSnapshotStorage(parsed.getPath(), StorageOptions.defaults()
            .withParams(parsed.getParams()));
        final String addrStr = parsed.getParam(ADDR_PARAM);
        if (addrStr != null) {
            final Endpoint endpoint = Endpoint.parse(addrStr);
            if (endpoint == null) {
                throw new IllegalArgumentException("Invalid addr '" + addrStr + "' in snapshot storage uri: " + uri);
            }
            storage.setServerAddr(endpoint);
        }
        if (parsed.hasParam(FILTER_BEFORE_COPY_PARAM)
            && StorageOptions.parseBoolean(FILTER_BEFORE_COPY_PARAM, parsed.getParam(FILTER_BEFORE_COPY_PARAM))) {
            storage.setFilterBeforeCopyRemote();
        }
        return storage;
    }

    @Override
    public Status setSnapshotThrottle(final SnapshotThrottle snapshotThrottle) {
        this.snapshotThrottle = snapshotThrottle;
        return Status.OK();
    }

    @Override
    public Status setFileSystemAdaptor(final FileSystemAdaptor fs) {
        this.fs = Requires.requireNonNull(fs, "fs");
        return Status.OK();
    }

    @Override
    public Status setFilterBeforeCopyRemote() {
        this.filterBeforeCopyRemote = true;
        return Status.OK();
    }

    public boolean isFilterBeforeCopyRemote() {
        return this.filterBeforeCopyRemote;
    }

    public boolean hasServerAddr() {
        return this.addr != null;
    }

    /**
     * Sets the address other peers reach this node's snapshots at.
     */
    public void setServerAddr(final Endpoint addr) {
        this.addr = addr;
    }

    public void setCopierOptions(final SnapshotCopierOptions copierOptions) {
        this.copierOptions = copierOptions;
    }

    public String getPath() {
        return this.path;
    }

    public StorageMetrics getMetrics() {
        return this.metrics;
    }

    FileSystemAdaptor getFileSystem() {
        return this.fs;
    }

    SnapshotThrottle getSnapshotThrottle() {
        return this.snapshotThrottle;
    }

    public long getLastSnapshotIndex() {
        this.lock.lock();
        try {
            return this.lastSnapshotIndex;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public Status init() {
        if (this.path == null) {
            return new Status(RaftError.EINVAL, "LocalSnapshotStorage prototype can't be initialized");
        }
        if (!this.fs.createDirectory(this.path, this.opts.isCreateParentDirectories())) {
            LOG.error("Fail to create directory {}.", this.path);
            return new Status(RaftError.EIO, "Fail to create directory %s", this.path);
        }

        // delete temp snapshot
        if (!this.filterBeforeCopyRemote) {
            final String tempSnapshotPath = this.path + File.separator + TEMP_PATH;
            if (this.fs.pathExists(tempSnapshotPath) && !this.fs.deleteFile(tempSnapshotPath, true)) {
                LOG.error("Fail to delete temp snapshot path {}.", tempSnapshotPath);
                return new Status(RaftError.EIO, "Fail to delete temp snapshot path %s", tempSnapshotPath);
            }
        }
        // delete old snapshot
        final List<String> names = this.fs.listDirectory(this.path);
        if (names == null) {
            return new Status(RaftError.EIO, "Fail to list directory %s", this.path);
        }
        final List<Long> snapshots = new ArrayList<>();
        for (final String name : names) {
            if (!name.startsWith(Snapshot.JRAFT_SNAPSHOT_PREFIX)) {
                continue;
            }
            try {
                snapshots.add(Long.parseLong(name.substring(Snapshot.JRAFT_SNAPSHOT_PREFIX.length())));
            } catch (final NumberFormatException e) {
                LOG.warn("Ignore unknown snapshot directory {} in {}.", name, this.path);
            }
        }

        // get last_snapshot_index
        if (!snapshots.isEmpty()) {
            Collections.sort(snapshots);
            final int snapshotCount = snapshots.size();

            for (int i = 0; i < snapshotCount - 1; i++) {
                final long index = snapshots.get(i);
                final String snapshotPath = getSnapshotPath(index);
                if (!destroySnapshot(snapshotPath)) {
                    return new Status(RaftError.EIO, "Fail to destroy snapshot %s", snapshotPath);
                }
            }
            this.lock.lock();
            try {
                this.lastSnapshotIndex = snapshots.get(snapshotCount - 1);
            } finally {
                this.lock.unlock();
            }
            ref(this.lastSnapshotIndex);
        }
        LOG.info("LocalSnapshotStorage {} initialized, last snapshot index {}.", this.path, this.lastSnapshotIndex);
        return Status.OK();
    }

    private String getSnapshotPath(final long index) {
        return this.path + File.separator + Snapshot.JRAFT_SNAPSHOT_PREFIX + index;
    }

    void ref(final long index) {
        final AtomicInteger refs = getRefs(index);
        refs.incrementAndGet();
    }

    private boolean destroySnapshot(final String path) {
        LOG.info("Deleting snapshot {}.", path);
        return this.fs.deleteFile(path, true);
    }

    void unref(final long index) {
        final AtomicInteger refs = getRefs(index);
        if (refs.decrementAndGet() == 0) {
            if (this.refMap.remove(index, refs)) {
                destroySnapshot(getSnapshotPath(index));
            }
        }
    }

    @OnlyForTest
    AtomicInteger getRefs(final long index) {
        AtomicInteger refs = this.refMap.get(index);
        if (refs == null) {
            refs = new AtomicInteger(0);
            final AtomicInteger eRefs = this.refMap.putIfAbsent(index, refs);
            if (eRefs != null) {
                refs = eRefs;
            }
        }
        return refs;
    }

    @Override
    public Status close(final SnapshotWriter writer) {
        return close(writer, false);
    }

    @Override
    public Status close(final SnapshotWriter snapshotWriter, final boolean keepDataOnError) {
        if (!(snapshotWriter instanceof LocalSnapshotWriter)) {
            return new Status(RaftError.EINVAL, "Not a local snapshot writer: %s", snapshotWriter);
        }
        final LocalSnapshotWriter writer = (LocalSnapshotWriter) snapshotWriter;
        this.lock.lock();
        try {
            if (this.activeWriter != writer) {
                return new Status(RaftError.EINVAL, "Snapshot writer %s is not open", writer.getPath());
            }
        } finally {
            this.lock.unlock();
        }
        final Status st = new Status();
        try {
            publish(writer, st);
            if (!st.isOk()) {
                LOG.warn("Snapshot writer {} is not published: {}.", writer.getPath(), st);
                if (!keepDataOnError) {
                    destroySnapshot(writer.getPath());
                }
            }
            return st;
        } finally {
            this.lock.lock();
            try {
                this.activeWriter = null;
            } finally {
                this.lock.unlock();
            }
        }
    }

    private void publish(final LocalSnapshotWriter writer, final Status st) {
        if (!writer.isOk()) {
            st.setError(writer.status().getCode(), "%s", writer.status().getErrorMsg());
            return;
        }
        if (!writer.hasMeta()) {
            st.setError(RaftError.EINVAL, "Snapshot writer %s has no meta", writer.getPath());
            return;
        }
        try {
            if (!writer.sync()) {
                st.setError(RaftError.EIO, "Fail to sync writer %s", writer.getPath());
                return;
            }
        } catch (final IOException e) {
            LOG.error("Fail to sync writer {}.", writer.getPath(), e);
            st.setError(RaftError.EIO, "Fail to sync writer %s", writer.getPath());
            return;
        }
        final long oldIndex = getLastSnapshotIndex();
        final long newIndex = writer.getSnapshotIndex();
        if (oldIndex == newIndex) {
            st.setError(RaftError.EEXISTS, "Snapshot %d already exists", newIndex);
            return;
        }
        // a retired generation with the same index is still read
        final AtomicInteger retiredRefs = this.refMap.get(newIndex);
        if (retiredRefs != null && retiredRefs.get() > 0) {
            LOG.warn("Snapshot {} is still held by {} reader(s), refuse to replace it.", newIndex, retiredRefs.get());
            st.setError(RaftError.EBUSY, "Snapshot %d is still in use by readers", newIndex);
            return;
        }
        // rename temp to new
        final String tempPath = this.path + File.separator + TEMP_PATH;
        final String newPath = getSnapshotPath(newIndex);

        if (!destroySnapshot(newPath)) {
            LOG.warn("Delete new snapshot path failed, path is {}.", newPath);
            st.setError(RaftError.EIO, "Fail to delete %s", newPath);
            return;
        }
        LOG.info("Renaming {} to {}.", tempPath, newPath);
        if (!this.fs.rename(tempPath, newPath)) {
            LOG.error("Renamed temp snapshot failed, from path {} to path {}.", tempPath, newPath);
            st.setError(RaftError.EIO, "Fail to rename %s to %s", tempPath, newPath);
            return;
        }

        ref(newIndex);
        this.lock.lock();
        try {
            Requires.requireTrue(oldIndex == this.lastSnapshotIndex);
            this.lastSnapshotIndex = newIndex;
        } finally {
            this.lock.unlock();
        }
        if (oldIndex > 0) {
            unref(oldIndex);
        }
    }

    @Override
    public void shutdown() {
        // ignore
    }

    @Override
    public SnapshotWriter create() {
        return create(true);
    }

    /**
     * Creates the writer, reusing the temp directory content unless fromEmpty.
     */
    public LocalSnapshotWriter create(final boolean fromEmpty) {
        this.lock.lock();
        try {
            if (this.activeWriter != null) {
                LOG.warn("Snapshot writer {} is in use.", this.activeWriter.getPath());
                return null;
            }
            final String snapshotPath = this.path + File.separator + TEMP_PATH;
            // delete temp
            if (fromEmpty && this.fs.pathExists(snapshotPath) && !destroySnapshot(snapshotPath)) {
                return null;
            }
            final LocalSnapshotWriter writer = new LocalSnapshotWriter(snapshotPath, this, this.opts, this.fs);
            if (!writer.init()) {
                LOG.error("Fail to init snapshot writer, status={}.", writer.status());
                return null;
            }
            this.activeWriter = writer;
            return writer;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public SnapshotReader open() {
        long lsIndex = 0;
        this.lock.lock();
        try {
            if (this.lastSnapshotIndex != 0) {
                lsIndex = this.lastSnapshotIndex;
                ref(lsIndex);
            }
        } finally {
            this.lock.unlock();
        }
        if (lsIndex == 0) {
            LOG.warn("No data for snapshot reader {}.", this.path);
            return null;
        }
        final String snapshotPath = getSnapshotPath(lsIndex);
        final LocalSnapshotReader reader = new LocalSnapshotReader(this, this.snapshotThrottle, this.addr, this.opts,
            this.fs, snapshotPath, lsIndex);
        if (!reader.init()) {
            LOG.error("Fail to init reader for path {}, status={}.", snapshotPath, reader.status());
            unref(lsIndex);
            return null;
        }
        return reader;
    }

    @Override
    public Status close(final SnapshotReader reader) {
        if (reader == null) {
            return new Status(RaftError.EINVAL, "Null snapshot reader");
        }
        try {
            reader.close();
            return Status.OK();
        } catch (final IOException e) {
            LOG.error("Fail to close snapshot reader {}.", reader.getPath(), e);
            return new Status(RaftError.EIO, "Fail to close snapshot reader %s", reader.getPath());
        }
    }

    @Override
    public SnapshotReader copyFrom(final String uri) {
        final SnapshotCopier copier = startToCopyFrom(uri);
        if (copier == null) {
            return null;
        }
        try {
            copier.join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Join on snapshot copier was interrupted.");
            close(copier);
            return null;
        }
        final SnapshotReader reader = copier.getReader();
        close(copier);
        return reader;
    }

    @Override
    public SnapshotCopier startToCopyFrom(final String uri) {
        final LocalSnapshotCopier copier = new LocalSnapshotCopier();
        copier.setStorage(this);
        copier.setSnapshotThrottle(this.snapshotThrottle);
        copier.setFilterBeforeCopyRemote(this.filterBeforeCopyRemote);
        if (!copier.init(uri, getCopierOptions())) {
            LOG.error("Fail to init copier to {}.", uri);
            return null;
        }
        copier.start();
        return copier;
    }

    @Override
    public Status close(final SnapshotCopier copier) {
        if (copier == null) {
            return new Status(RaftError.EINVAL, "Null snapshot copier");
        }
        try {
            copier.close();
            return copier.status();
        } catch (final IOException e) {
            LOG.error("Fail to close snapshot copier.", e);
            return new Status(RaftError.EIO, "Fail to close snapshot copier: %s", e.getMessage());
        }
    }

    private SnapshotCopierOptions getCopierOptions() {
        SnapshotCopierOptions copierOpts = this.copierOptions;
        if (copierOpts == null) {
            copierOpts = new SnapshotCopierOptions(LocalFileClientService.getInstance(), DefaultTimerHolder.TIMER,
                this.opts, new CopyOptions());
        }
        if (copierOpts.getStorageOptions() == null) {
            copierOpts.setStorageOptions(this.opts);
        }
        if (copierOpts.getCopyOptions() == null) {
            copierOpts.setCopyOptions(new CopyOptions());
        }
        if (copierOpts.getTimerManager() == null) {
            copierOpts.setTimerManager(DefaultTimerHolder.TIMER);
        }
        if (copierOpts.getMetrics() == null) {
            copierOpts.setMetrics(this.metrics);
        }
        return copierOpts;
    }

    private static final class DefaultTimerHolder {

        static final TimerManager TIMER = newTimer();

        private static TimerManager newTimer() {
            final TimerManager timer = new TimerManager();
            timer.init(Math.max(1, Utils.cpus() / 2));
            return timer;
        }
    }

    @Override
    public String toString() {
        return "LocalSnapshotStorage{path=" + this.path + ", lastSnapshotIndex=" + this.lastSnapshotIndex + '}';
    }
}
