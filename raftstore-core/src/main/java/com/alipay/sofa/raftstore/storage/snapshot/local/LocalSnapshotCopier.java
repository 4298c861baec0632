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
import java.util.ArrayDeque;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.FileSource;
import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.SnapshotCopierOptions;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.StorageMetrics;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.Snapshot;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotCopier;
import com.alipay.sofa.raftstore.storage.snapshot.SnapshotReader;
import com.alipay.sofa.raftstore.storage.snapshot.remote.RemoteFileCopier;
import com.alipay.sofa.raftstore.storage.snapshot.remote.Session;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Copy another machine snapshot to local.
 *
 * The job runs on the closure executor: fetch the remote manifest, prepare
 * a writer (optionally reusing files of the temp directory or of the last
 * local snapshot with a matching checksum), pull the missing files, then
 * publish the writer and open the result as a reader. Cancellation is
 * cooperative, the running session is cancelled and no new one starts.
 */
public class LocalSnapshotCopier extends SnapshotCopier {

    private static final Logger          LOG   = LoggerFactory.getLogger(LocalSnapshotCopier.class);

    private final Lock                   lock  = new ReentrantLock();
    private final CountDownLatch         latch = new CountDownLatch(1);
    private final Status                 st    = Status.OK();
    private volatile State               state = State.PENDING;
    private boolean                      cancelled;
    private LocalSnapshotWriter          writer;
    private volatile LocalSnapshotReader reader;
    private boolean                      readerTaken;
    private LocalSnapshotStorage         storage;
    private boolean                      filterBeforeCopyRemote;
    private LocalSnapshot                remoteSnapshot;
    private RemoteFileCopier             copier;
    private Session                      curSession;
    private SnapshotThrottle             snapshotThrottle;
    private FileSystemAdaptor            fs;
    private StorageMetrics               metrics;
    private volatile long                copiedBytes;
    private long                         startMs;

    public void setSnapshotThrottle(final SnapshotThrottle snapshotThrottle) {
        this.snapshotThrottle = snapshotThrottle;
    }

    public LocalSnapshotStorage getStorage() {
        return this.storage;
    }

    public void setStorage(final LocalSnapshotStorage storage) {
        this.storage = storage;
    }

    public boolean isFilterBeforeCopyRemote() {
        return this.filterBeforeCopyRemote;
    }

    public void setFilterBeforeCopyRemote(final boolean filterBeforeCopyRemote) {
        this.filterBeforeCopyRemote = filterBeforeCopyRemote;
    }

    public boolean init(final String uri, final SnapshotCopierOptions opts) {
        if (this.storage == null) {
            LOG.error("Snapshot storage of copier is not set.");
            return false;
        }
        this.fs = this.storage.getFileSystem();
        this.metrics = opts.getMetrics();
        this.copier = new RemoteFileCopier();
        this.copier.setFileSystemAdaptor(this.fs);
        this.cancelled = false;
        this.remoteSnapshot = new LocalSnapshot(opts.getStorageOptions().isSyncMeta());
        return this.copier.init(uri, this.snapshotThrottle, opts);
    }

    @Override
    public void start() {
        this.lock.lock();
        try {
            if (this.state != State.PENDING) {
                LOG.warn("Snapshot copier is already {}.", this.state);
                return;
            }
            this.state = State.RUNNING;
            this.startMs = Utils.monotonicMs();
        } finally {
            this.lock.unlock();
        }
        Utils.runInThread(this::startCopy);
    }

    private void startCopy() {
        try {
            internalCopy();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            setErrorIfOk(RaftError.ECANCELED, "Copy job was interrupted");
        } catch (final IOException e) {
            LOG.error("Fail to copy snapshot.", e);
            setErrorIfOk(RaftError.EIO, "Fail to copy snapshot: %s", e.getMessage());
        } catch (final RuntimeException e) {
            LOG.error("Unexpected error while copying snapshot.", e);
            setErrorIfOk(RaftError.EINTERNAL, "Unexpected error: %s", e.getMessage());
        } finally {
            finish();
        }
    }

    private void internalCopy() throws IOException, InterruptedException {
        // noinspection ConstantConditions
        do {
            loadMetaTable();
            if (!isOk()) {
                break;
            }
            filter();
            if (!isOk()) {
                break;
            }
            final Set<String> files = this.remoteSnapshot.listFiles();
            for (final String file : files) {
                copyFile(file);
                if (!isOk()) {
                    break;
                }
            }
        } while (false);
        if (this.writer != null) {
            if (!isOk() && this.writer.isOk()) {
                final Status cur = status();
                this.writer.setError(cur.getCode(), "%s", cur.getErrorMsg());
            }
            final Status closeSt = this.storage.close(this.writer, false);
            this.writer = null;
            if (!closeSt.isOk()) {
                setErrorIfOk(closeSt.getCode(), "%s", closeSt.getErrorMsg());
            }
        }
        if (isOk()) {
            this.lock.lock();
            try {
                if (this.cancelled) {
                    return;
                }
            } finally {
                this.lock.unlock();
            }
            this.reader = (LocalSnapshotReader) this.storage.open();
            if (this.reader == null) {
                setErrorIfOk(RaftError.EIO, "Fail to open the copied snapshot");
            }
        }
    }

    private void finish() {
        LocalSnapshotReader toClose = null;
        this.lock.lock();
        try {
            if (this.st.isOk()) {
                this.state = State.COMPLETED;
            } else {
                this.state = this.cancelled ? State.CANCELLED : State.FAILED;
                toClose = this.reader;
                this.reader = null;
            }
        } finally {
            this.lock.unlock();
        }
        if (toClose != null) {
            Utils.closeQuietly(toClose);
        }
        if (this.metrics != null) {
            this.metrics.recordLatency("copy-snapshot", Utils.monotonicMs() - this.startMs);
            this.metrics.recordSize("copy-snapshot-bytes", this.copiedBytes);
        }
        LOG.info("Snapshot copy job finished, state={}, status={}, copied {} bytes.", this.state, status(),
            this.copiedBytes);
        this.latch.countDown();
    }

    void copyFile(final String fileName) throws IOException, InterruptedException {
        if (this.writer.getFileMeta(fileName) != null) {
            LOG.info("Skipped downloading {}.", fileName);
            return;
        }
        final String filePath = this.writer.getPath() + File.separator + fileName;
        final LocalFileMeta meta = this.remoteSnapshot.getFileMeta(fileName);
        Session session = null;
        try {
            this.lock.lock();
            try {
                if (this.cancelled) {
                    if (this.st.isOk()) {
                        this.st.setError(RaftError.ECANCELED, "ECANCELED");
                    }
                    return;
                }
                session = this.copier.startCopyToFile(fileName, filePath, null);
                if (session == null) {
                    LOG.error("Fail to copy {}.", fileName);
                    this.st.setError(RaftError.EIO, "Fail to copy %s", fileName);
                    return;
                }
                this.curSession = session;
            } finally {
                this.lock.unlock();
            }
            session.join(); // join out of lock
            this.lock.lock();
            try {
                this.curSession = null;
            } finally {
                this.lock.unlock();
            }
            this.copiedBytes += session.getCopiedBytes();
            final Status sessionSt = session.status();
            if (!sessionSt.isOk()) {
                setErrorIfOk(sessionSt.getCode(), "%s", sessionSt.getErrorMsg());
                return;
            }
            final Status addSt = this.writer.addFile(fileName, meta);
            if (!addSt.isOk()) {
                setErrorIfOk(addSt.getCode(), "Fail to add file to writer: %s", addSt.getErrorMsg());
                return;
            }
            if (!this.writer.sync()) {
                setErrorIfOk(RaftError.EIO, "Fail to sync writer");
            }
        } finally {
            if (session != null) {
                Utils.closeQuietly(session);
            }
        }
    }

    private void loadMetaTable() throws InterruptedException {
        final ByteBufferCollector metaBuf = ByteBufferCollector.allocate(0);
        Session session = null;
        try {
            this.lock.lock();
            try {
                if (this.cancelled) {
                    if (this.st.isOk()) {
                        this.st.setError(RaftError.ECANCELED, "ECANCELED");
                    }
                    return;
                }
                session = this.copier.startCopy2IoBuffer(Snapshot.JRAFT_SNAPSHOT_META_FILE, metaBuf, null);
                this.curSession = session;
            } finally {
                this.lock.unlock();
            }
            session.join(); //join out of lock.
            this.lock.lock();
            try {
                this.curSession = null;
            } finally {
                this.lock.unlock();
            }
            this.copiedBytes += session.getCopiedBytes();
            final Status sessionSt = session.status();
            if (!sessionSt.isOk()) {
                LOG.warn("Fail to copy meta file: {}.", sessionSt);
                setErrorIfOk(sessionSt.getCode(), "%s", sessionSt.getErrorMsg());
                return;
            }
            if (!this.remoteSnapshot.getMetaTable().loadFromIoBufferAsRemote(metaBuf.getBuffer())) {
                LOG.warn("Bad meta_table format.");
                setErrorIfOk(RaftError.ECORRUPTED, "Bad meta_table format from remote");
                return;
            }
            if (!this.remoteSnapshot.getMetaTable().hasMeta()) {
                setErrorIfOk(RaftError.ECORRUPTED, "Remote snapshot has no meta");
            }
        } finally {
            if (session != null) {
                Utils.closeQuietly(session);
            }
        }
    }

    boolean filterBeforeCopy(final LocalSnapshotWriter writer, final SnapshotReader lastSnapshot) throws IOException {
        final Set<String> existingFiles = writer.listFiles();
        final ArrayDeque<String> toRemove = new ArrayDeque<>();
        for (final String file : existingFiles) {
            if (this.remoteSnapshot.getFileMeta(file) == null) {
                toRemove.add(file);
                writer.removeFile(file);
            }
        }

        final Set<String> remoteFiles = this.remoteSnapshot.listFiles();

        for (final String fileName : remoteFiles) {
            final LocalFileMeta remoteMeta = this.remoteSnapshot.getFileMeta(fileName);
            if (!remoteMeta.hasChecksum()) {
                // Re-download file if this file doesn't have checksum
                writer.removeFile(fileName);
                toRemove.add(fileName);
                continue;
            }

            LocalFileMeta localMeta = writer.getFileMeta(fileName);
            if (localMeta != null) {
                if (localMeta.hasChecksum() && localMeta.getChecksum().equals(remoteMeta.getChecksum())) {
                    LOG.info("Keep file={} checksum={} in {}.", fileName, remoteMeta.getChecksum(), writer.getPath());
                    continue;
                }
                // Remove files from writer so that the file is to be copied from
                // remote_snapshot or last_snapshot
                writer.removeFile(fileName);
                toRemove.add(fileName);
            }
            // Try find files in last_snapshot
            if (lastSnapshot == null) {
                continue;
            }
            if ((localMeta = (LocalFileMeta) lastSnapshot.getFileMeta(fileName)) == null) {
                continue;
            }
            if (!localMeta.hasChecksum() || !localMeta.getChecksum().equals(remoteMeta.getChecksum())) {
                continue;
            }

            LOG.info("Found the same file ={} checksum={} in lastSnapshot={}.", fileName, remoteMeta.getChecksum(),
                lastSnapshot.getPath());
            if (localMeta.getSource() == FileSource.FILE_SOURCE_LOCAL) {
                final String sourcePath = lastSnapshot.getPath() + File.separator + fileName;
                final String destPath = writer.getPath() + File.separator + fileName;
                this.fs.deleteFile(destPath, false);
                if (!this.fs.link(sourcePath, destPath)) {
                    LOG.error("Fail to link {} to {}.", sourcePath, destPath);
                    continue;
                }
                // Don't delete linked file
                if (!toRemove.isEmpty() && toRemove.peekLast().equals(fileName)) {
                    toRemove.pollLast();
                }
            }
            // Copy file from last_snapshot
            final Status addSt = writer.addFile(fileName, localMeta);
            if (!addSt.isOk()) {
                LOG.error("Fail to add file {} to writer {}: {}.", fileName, writer.getPath(), addSt);
                return false;
            }
        }
        if (!writer.sync()) {
            LOG.error("Fail to sync writer on path={}.", writer.getPath());
            return false;
        }
        for (final String fileName : toRemove) {
            final String removePath = writer.getPath() + File.separator + fileName;
            if (this.fs.deleteFile(removePath, false)) {
                LOG.info("Deleted file: {}.", removePath);
            } else {
                LOG.warn("Fail to delete file: {}.", removePath);
            }
        }
        return true;
    }

    private void filter() throws IOException {
        this.writer = this.storage.create(!this.filterBeforeCopyRemote);
        if (this.writer == null) {
            setErrorIfOk(RaftError.EBUSY, "Fail to create snapshot writer");
            return;
        }
        if (this.filterBeforeCopyRemote) {
            final SnapshotReader lastSnapshot = this.storage.open();
            try {
                if (!filterBeforeCopy(this.writer, lastSnapshot)) {
                    LOG.warn("Fail to filter writer before copying, destroy and create a new writer.");
                    this.writer.setError(RaftError.EIO, "Fail to filter");
                    this.storage.close(this.writer, false);
                    this.writer = this.storage.create(true);
                }
            } finally {
                if (lastSnapshot != null) {
                    Utils.closeQuietly(lastSnapshot);
                }
            }
            if (this.writer == null) {
                setErrorIfOk(RaftError.EBUSY, "Fail to create snapshot writer");
                return;
            }
        }
        final Status metaSt = this.writer.saveMeta(this.remoteSnapshot.getMetaTable().getMeta());
        if (!metaSt.isOk()) {
            setErrorIfOk(metaSt.getCode(), "%s", metaSt.getErrorMsg());
            return;
        }
        if (!this.writer.sync()) {
            LOG.error("Fail to sync snapshot writer path={}.", this.writer.getPath());
            setErrorIfOk(RaftError.EIO, "Fail to sync snapshot writer");
        }
    }

    private boolean isOk() {
        this.lock.lock();
        try {
            return this.st.isOk();
        } finally {
            this.lock.unlock();
        }
    }

    private void setErrorIfOk(final RaftError error, final String fmt, final Object... args) {
        setErrorIfOk(error.getNumber(), fmt, args);
    }

    private void setErrorIfOk(final int code, final String fmt, final Object... args) {
        this.lock.lock();
        try {
            if (this.st.isOk()) {
                this.st.setError(code, fmt, args);
            }
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public Status status() {
        this.lock.lock();
        try {
            return this.st.copy();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public State getState() {
        return this.state;
    }

    public long getCopiedBytes() {
        return this.copiedBytes;
    }

    @Override
    public void cancel() {
        boolean neverStarted = false;
        this.lock.lock();
        try {
            if (this.cancelled || this.state.isTerminal()) {
                return;
            }
            if (this.st.isOk()) {
                this.st.setError(RaftError.ECANCELED, "Cancel the copier manually.");
            }
            this.cancelled = true;
            if (this.curSession != null) {
                this.curSession.cancel();
            }
            if (this.state == State.PENDING) {
                this.state = State.CANCELLED;
                neverStarted = true;
            }
        } finally {
            this.lock.unlock();
        }
        if (neverStarted) {
            this.latch.countDown();
        }
    }

    @Override
    public void join() throws InterruptedException {
        this.latch.await();
    }

    @Override
    public boolean join(final long timeout, final TimeUnit unit) throws InterruptedException {
        return this.latch.await(timeout, unit);
    }

    @Override
    public SnapshotReader getReader() {
        this.lock.lock();
        try {
            if (this.state != State.COMPLETED) {
                return null;
            }
            this.readerTaken = true;
            return this.reader;
        } finally {
            this.lock.unlock();
        }
    }

    /**
     * Cancels the job if it's running and waits for it. A reader nobody took
     * is released.
     */
    @Override
    public void close() throws IOException {
        cancel();
        try {
            join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while closing snapshot copier", e);
        }
        LocalSnapshotReader toClose = null;
        this.lock.lock();
        try {
            if (!this.readerTaken && this.reader != null) {
                toClose = this.reader;
                this.reader = null;
            }
        } finally {
            this.lock.unlock();
        }
        if (toClose != null) {
            toClose.close();
        }
    }
}
