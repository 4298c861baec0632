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
package com.alipay.sofa.raftstore.storage.snapshot.remote;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.option.CopyOptions;
import com.alipay.sofa.raftstore.option.SnapshotCopierOptions;
import com.alipay.sofa.raftstore.rpc.FileClientService;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.io.FileAdaptor;
import com.alipay.sofa.raftstore.storage.io.FileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.io.PosixFileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.Snapshot;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.OnlyForTest;
import com.alipay.sofa.raftstore.util.TimerManager;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Copies files of the snapshot a {@code remote://ip:port/readerId} uri
 * points at.
 */
public class RemoteFileCopier {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteFileCopier.class);

    private long                readId;
    private FileClientService   fileClientService;
    private Endpoint            endpoint;
    private int                 maxByteCountPerRpc;
    private TimerManager        timerManager;
    private SnapshotThrottle    snapshotThrottle;
    private FileSystemAdaptor   fs = PosixFileSystemAdaptor.getInstance();
    private CopyOptions         copyOptions;

    @OnlyForTest
    long getReaderId() {
        return this.readId;
    }

    @OnlyForTest
    Endpoint getEndpoint() {
        return this.endpoint;
    }

    public void setFileSystemAdaptor(final FileSystemAdaptor fs) {
        this.fs = fs;
    }

    public boolean init(String uri, final SnapshotThrottle snapshotThrottle, final SnapshotCopierOptions opts) {
        this.fileClientService = opts.getFileClientService();
        this.timerManager = opts.getTimerManager();
        this.maxByteCountPerRpc = opts.getStorageOptions().getMaxByteCountPerRpc();
        this.copyOptions = opts.getCopyOptions();
        this.snapshotThrottle = snapshotThrottle;

        final int prefixSize = Snapshot.REMOTE_SNAPSHOT_URI_SCHEME.length();
        if (uri == null || !uri.startsWith(Snapshot.REMOTE_SNAPSHOT_URI_SCHEME)) {
            LOG.error("Invalid uri {}.", uri);
            return false;
        }
        uri = uri.substring(prefixSize);
        final int slasPos = uri.indexOf('/');
        if (slasPos <= 0) {
            LOG.error("Invalid uri {}, missing reader id.", uri);
            return false;
        }
        final String ipAndPort = uri.substring(0, slasPos);
        uri = uri.substring(slasPos + 1);

        try {
            this.readId = Long.parseLong(uri);
        } catch (final NumberFormatException e) {
            LOG.error("Fail to parse readerId {}.", uri, e);
            return false;
        }
        this.endpoint = Endpoint.parse(ipAndPort);
        if (this.endpoint == null) {
            LOG.error("Fail to parse endpoint {}.", ipAndPort);
            return false;
        }
        if (!this.fileClientService.connect(this.endpoint)) {
            LOG.error("Fail to init channel to {}.", this.endpoint);
            return false;
        }
        return true;
    }

    /**
     * Copy `source` from remote to local dest.
     *
     * @param source   source from remote
     * @param destPath local path
     * @param opts     options of copy
     * @return true if copy success
     */
    public boolean copyToFile(final String source, final String destPath, final CopyOptions opts) throws IOException,
                                                                                                 InterruptedException {
        final Session session = startCopyToFile(source, destPath, opts);
        if (session == null) {
            return false;
        }
        try {
            session.join();
            return session.status().isOk();
        } finally {
            Utils.closeQuietly(session);
        }
    }

    public Session startCopyToFile(final String source, final String destPath, final CopyOptions opts)
                                                                                                      throws IOException {
        if (this.fs.pathExists(destPath) && !this.fs.deleteFile(destPath, false)) {
            LOG.error("Fail to delete destPath: {}.", destPath);
            return null;
        }
        final File parent = new File(destPath).getParentFile();
        if (parent != null && !this.fs.createDirectory(parent.getPath(), true)) {
            LOG.error("Fail to create directory for {}.", destPath);
            return null;
        }
        final FileAdaptor out = this.fs.open(destPath, true, true);
        final CopySession session = newCopySession(source);
        session.setOutputFile(out);
        session.setDestPath(destPath);
        session.setDestBuf(null);
        session.setCopyOptions(opts != null ? opts : this.copyOptions);
        session.sendNextRpc();
        return session;
    }

    private CopySession newCopySession(final String source) {
        final GetFileRequest.Builder reqBuilder = GetFileRequest.newBuilder() //
            .setFilename(source) //
            .setReaderId(this.readId);
        final CopySession session = new CopySession(this.fileClientService, this.timerManager, this.snapshotThrottle,
            this.maxByteCountPerRpc, reqBuilder, this.endpoint);
        if (this.copyOptions != null) {
            session.setCopyOptions(this.copyOptions);
        }
        return session;
    }

    /**
     * Copy `source` from remote to buffer.
     *
     * @param source  source from remote
     * @param destBuf buffer of dest
     * @param opt     options of copy
     * @return true if copy success
     */
    public boolean copy2IoBuffer(final String source, final ByteBufferCollector destBuf, final CopyOptions opt)
                                                                                                               throws InterruptedException {
        final Session session = startCopy2IoBuffer(source, destBuf, opt);
        try {
            session.join();
            return session.status().isOk();
        } finally {
            Utils.closeQuietly(session);
        }
    }

    public Session startCopy2IoBuffer(final String source, final ByteBufferCollector destBuf, final CopyOptions opts) {
        final CopySession session = newCopySession(source);
        session.setOutputFile(null);
        session.setDestBuf(destBuf);
        if (opts != null) {
            session.setCopyOptions(opts);
        }
        session.sendNextRpc();
        return session;
    }
}
