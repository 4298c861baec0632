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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.CopyOptions;
import com.alipay.sofa.raftstore.rpc.FileClientService;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.rpc.RpcResponseClosureAdapter;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.io.FileAdaptor;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.OnlyForTest;
import com.alipay.sofa.raftstore.util.Requires;
import com.alipay.sofa.raftstore.util.TimerManager;
import com.alipay.sofa.raftstore.util.Utils;
import com.google.protobuf.Message;

/**
 * Pulls one remote file chunk by chunk through a {@link FileClientService},
 * into a local file or into a buffer.
 *
 * Failed chunks are retried after {@link CopyOptions#getRetryIntervalMs()};
 * EAGAIN never counts against {@link CopyOptions#getMaxRetry()}.
 */
@ThreadSafe
public class CopySession implements Session {

    private static final Logger          LOG         = LoggerFactory.getLogger(CopySession.class);

    private final Lock                   lock        = new ReentrantLock();
    private final Status                 st          = Status.OK();
    private final CountDownLatch         finishLatch = new CountDownLatch(1);
    private final GetFileResponseClosure done        = new GetFileResponseClosure();
    private final FileClientService      fileClientService;
    private final GetFileRequest.Builder requestBuilder;
    private final Endpoint               endpoint;
    private final TimerManager           timerManager;
    private final SnapshotThrottle       snapshotThrottle;
    private final int                    maxByteCountPerRpc;
    private int                          retryTimes  = 0;
    private boolean                      finished;
    private ByteBufferCollector          destBuf;
    private CopyOptions                  copyOptions = new CopyOptions();
    private FileAdaptor                  outputFile;
    private long                         fileOffset;
    private long                         copiedBytes;
    private ScheduledFuture<?>           timer;
    private String                       destPath;
    private Future<Message>              rpcCall;

    private class GetFileResponseClosure extends RpcResponseClosureAdapter<GetFileResponse> {

        @Override
        public void run(final Status status) {
            onRpcReturned(status, getResponse());
        }
    }

    public CopySession(final FileClientService fileClientService, final TimerManager timerManager,
                       final SnapshotThrottle snapshotThrottle, final int maxByteCountPerRpc,
                       final GetFileRequest.Builder rb, final Endpoint ep) {
        super();
        this.snapshotThrottle = snapshotThrottle;
        this.maxByteCountPerRpc = maxByteCountPerRpc;
        this.timerManager = timerManager;
        this.fileClientService = fileClientService;
        this.requestBuilder = rb;
        this.endpoint = ep;
    }

    public void setDestPath(final String destPath) {
        this.destPath = destPath;
    }

    public void setDestBuf(final ByteBufferCollector bufRef) {
        this.destBuf = bufRef;
    }

    public void setCopyOptions(final CopyOptions copyOptions) {
        this.copyOptions = copyOptions;
    }

    public void setOutputFile(final FileAdaptor outputFile) {
        this.outputFile = outputFile;
    }

    @OnlyForTest
    GetFileResponseClosure getDone() {
        return this.done;
    }

    @OnlyForTest
    ScheduledFuture<?> getTimer() {
        return this.timer;
    }

    @OnlyForTest
    int getRetryTimes() {
        this.lock.lock();
        try {
            return this.retryTimes;
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        this.lock.lock();
        try {
            if (!this.finished) {
                Utils.closeQuietly(this.outputFile);
                this.outputFile = null;
            }
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void cancel() {
        this.lock.lock();
        try {
            if (this.finished) {
                return;
            }
            if (this.timer != null) {
                this.timer.cancel(true);
            }
            if (this.rpcCall != null) {
                this.rpcCall.cancel(true);
            }
            if (this.st.isOk()) {
                this.st.setError(RaftError.ECANCELED, RaftError.ECANCELED.name());
            }
            onFinished();
        } finally {
            this.lock.unlock();
        }
    }

    @Override
    public void join() throws InterruptedException {
        this.finishLatch.await();
    }

    @Override
    public boolean join(final long timeout, final TimeUnit unit) throws InterruptedException {
        return this.finishLatch.await(timeout, unit);
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
    public long getCopiedBytes() {
        this.lock.lock();
        try {
            return this.copiedBytes;
        } finally {
            this.lock.unlock();
        }
    }

    private void onFinished() {
        if (!this.finished) {
            if (!this.st.isOk()) {
                LOG.error("Fail to copy data, readerId={} fileName={} offset={} status={}.",
                    this.requestBuilder.getReaderId(), this.requestBuilder.getFilename(),
                    this.requestBuilder.getOffset(), this.st);
            }
            if (this.outputFile != null) {
                try {
                    if (this.st.isOk()) {
                        this.outputFile.sync();
                    }
                } catch (final IOException e) {
                    LOG.error("Fail to sync file {}.", this.destPath, e);
                    this.st.setError(RaftError.EIO, "Fail to sync file %s", this.destPath);
                } finally {
                    Utils.closeQuietly(this.outputFile);
                    this.outputFile = null;
                }
            }
            if (this.destBuf != null) {
                final ByteBuffer buf = this.destBuf.getBuffer();
                if (buf != null) {
                    buf.flip();
                }
                this.destBuf = null;
            }
            this.finished = true;
            this.finishLatch.countDown();
        }
    }

    private void onTimer() {
        Utils.runInThread(this::sendNextRpc);
    }

    void onRpcReturned(final Status status, final GetFileResponse response) {
        this.lock.lock();
        try {
            if (this.finished) {
                return;
            }
            if (!status.isOk()) {
                this.requestBuilder.setCount(0);
                if (status.getCode() == RaftError.ECANCELED.getNumber()) {
                    this.st.setError(status.getCode(), "%s", status.getErrorMsg());
                    onFinished();
                    return;
                }
                // EAGAIN means throttled on the server side, retry without counting.
                if (status.getCode() != RaftError.EAGAIN.getNumber()
                    && ++this.retryTimes >= this.copyOptions.getMaxRetry()) {
                    this.st.setError(status.getCode(), "%s", status.getErrorMsg());
                    onFinished();
                    return;
                }
                LOG.warn("Fail to get file {} from {}: {}, retry in {} ms.", this.requestBuilder.getFilename(),
                    this.endpoint, status, this.copyOptions.getRetryIntervalMs());
                this.timer = this.timerManager.schedule(this::onTimer, this.copyOptions.getRetryIntervalMs(),
                    TimeUnit.MILLISECONDS);
                return;
            }
            this.retryTimes = 0;
            Requires.requireNonNull(response, "response");
            if (!response.getEof()) {
                this.requestBuilder.setCount(response.getReadSize());
            }
            if (this.outputFile != null) {
                try {
                    final ByteBuffer data = response.getData().asReadOnlyByteBuffer();
                    while (data.hasRemaining()) {
                        this.fileOffset += this.outputFile.write(data, this.fileOffset);
                    }
                } catch (final IOException e) {
                    LOG.error("Fail to write into file {}.", this.destPath, e);
                    this.st.setError(RaftError.EIO, RaftError.EIO.name());
                    onFinished();
                    return;
                }
            } else {
                this.destBuf.put(response.getData().asReadOnlyByteBuffer());
            }
            this.copiedBytes += response.getData().size();
            if (response.getEof()) {
                onFinished();
                return;
            }
        } finally {
            this.lock.unlock();
        }
        sendNextRpc();
    }

    /**
     * Send next request to get a piece of file data.
     */
    void sendNextRpc() {
        this.lock.lock();
        try {
            this.timer = null;
            final long offset = this.requestBuilder.getOffset() + this.requestBuilder.getCount();
            final long maxCount = this.destBuf == null ? this.maxByteCountPerRpc : Integer.MAX_VALUE;
            this.requestBuilder.setOffset(offset).setCount(maxCount).setReadPartly(true);

            if (this.finished) {
                return;
            }
            long newMaxCount = maxCount;
            if (this.snapshotThrottle != null) {
                newMaxCount = this.snapshotThrottle.throttledByThroughput(maxCount);
                if (newMaxCount == 0) {
                    this.requestBuilder.setCount(0);
                    this.timer = this.timerManager.schedule(this::onTimer, this.copyOptions.getRetryIntervalMs(),
                        TimeUnit.MILLISECONDS);
                    return;
                }
            }
            this.requestBuilder.setCount(newMaxCount);
            final GetFileRequest request = this.requestBuilder.build();
            LOG.debug("Send get file request {} to peer {}.", request, this.endpoint);
            this.rpcCall = this.fileClientService.getFile(this.endpoint, request, this.copyOptions.getTimeoutMs(),
                this.done);
        } finally {
            this.lock.unlock();
        }
    }
}
