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
package com.alipay.sofa.raftstore.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.error.RetryAgainException;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.storage.io.FileReader;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.alipay.sofa.raftstore.util.OnlyForTest;
import com.alipay.sofa.raftstore.util.Utils;
import com.google.protobuf.ByteString;

/**
 * File reader service. Snapshot readers exposed for copy are registered here
 * under a reader id, and chunk requests are served from them.
 */
public final class FileService {

    private static final Logger                   LOG                  = LoggerFactory.getLogger(FileService.class);

    private static final FileService              INSTANCE             = new FileService();

    private static final int                      MAX_INITIAL_BUF_SIZE = 1024;

    private final ConcurrentMap<Long, FileReader> fileReaderMap        = new ConcurrentHashMap<>();
    private final AtomicLong                      nextId               = new AtomicLong();

    /**
     * Retrieve the singleton instance of FileService.
     *
     * @return a fileService instance
     */
    public static FileService getInstance() {
        return INSTANCE;
    }

    @OnlyForTest
    void clear() {
        this.fileReaderMap.clear();
    }

    @OnlyForTest
    int readerCount() {
        return this.fileReaderMap.size();
    }

    private FileService() {
        final long processId = Utils.getProcessId(ThreadLocalRandom.current().nextLong(10000, Integer.MAX_VALUE));
        final long initialValue = Math.abs(processId << 45 | System.nanoTime() << 17 >> 17);
        this.nextId.set(initialValue);
        LOG.info("Initial file reader id in FileService is {}", initialValue);
    }

    /**
     * Handle GetFileRequest. Returns the response, or null with the error set
     * in {@code status}.
     */
    public GetFileResponse handleGetFile(final GetFileRequest request, final Status status) {
        if (request.getCount() <= 0 || request.getOffset() < 0) {
            status.setError(RaftError.EINVAL, "Invalid request: %s", request);
            return null;
        }
        final FileReader reader = this.fileReaderMap.get(request.getReaderId());
        if (reader == null) {
            status.setError(RaftError.ENOENT, "Fail to find reader=%d", request.getReaderId());
            return null;
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("GetFile path={} filename={} offset={} count={}", reader.getPath(), request.getFilename(),
                request.getOffset(), request.getCount());
        }

        // a chunk never exceeds the requested count
        final ByteBufferCollector dataBuffer = ByteBufferCollector.allocate((int) Math.min(request.getCount(),
            MAX_INITIAL_BUF_SIZE));
        final GetFileResponse.Builder responseBuilder = GetFileResponse.newBuilder();
        try {
            final int read = reader
                .readFile(dataBuffer, request.getFilename(), request.getOffset(), request.getCount());
            responseBuilder.setReadSize(read);
            responseBuilder.setEof(read == FileReader.EOF);
            final ByteBuffer buf = dataBuffer.getBuffer();
            buf.flip();
            if (!buf.hasRemaining()) {
                // skip empty data
                responseBuilder.setData(ByteString.EMPTY);
            } else {
                responseBuilder.setData(ByteString.copyFrom(buf));
            }
            return responseBuilder.build();
        } catch (final RetryAgainException e) {
            status.setError(RaftError.EAGAIN, "Fail to read from path=%s filename=%s with error: %s",
                reader.getPath(), request.getFilename(), e.getMessage());
            return null;
        } catch (final IOException e) {
            LOG.error("Fail to read file path={} filename={}", reader.getPath(), request.getFilename(), e);
            status.setError(RaftError.EIO, "Fail to read from path=%s filename=%s", reader.getPath(),
                request.getFilename());
            return null;
        }
    }

    /**
     * Adds a file reader and return it's generated readerId.
     */
    public long addReader(final FileReader reader) {
        final long readerId = this.nextId.getAndIncrement();
        if (this.fileReaderMap.putIfAbsent(readerId, reader) == null) {
            return readerId;
        } else {
            return -1L;
        }
    }

    /**
     * Remove the reader by readerId.
     */
    public boolean removeReader(final long readerId) {
        return this.fileReaderMap.remove(readerId) != null;
    }
}
