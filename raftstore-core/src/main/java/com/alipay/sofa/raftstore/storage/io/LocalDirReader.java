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
package com.alipay.sofa.raftstore.storage.io;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.error.RetryAgainException;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.google.protobuf.Message;

/**
 * Read a file data form local dir by fileName.
 */
public class LocalDirReader implements FileReader {

    private static final Logger     LOG = LoggerFactory.getLogger(LocalDirReader.class);

    private final String            path;
    private final FileSystemAdaptor fs;

    public LocalDirReader(final String path) {
        this(path, PosixFileSystemAdaptor.getInstance());
    }

    public LocalDirReader(final String path, final FileSystemAdaptor fs) {
        super();
        this.path = path;
        this.fs = fs;
    }

    @Override
    public String getPath() {
        return this.path;
    }

    protected FileSystemAdaptor getFileSystem() {
        return this.fs;
    }

    @Override
    public int readFile(final ByteBufferCollector buf, final String fileName, final long offset, final long maxCount)
                                                                                                                     throws IOException,
                                                                                                                     RetryAgainException {
        return readFileWithMeta(buf, fileName, null, offset, maxCount);
    }

    @SuppressWarnings("unused")
    protected int readFileWithMeta(final ByteBufferCollector buf, final String fileName, final Message fileMeta,
                                   long offset, final long maxCount) throws IOException, RetryAgainException {
        buf.expandIfNecessary();
        final String filePath = this.path + File.separator + fileName;
        try (final FileAdaptor file = this.fs.open(filePath, false, false)) {
            int totalRead = 0;
            while (true) {
                final int nread = file.read(buf.getBuffer(), offset);
                if (nread <= 0) {
                    return EOF;
                }
                totalRead += nread;
                if (totalRead < maxCount) {
                    if (buf.hasRemaining()) {
                        return EOF;
                    } else {
                        buf.expandAtMost((int) (maxCount - totalRead));
                        offset += nread;
                    }
                } else {
                    final long fsize = file.size();
                    if (fsize < 0) {
                        LOG.warn("Invalid file length {}", filePath);
                        return EOF;
                    }
                    if (fsize == offset + nread) {
                        return EOF;
                    } else {
                        return totalRead;
                    }
                }
            }
        }
    }
}
