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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FileSystemAdaptor} on the local file system.
 */
public class PosixFileSystemAdaptor implements FileSystemAdaptor {

    private static final Logger                 LOG      = LoggerFactory.getLogger(PosixFileSystemAdaptor.class);

    private static final PosixFileSystemAdaptor INSTANCE = new PosixFileSystemAdaptor();

    public static PosixFileSystemAdaptor getInstance() {
        return INSTANCE;
    }

    @Override
    public FileAdaptor open(final String path, final boolean write, final boolean truncate) throws IOException {
        final List<OpenOption> options = new ArrayList<>();
        options.add(StandardOpenOption.READ);
        if (write) {
            options.add(StandardOpenOption.WRITE);
            options.add(StandardOpenOption.CREATE);
            if (truncate) {
                options.add(StandardOpenOption.TRUNCATE_EXISTING);
            }
        }
        final FileChannel fc = FileChannel.open(Paths.get(path), options.toArray(new OpenOption[0]));
        return new PosixFileAdaptor(fc);
    }

    @Override
    public boolean deleteFile(final String path, final boolean recursive) {
        final File file = new File(path);
        if (!file.exists()) {
            return true;
        }
        try {
            if (file.isDirectory() && recursive) {
                FileUtils.deleteDirectory(file);
            } else {
                Files.delete(file.toPath());
            }
            return true;
        } catch (final IOException e) {
            LOG.error("Fail to delete {}.", path, e);
            return false;
        }
    }

    @Override
    public boolean rename(final String oldPath, final String newPath) {
        try {
            Files.move(Paths.get(oldPath), Paths.get(newPath), StandardCopyOption.ATOMIC_MOVE,
                StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (final IOException e) {
            LOG.error("Fail to rename {} to {}.", oldPath, newPath, e);
            return false;
        }
    }

    @Override
    public boolean link(final String oldPath, final String newPath) {
        try {
            Files.createLink(Paths.get(newPath), Paths.get(oldPath));
            return true;
        } catch (final IOException | UnsupportedOperationException e) {
            LOG.error("Fail to link {} to {}.", oldPath, newPath, e);
            return false;
        }
    }

    @Override
    public boolean createDirectory(final String path, final boolean createParentDirectories) {
        final File dir = new File(path);
        if (dir.isDirectory()) {
            return true;
        }
        try {
            if (createParentDirectories) {
                FileUtils.forceMkdir(dir);
            } else {
                Files.createDirectory(dir.toPath());
            }
            return true;
        } catch (final IOException e) {
            LOG.error("Fail to create directory {}.", path, e);
            return false;
        }
    }

    @Override
    public boolean pathExists(final String path) {
        return new File(path).exists();
    }

    @Override
    public boolean directoryExists(final String path) {
        return new File(path).isDirectory();
    }

    @Override
    public List<String> listDirectory(final String path) {
        final String[] names = new File(path).list();
        if (names == null) {
            return null;
        }
        return new ArrayList<>(Arrays.asList(names));
    }

    static final class PosixFileAdaptor implements FileAdaptor {

        private final FileChannel fc;

        PosixFileAdaptor(final FileChannel fc) {
            this.fc = fc;
        }

        @Override
        public int read(final ByteBuffer buf, final long offset) throws IOException {
            return this.fc.read(buf, offset);
        }

        @Override
        public int write(final ByteBuffer buf, final long offset) throws IOException {
            int written = 0;
            long pos = offset;
            while (buf.hasRemaining()) {
                final int n = this.fc.write(buf, pos);
                written += n;
                pos += n;
            }
            return written;
        }

        @Override
        public long size() throws IOException {
            return this.fc.size();
        }

        @Override
        public void sync() throws IOException {
            this.fc.force(true);
        }

        @Override
        public void close() throws IOException {
            this.fc.close();
        }
    }
}
