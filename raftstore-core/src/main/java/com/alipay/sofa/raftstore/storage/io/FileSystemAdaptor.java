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

import java.io.IOException;
import java.util.List;

/**
 * Byte-level file system used by the local snapshot backend. Replace it to
 * put snapshots on something other than the local disk.
 */
public interface FileSystemAdaptor {

    /**
     * Opens a file for reading, or for writing when {@code write} is set.
     * A file opened for writing is created if absent and truncated when
     * {@code truncate} is set.
     */
    FileAdaptor open(final String path, final boolean write, final boolean truncate) throws IOException;

    /**
     * Deletes a file or a directory, a missing path counts as deleted.
     */
    boolean deleteFile(final String path, final boolean recursive);

    /**
     * Atomically replaces newPath with oldPath.
     */
    boolean rename(final String oldPath, final String newPath);

    /**
     * Creates a hard link.
     */
    boolean link(final String oldPath, final String newPath);

    boolean createDirectory(final String path, final boolean createParentDirectories);

    boolean pathExists(final String path);

    boolean directoryExists(final String path);

    /**
     * Lists the entry names of a directory, null if it can't be listed.
     */
    List<String> listDirectory(final String path);
}
