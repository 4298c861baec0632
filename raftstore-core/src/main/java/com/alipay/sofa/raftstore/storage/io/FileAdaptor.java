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

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * An open file handle returned by {@link FileSystemAdaptor#open}.
 */
public interface FileAdaptor extends Closeable {

    /**
     * Reads bytes into buf starting at the given file offset.
     *
     * @return bytes read, or -1 at end of file
     */
    int read(final ByteBuffer buf, final long offset) throws IOException;

    /**
     * Writes all remaining bytes of buf at the given file offset.
     *
     * @return bytes written
     */
    int write(final ByteBuffer buf, final long offset) throws IOException;

    long size() throws IOException;

    /**
     * Flushes written data to the device.
     */
    void sync() throws IOException;
}
