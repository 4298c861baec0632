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
package com.alipay.sofa.raftstore.util;

import java.nio.ByteBuffer;

/**
 * A byte buffer that grows on demand, used to gather chunks of a remote file.
 */
public final class ByteBufferCollector {

    private static final int DEFAULT_CAPACITY = 1024;
    private static final int MAX_CAPACITY     = 64 * 1024 * 1024;

    private ByteBuffer       buffer;

    public static ByteBufferCollector allocate(final int size) {
        return new ByteBufferCollector(size);
    }

    public static ByteBufferCollector allocate() {
        return new ByteBufferCollector(DEFAULT_CAPACITY);
    }

    private ByteBufferCollector(final int size) {
        if (size > 0) {
            this.buffer = ByteBuffer.allocate(size);
        }
    }

    public boolean hasRemaining() {
        return this.buffer != null && this.buffer.hasRemaining();
    }

    public void expandIfNecessary() {
        if (!hasRemaining()) {
            getBuffer(DEFAULT_CAPACITY);
        }
    }

    public void expandAtMost(final int atMostBytes) {
        if (this.buffer == null) {
            this.buffer = ByteBuffer.allocate(Math.max(atMostBytes, 0));
        } else {
            this.buffer = expandByteBufferAtMost(this.buffer, atMostBytes);
        }
    }

    public ByteBuffer getBuffer() {
        return this.buffer;
    }

    public void setBuffer(final ByteBuffer buffer) {
        this.buffer = buffer;
    }

    public void put(final ByteBuffer buf) {
        getBuffer(buf.remaining()).put(buf);
    }

    public void put(final byte[] bs) {
        getBuffer(bs.length).put(bs);
    }

    private ByteBuffer getBuffer(final int expectSize) {
        if (this.buffer == null) {
            this.buffer = ByteBuffer.allocate(Math.max(expectSize, DEFAULT_CAPACITY));
        } else if (this.buffer.remaining() < expectSize) {
            this.buffer = expandByteBufferAtLeast(this.buffer, expectSize);
        }
        return this.buffer;
    }

    private static ByteBuffer expandByteBufferAtLeast(final ByteBuffer buf, final int minLength) {
        final int newCapacity = minLength > DEFAULT_CAPACITY ? minLength : DEFAULT_CAPACITY;
        return expand(buf, buf.capacity() + newCapacity);
    }

    private static ByteBuffer expandByteBufferAtMost(final ByteBuffer buf, final int maxLength) {
        final int newCapacity = maxLength > DEFAULT_CAPACITY || maxLength <= 0 ? DEFAULT_CAPACITY : maxLength;
        return expand(buf, buf.capacity() + newCapacity);
    }

    private static ByteBuffer expand(final ByteBuffer buf, final int capacity) {
        if (capacity > MAX_CAPACITY) {
            throw new IllegalStateException("Buffer capacity exceeds " + MAX_CAPACITY);
        }
        final ByteBuffer newBuf = ByteBuffer.allocate(capacity);
        buf.flip();
        newBuf.put(buf);
        return newBuf;
    }
}
