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

public final class BytesUtil {

    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    public static final byte[]  EMPTY_BYTES = new byte[0];

    public static String toHex(final byte[] bytes) {
        if (bytes == null) {
            return "null";
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int b = bytes[i] & 0xFF;
            chars[2 * i] = HEX_CHARS[b >>> 4];
            chars[2 * i + 1] = HEX_CHARS[b & 0x0F];
        }
        return new String(chars);
    }

    private BytesUtil() {
    }
}
