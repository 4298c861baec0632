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
package com.alipay.sofa.raftstore.entity.codec.v1;

import com.alipay.sofa.raftstore.entity.codec.LogEntryCodecFactory;
import com.alipay.sofa.raftstore.entity.codec.LogEntryDecoder;
import com.alipay.sofa.raftstore.entity.codec.LogEntryEncoder;

/**
 * Log entry codec for the binary V1 layout.
 * <pre>
 * magic(1) | type(4) | index(8) | term(8) | has_checksum(1) | checksum(8)
 *   | peer_count(4) | (len(2) peer)* | old_peer_count(4) | (len(2) peer)* | data
 * </pre>
 */
public class LogEntryV1CodecFactory implements LogEntryCodecFactory {

    //"Beyond Two Phase" magic
    public static final byte                  MAGIC           = (byte) 0xB8;

    static final int                          TYPE_OFFSET     = 1;
    static final int                          INDEX_OFFSET    = 5;
    static final int                          TERM_OFFSET     = 13;
    static final int                          HAS_SUM_OFFSET  = 21;
    static final int                          CHECKSUM_OFFSET = 22;
    static final int                          HEADER_SIZE     = 30;

    private static final LogEntryV1CodecFactory INSTANCE      = new LogEntryV1CodecFactory();

    public static LogEntryV1CodecFactory getInstance() {
        return INSTANCE;
    }

    @Override
    public LogEntryEncoder encoder() {
        return V1Encoder.INSTANCE;
    }

    @Override
    public LogEntryDecoder decoder() {
        return V1Decoder.INSTANCE;
    }

    private LogEntryV1CodecFactory() {
    }
}
