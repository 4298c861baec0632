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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.alipay.sofa.raftstore.entity.EnumOutter;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.codec.LogEntryDecoder;
import com.alipay.sofa.raftstore.util.Bits;

/**
 * V1 log entry decoder
 */
public final class V1Decoder implements LogEntryDecoder {

    private V1Decoder() {
    }

    public static final V1Decoder INSTANCE = new V1Decoder();

    @Override
    public LogEntry decode(final byte[] content) {
        if (!isValidHeader(content)) {
            // Corrupted log
            return null;
        }
        final LogEntry log = new LogEntry();
        return decode(log, content) ? log : null;
    }

    @Override
    public LogId decodeId(final byte[] content) {
        if (!isValidHeader(content)) {
            return null;
        }
        return new LogId(Bits.getLong(content, LogEntryV1CodecFactory.INDEX_OFFSET), Bits.getLong(content,
            LogEntryV1CodecFactory.TERM_OFFSET));
    }

    private static boolean isValidHeader(final byte[] content) {
        return content != null && content.length >= LogEntryV1CodecFactory.HEADER_SIZE + 8
               && content[0] == LogEntryV1CodecFactory.MAGIC;
    }

    private boolean decode(final LogEntry log, final byte[] content) {
        // 1-5 type
        final int iType = Bits.getInt(content, LogEntryV1CodecFactory.TYPE_OFFSET);
        final EnumOutter.EntryType type = EnumOutter.EntryType.forNumber(iType);
        if (type == null) {
            return false;
        }
        log.setType(type);
        // 5-13 index
        // 13-21 term
        final long index = Bits.getLong(content, LogEntryV1CodecFactory.INDEX_OFFSET);
        final long term = Bits.getLong(content, LogEntryV1CodecFactory.TERM_OFFSET);
        log.setId(new LogId(index, term));
        // 21-30 checksum
        if (content[LogEntryV1CodecFactory.HAS_SUM_OFFSET] == 1) {
            log.setChecksum(Bits.getLong(content, LogEntryV1CodecFactory.CHECKSUM_OFFSET));
        }
        int[] pos = new int[] { LogEntryV1CodecFactory.HEADER_SIZE };
        final List<PeerId> peers = readPeers(content, pos);
        if (peers == null) {
            return false;
        }
        if (!peers.isEmpty()) {
            log.setPeers(peers);
        }
        final List<PeerId> oldPeers = readPeers(content, pos);
        if (oldPeers == null) {
            return false;
        }
        if (!oldPeers.isEmpty()) {
            log.setOldPeers(oldPeers);
        }

        // data
        if (content.length > pos[0]) {
            final int len = content.length - pos[0];
            final ByteBuffer data = ByteBuffer.allocate(len);
            data.put(content, pos[0], len);
            data.flip();
            log.setData(data);
        }
        return true;
    }

    private static List<PeerId> readPeers(final byte[] content, final int[] pos) {
        if (content.length < pos[0] + 4) {
            return null;
        }
        int peerCount = Bits.getInt(content, pos[0]);
        pos[0] += 4;
        if (peerCount < 0) {
            return null;
        }
        final List<PeerId> peers = new ArrayList<>(peerCount);
        while (peerCount-- > 0) {
            if (content.length < pos[0] + 2) {
                return null;
            }
            final short len = Bits.getShort(content, pos[0]);
            if (len < 0 || content.length < pos[0] + 2 + len) {
                return null;
            }
            // peer len (short in 2 bytes)
            // peer str
            final PeerId peer = new PeerId();
            if (!peer.parse(new String(content, pos[0] + 2, len, StandardCharsets.UTF_8))) {
                return null;
            }
            pos[0] += 2 + len;
            peers.add(peer);
        }
        return peers;
    }
}
