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
import java.util.ArrayList;
import java.util.List;

import com.alipay.sofa.raftstore.entity.EnumOutter.EntryType;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.codec.LogEntryEncoder;
import com.alipay.sofa.raftstore.util.Bits;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * V1 log entry encoder
 */
public final class V1Encoder implements LogEntryEncoder {

    private V1Encoder() {
    }

    public static final LogEntryEncoder INSTANCE = new V1Encoder();

    @Override
    public byte[] encode(final LogEntry log) {
        final EntryType type = log.getType();
        if (type == null || type == EntryType.ENTRY_TYPE_UNKNOWN) {
            throw new IllegalArgumentException("Invalid log entry type: " + type);
        }
        final LogId id = log.getId();
        final List<PeerId> peers = log.getPeers();
        final List<PeerId> oldPeers = log.getOldPeers();
        final ByteBuffer data = log.getData();

        // magic number 1 byte
        int totalLen = LogEntryV1CodecFactory.HEADER_SIZE;
        final int iType = type.getNumber();
        final long index = id.getIndex();
        final long term = id.getTerm();
        // peer count
        totalLen += 4;
        final List<byte[]> peerStrs = new ArrayList<>();
        if (peers != null) {
            for (final PeerId peer : peers) {
                final byte[] ps = Utils.getBytes(peer.toString());
                totalLen += 2 + ps.length;
                peerStrs.add(ps);
            }
        }
        // old peer count
        totalLen += 4;
        final List<byte[]> oldPeerStrs = new ArrayList<>();
        if (oldPeers != null) {
            for (final PeerId peer : oldPeers) {
                final byte[] ps = Utils.getBytes(peer.toString());
                totalLen += 2 + ps.length;
                oldPeerStrs.add(ps);
            }
        }

        final int bodyLen = data != null ? data.remaining() : 0;
        totalLen += bodyLen;

        final byte[] content = new byte[totalLen];
        // {0} magic
        content[0] = LogEntryV1CodecFactory.MAGIC;
        // 1-5 type
        Bits.putInt(content, LogEntryV1CodecFactory.TYPE_OFFSET, iType);
        // 5-13 index
        Bits.putLong(content, LogEntryV1CodecFactory.INDEX_OFFSET, index);
        // 13-21 term
        Bits.putLong(content, LogEntryV1CodecFactory.TERM_OFFSET, term);
        // 21 has checksum, 22-30 checksum
        if (log.hasChecksum()) {
            content[LogEntryV1CodecFactory.HAS_SUM_OFFSET] = 1;
            Bits.putLong(content, LogEntryV1CodecFactory.CHECKSUM_OFFSET, log.getChecksum());
        }
        int pos = LogEntryV1CodecFactory.HEADER_SIZE;
        pos = writePeers(content, pos, peerStrs);
        pos = writePeers(content, pos, oldPeerStrs);

        if (data != null) {
            final int dataPos = data.position();
            data.get(content, pos, bodyLen);
            data.position(dataPos);
        }

        return content;
    }

    private static int writePeers(final byte[] content, int pos, final List<byte[]> peerStrs) {
        Bits.putInt(content, pos, peerStrs.size());
        pos += 4;
        for (final byte[] ps : peerStrs) {
            Bits.putShort(content, pos, (short) ps.length);
            System.arraycopy(ps, 0, content, pos + 2, ps.length);
            pos += 2 + ps.length;
        }
        return pos;
    }
}
