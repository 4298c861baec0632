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

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.alipay.sofa.raftstore.TestUtils;
import com.alipay.sofa.raftstore.entity.EnumOutter.EntryType;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.entity.codec.LogEntryDecoder;
import com.alipay.sofa.raftstore.entity.codec.LogEntryEncoder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LogEntryV1CodecTest {

    private final LogEntryEncoder encoder = LogEntryV1CodecFactory.getInstance().encoder();
    private final LogEntryDecoder decoder = LogEntryV1CodecFactory.getInstance().decoder();

    @Test
    public void testConfigurationEntry() {
        final LogEntry entry = TestUtils.mockConfEntry(8, 3, "127.0.0.1:8081", "127.0.0.1:8082:2");
        entry.setOldPeers(Arrays.asList(PeerId.parsePeer("127.0.0.1:8081")));
        entry.setChecksum(entry.checksum());

        final byte[] content = this.encoder.encode(entry);
        assertEquals(LogEntryV1CodecFactory.MAGIC, content[0]);
        final LogEntry decoded = this.decoder.decode(content);
        assertEquals(EntryType.ENTRY_TYPE_CONFIGURATION, decoded.getType());
        assertEquals(new LogId(8, 3), decoded.getId());
        assertEquals(entry.getPeers(), decoded.getPeers());
        assertEquals(entry.getOldPeers(), decoded.getOldPeers());
        assertTrue(decoded.hasChecksum());
        assertFalse(decoded.isCorrupted());
    }

    @Test
    public void testDataEntryKeepsPayloadPosition() {
        final LogEntry entry = TestUtils.mockEntry(100, 7, "payload");
        final byte[] content = this.encoder.encode(entry);
        assertEquals("payload", TestUtils.dataOf(entry));
        final LogEntry decoded = this.decoder.decode(content);
        assertEquals("payload", TestUtils.dataOf(decoded));
        assertNull(decoded.getPeers());
        assertFalse(decoded.hasChecksum());
    }

    @Test
    public void testDecodeIdReadsHeaderOnly() {
        final byte[] content = this.encoder.encode(TestUtils.mockEntry(42, 9));
        // a broken body doesn't matter for the id
        final byte[] truncated = Arrays.copyOf(content, LogEntryV1CodecFactory.HEADER_SIZE + 8);
        assertEquals(new LogId(42, 9), this.decoder.decodeId(truncated));
    }

    @Test
    public void testMalformedContent() {
        assertNull(this.decoder.decode(null));
        assertNull(this.decoder.decode(new byte[] { 1, 2, 3 }));
        final byte[] content = this.encoder.encode(TestUtils.mockConfEntry(1, 1, "127.0.0.1:8081"));
        content[0] = 0;
        assertNull(this.decoder.decode(content));
        assertNull(this.decoder.decodeId(content));

        final byte[] badPeerCount = this.encoder.encode(TestUtils.mockConfEntry(1, 1, "127.0.0.1:8081"));
        badPeerCount[LogEntryV1CodecFactory.HEADER_SIZE + 3] = 9;
        assertNull(this.decoder.decode(badPeerCount));
    }

    @Test
    public void testUnknownTypeIsRejected() {
        final LogEntry entry = TestUtils.mockEntry(1, 1);
        entry.setType(EntryType.ENTRY_TYPE_UNKNOWN);
        assertThrows(IllegalArgumentException.class, () -> this.encoder.encode(entry));
    }
}
