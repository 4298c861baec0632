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
package com.alipay.sofa.raftstore;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.alipay.sofa.raftstore.entity.EnumOutter.EntryType;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.PeerId;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Entry builders shared by tests.
 */
public final class TestUtils {

    private TestUtils() {
    }

    public static LogEntry mockEntry(final long index, final long term) {
        return mockEntry(index, term, "hello" + index);
    }

    public static LogEntry mockEntry(final long index, final long term, final String data) {
        final LogEntry entry = new LogEntry(EntryType.ENTRY_TYPE_DATA);
        entry.setId(new LogId(index, term));
        entry.setData(ByteBuffer.wrap(Utils.getBytes(data)));
        return entry;
    }

    public static List<LogEntry> mockEntries(final long firstIndex, final long term, final int n) {
        final List<LogEntry> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            entries.add(mockEntry(firstIndex + i, term));
        }
        return entries;
    }

    public static LogEntry mockConfEntry(final long index, final long term, final String... peers) {
        final LogEntry entry = new LogEntry(EntryType.ENTRY_TYPE_CONFIGURATION);
        entry.setId(new LogId(index, term));
        final List<PeerId> peerIds = new ArrayList<>();
        for (final String peer : Arrays.asList(peers)) {
            peerIds.add(PeerId.parsePeer(peer));
        }
        entry.setPeers(peerIds);
        return entry;
    }

    public static String dataOf(final LogEntry entry) {
        final ByteBuffer data = entry.getData().duplicate();
        final byte[] bs = new byte[data.remaining()];
        data.get(bs);
        return new String(bs, StandardCharsets.UTF_8);
    }
}
