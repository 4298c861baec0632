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
package com.alipay.sofa.raftstore.storage.impl;

import java.nio.ByteBuffer;

import org.junit.jupiter.api.Test;

import com.alipay.sofa.raftstore.TestUtils;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.storage.LogStorage;
import com.alipay.sofa.raftstore.util.Utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MemoryLogStorageTest extends BaseLogStorageTest {

    @Override
    protected LogStorage newLogStorage() {
        return new MemoryLogStorage("test");
    }

    @Test
    public void testNewInstanceIsFresh() {
        final LogStorage other = this.logStorage.newInstance("memory://other");
        assertNotSame(this.logStorage, other);
        assertTrue(other instanceof MemoryLogStorage);
    }

    @Test
    public void testStoredEntriesAreIsolatedFromCallers() {
        final LogEntry appended = TestUtils.mockEntry(1, 1, "stored");
        assertTrue(this.logStorage.appendEntry(appended).isOk());
        appended.setId(new LogId(1, 9));
        appended.getData().put(0, (byte) 'X');

        final LogEntry read = this.logStorage.getEntry(1);
        assertNotSame(appended, read);
        assertEquals(1, read.getId().getTerm());
        assertEquals("stored", TestUtils.dataOf(read));

        read.setId(new LogId(1, 7));
        read.setData(ByteBuffer.wrap(Utils.getBytes("changed")));
        assertEquals(1, this.logStorage.getTerm(1));
        assertEquals("stored", TestUtils.dataOf(this.logStorage.getEntry(1)));
    }
}
