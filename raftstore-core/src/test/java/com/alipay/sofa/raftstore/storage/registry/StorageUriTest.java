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
package com.alipay.sofa.raftstore.storage.registry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StorageUriTest {

    @Test
    public void testParsePathAndParams() {
        final StorageUri uri = StorageUri.parse("local:///data/raft/snapshot?addr=127.0.0.1:8081&sync_meta=false&flag");
        assertEquals("local", uri.getScheme());
        assertEquals("/data/raft/snapshot", uri.getPath());
        assertEquals(3, uri.getParams().size());
        assertEquals("127.0.0.1:8081", uri.getParam("addr"));
        assertEquals("false", uri.getParam("sync_meta"));
        assertTrue(uri.hasParam("flag"));
        assertEquals("", uri.getParam("flag"));
        assertFalse(uri.hasParam("sync"));
    }

    @Test
    public void testRelativePathWithoutParams() {
        final StorageUri uri = StorageUri.parse("rocksdb://data/log");
        assertEquals("rocksdb", uri.getScheme());
        assertEquals("data/log", uri.getPath());
        assertTrue(uri.getParams().isEmpty());
        assertEquals("data/log", StorageUri.parsePath("rocksdb://data/log?sync=true"));
    }

    @Test
    public void testEmptyPath() {
        assertEquals("", StorageUri.parse("memory://").getPath());
    }

    @Test
    public void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse(null));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("  "));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("/data/log"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("://data/log"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("lo cal://data"));
        assertThrows(IllegalArgumentException.class, () -> StorageUri.parse("local://data?=1"));
    }
}
