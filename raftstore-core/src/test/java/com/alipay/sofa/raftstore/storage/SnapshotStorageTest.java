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
package com.alipay.sofa.raftstore.storage;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import com.alipay.sofa.raftstore.storage.io.PosixFileSystemAdaptor;
import com.alipay.sofa.raftstore.storage.snapshot.ThroughputSnapshotThrottle;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

public class SnapshotStorageTest {

    @Test
    public void testOptionalHooksAreUnsupportedByDefault() {
        final SnapshotStorage storage = mock(SnapshotStorage.class, Mockito.CALLS_REAL_METHODS);
        assertThrows(UnsupportedOperationException.class, storage::setFilterBeforeCopyRemote);
        assertThrows(UnsupportedOperationException.class,
            () -> storage.setFileSystemAdaptor(PosixFileSystemAdaptor.getInstance()));
        assertThrows(UnsupportedOperationException.class,
            () -> storage.setSnapshotThrottle(new ThroughputSnapshotThrottle(1024, 1)));
    }
}
