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

import com.alipay.sofa.raftstore.storage.LogStorage;
import com.alipay.sofa.raftstore.storage.RaftMetaStorage;
import com.alipay.sofa.raftstore.storage.SnapshotStorage;
import com.alipay.sofa.raftstore.storage.impl.LocalRaftMetaStorage;
import com.alipay.sofa.raftstore.storage.impl.MemoryLogStorage;
import com.alipay.sofa.raftstore.storage.impl.MemoryRaftMetaStorage;
import com.alipay.sofa.raftstore.storage.impl.RocksDBLogStorage;
import com.alipay.sofa.raftstore.storage.snapshot.local.LocalSnapshotStorage;

/**
 * Backend registry for the log, raft meta and snapshot storages.
 * <pre>
 *   StorageRegistry registry = StorageRegistry.withDefaults();
 *   LogStorage log = registry.createLogStorage("rocksdb:///data/raft/log?sync=false");
 * </pre>
 */
public class StorageRegistry {

    public static final String                   MEMORY_SCHEME  = "memory";
    public static final String                   LOCAL_SCHEME   = "local";
    public static final String                   ROCKSDB_SCHEME = "rocksdb";

    private final BackendRegistry<LogStorage>      logStorages      = new BackendRegistry<>("log storage");
    private final BackendRegistry<RaftMetaStorage> raftMetaStorages = new BackendRegistry<>("raft meta storage");
    private final BackendRegistry<SnapshotStorage> snapshotStorages = new BackendRegistry<>("snapshot storage");

    /**
     * Creates a registry with the built-in backends.
     */
    public static StorageRegistry withDefaults() {
        final StorageRegistry registry = new StorageRegistry();
        registry.registerLogStorage(MEMORY_SCHEME, new MemoryLogStorage());
        registry.registerLogStorage(ROCKSDB_SCHEME, new RocksDBLogStorage());
        registry.registerRaftMetaStorage(LOCAL_SCHEME, new LocalRaftMetaStorage());
        registry.registerRaftMetaStorage(MEMORY_SCHEME, new MemoryRaftMetaStorage());
        registry.registerSnapshotStorage(LOCAL_SCHEME, new LocalSnapshotStorage());
        return registry;
    }

    public void registerLogStorage(final String scheme, final LogStorage prototype) {
        this.logStorages.register(scheme, prototype);
    }

    public void registerRaftMetaStorage(final String scheme, final RaftMetaStorage prototype) {
        this.raftMetaStorages.register(scheme, prototype);
    }

    public void registerSnapshotStorage(final String scheme, final SnapshotStorage prototype) {
        this.snapshotStorages.register(scheme, prototype);
    }

    public LogStorage createLogStorage(final String uri) {
        return this.logStorages.create(uri);
    }

    public RaftMetaStorage createRaftMetaStorage(final String uri) {
        return this.raftMetaStorages.create(uri);
    }

    public SnapshotStorage createSnapshotStorage(final String uri) {
        return this.snapshotStorages.create(uri);
    }

    public BackendRegistry<LogStorage> getLogStorages() {
        return this.logStorages;
    }

    public BackendRegistry<RaftMetaStorage> getRaftMetaStorages() {
        return this.raftMetaStorages;
    }

    public BackendRegistry<SnapshotStorage> getSnapshotStorages() {
        return this.snapshotStorages;
    }
}
