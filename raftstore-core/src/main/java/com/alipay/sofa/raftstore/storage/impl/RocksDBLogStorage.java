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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.IndexType;
import org.rocksdb.LRUCache;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.rocksdb.util.SizeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.conf.ConfigurationEntry;
import com.alipay.sofa.raftstore.conf.ConfigurationManager;
import com.alipay.sofa.raftstore.entity.EnumOutter.EntryType;
import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.codec.LogEntryCodecFactory;
import com.alipay.sofa.raftstore.entity.codec.LogEntryDecoder;
import com.alipay.sofa.raftstore.entity.codec.LogEntryEncoder;
import com.alipay.sofa.raftstore.entity.codec.v1.LogEntryV1CodecFactory;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.StorageOptions;
import com.alipay.sofa.raftstore.storage.LogStorage;
import com.alipay.sofa.raftstore.storage.StorageMetrics;
import com.alipay.sofa.raftstore.storage.registry.StorageUri;
import com.alipay.sofa.raftstore.util.Bits;
import com.alipay.sofa.raftstore.util.BytesUtil;
import com.alipay.sofa.raftstore.util.Utils;

/**
 * Log storage based on rocksdb. Entries live in the default column family
 * keyed by their big-endian index; the first log index is kept in the
 * "Configuration" column family so prefix truncation and reset survive a
 * restart. URI: {@code rocksdb://path[?sync=true|false]}.
 */
public class RocksDBLogStorage implements LogStorage {

    private static final Logger     LOG               = LoggerFactory.getLogger(RocksDBLogStorage.class);

    public static final byte[]      FIRST_LOG_IDX_KEY = Utils.getBytes("meta/firstLogIndex");
    static final byte[]             CONF_CF_NAME      = Utils.getBytes("Configuration");

    static {
        RocksDB.loadLibrary();
    }

    /**
     * Write batch template.
     */
    private interface WriteBatchTemplate {

        void execute(WriteBatch batch) throws RocksDBException, IOException;
    }

    private final String                    path;
    private final StorageOptions            opts;
    private final StorageMetrics            metrics;
    private final LogEntryEncoder           logEntryEncoder;
    private final LogEntryDecoder           logEntryDecoder;
    private RocksDB                         db;
    private DBOptions                       dbOptions;
    private WriteOptions                    writeOptions;
    private final List<ColumnFamilyOptions> cfOptions     = new ArrayList<>();
    private LRUCache                        blockCache;
    private BloomFilter                     bloomFilter;
    private ColumnFamilyHandle              defaultHandle;
    private ColumnFamilyHandle              confHandle;
    private ReadOptions                     totalOrderReadOptions;
    private final ReadWriteLock             readWriteLock = new ReentrantReadWriteLock();
    private final Lock                      readLock      = this.readWriteLock.readLock();
    private final Lock                      writeLock     = this.readWriteLock.writeLock();

    private volatile long                   firstLogIndex = 1;
    private volatile long                   lastLogIndex  = 0;

    /**
     * Creates a prototype for the backend registry.
     */
    public RocksDBLogStorage() {
        this(null, StorageOptions.defaults());
    }

    public RocksDBLogStorage(final String path, final StorageOptions opts) {
        this(path, opts, LogEntryV1CodecFactory.getInstance());
    }

    public RocksDBLogStorage(final String path, final StorageOptions opts, final LogEntryCodecFactory codecFactory) {
        super();
        this.path = path;
        this.opts = opts;
        this.metrics = new StorageMetrics(opts.isEnableMetrics());
        this.logEntryEncoder = codecFactory.encoder();
        this.logEntryDecoder = codecFactory.decoder();
    }

    @Override
    public LogStorage newInstance(final String uri) {
        final StorageUri parsed = StorageUri.parse(uri);
        if (StringUtils.isBlank(parsed.getPath())) {
            throw new IllegalArgumentException("Missing path in rocksdb log storage uri: " + uri);
        }
        return new RocksDBLogStorage(parsed.getPath(), StorageOptions.defaults().withParams(parsed.getParams()));
    }

    public String getPath() {
        return this.path;
    }

    public StorageMetrics getMetrics() {
        return this.metrics;
    }

    private BlockBasedTableConfig createTableConfig() {
        this.blockCache = new LRUCache(64 * SizeUnit.MB, 8);
        this.bloomFilter = new BloomFilter(16, false);
        return new BlockBasedTableConfig() //
            .setIndexType(IndexType.kTwoLevelIndexSearch) //
            .setFilterPolicy(this.bloomFilter) //
            .setPartitionFilters(true) //
            .setMetadataBlockSize(8 * SizeUnit.KB) //
            .setCacheIndexAndFilterBlocks(false) //
            .setCacheIndexAndFilterBlocksWithHighPriority(true) //
            .setPinL0FilterAndIndexBlocksInCache(true) //
            .setBlockSize(4 * SizeUnit.KB) //
            .setBlockCache(this.blockCache);
    }

    private static DBOptions createDBOptions() {
        return new DBOptions() //
            .setCreateIfMissing(true) //
            .setCreateMissingColumnFamilies(true) //
            .setMaxOpenFiles(-1) //
            .setMaxBackgroundJobs(Math.min(Utils.cpus(), 4));
    }

    private ColumnFamilyOptions createColumnFamilyOptions() {
        return new ColumnFamilyOptions() //
            .setWriteBufferSize(64 * SizeUnit.MB) //
            .setMaxWriteBufferNumber(3) //
            .setCompactionStyle(CompactionStyle.LEVEL) //
            .setCompressionType(CompressionType.LZ4_COMPRESSION) //
            .useFixedLengthPrefixExtractor(8) //
            .setTableFormatConfig(createTableConfig());
    }

    @Override
    public Status init(final ConfigurationManager confManager) {
        if (this.path == null) {
            return new Status(RaftError.EINVAL, "RocksDBLogStorage prototype can't be initialized");
        }
        this.writeLock.lock();
        try {
            if (this.db != null) {
                LOG.warn("RocksDBLogStorage init() already.");
                return Status.OK();
            }
            final File dir = new File(this.path);
            if (dir.exists() && !dir.isDirectory()) {
                return new Status(RaftError.EIO, "Invalid log path, it's a regular file: %s", this.path);
            }
            if (this.opts.isCreateParentDirectories()) {
                FileUtils.forceMkdir(dir);
            }
            this.dbOptions = createDBOptions();
            this.writeOptions = new WriteOptions();
            this.writeOptions.setSync(this.opts.isSync());
            this.totalOrderReadOptions = new ReadOptions();
            this.totalOrderReadOptions.setTotalOrderSeek(true);

            openDB();
            final Status st = load(confManager);
            if (!st.isOk()) {
                LOG.error("Fail to load RocksDBLogStorage, path={}, status={}.", this.path, st);
                releaseResources();
                return st;
            }
            LOG.info("RocksDBLogStorage opened, path={}, firstLogIndex={}, lastLogIndex={}.", this.path,
                this.firstLogIndex, this.lastLogIndex);
            return st;
        } catch (final RocksDBException | IOException e) {
            LOG.error("Fail to init RocksDBLogStorage, path={}.", this.path, e);
            releaseResources();
            return new Status(RaftError.EIO, "Fail to open rocksdb at %s: %s", this.path, e.getMessage());
        } finally {
            this.writeLock.unlock();
        }
    }

    private void openDB() throws RocksDBException {
        final List<ColumnFamilyDescriptor> columnFamilyDescriptors = new ArrayList<>();
        final ColumnFamilyOptions cfOption = createColumnFamilyOptions();
        this.cfOptions.add(cfOption);
        columnFamilyDescriptors.add(new ColumnFamilyDescriptor(CONF_CF_NAME, cfOption));
        columnFamilyDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOption));

        final List<ColumnFamilyHandle> columnFamilyHandles = new ArrayList<>();
        this.db = RocksDB.open(this.dbOptions, this.path, columnFamilyDescriptors, columnFamilyHandles);
        this.confHandle = columnFamilyHandles.get(0);
        this.defaultHandle = columnFamilyHandles.get(1);
    }

    /**
     * Loads the first log index and checks that the stored entries form one
     * contiguous, decodable run starting at it.
     */
    private Status load(final ConfigurationManager confManager) throws RocksDBException {
        this.firstLogIndex = 1;
        this.lastLogIndex = 0;
        boolean hasFirstLogIndex = false;
        final byte[] firstBytes = this.db.get(this.confHandle, FIRST_LOG_IDX_KEY);
        if (firstBytes != null) {
            if (firstBytes.length != 8) {
                return new Status(RaftError.ECORRUPTED, "Bad first log index record: %s", BytesUtil.toHex(firstBytes));
            }
            this.firstLogIndex = Bits.getLong(firstBytes, 0);
            hasFirstLogIndex = true;
            // entries before the first index may be left by an interrupted prefix truncation
            this.db.deleteRange(this.defaultHandle, getKeyBytes(0), getKeyBytes(this.firstLogIndex));
        }

        try (final RocksIterator it = this.db.newIterator(this.defaultHandle, this.totalOrderReadOptions)) {
            it.seekToFirst();
            long expected = -1;
            while (it.isValid()) {
                final byte[] ks = it.key();
                final byte[] bs = it.value();
                if (ks.length != 8) {
                    return new Status(RaftError.ECORRUPTED, "Unknown key in log storage: %s", BytesUtil.toHex(ks));
                }
                final long index = Bits.getLong(ks, 0);
                if (expected < 0) {
                    if (hasFirstLogIndex && index != this.firstLogIndex) {
                        return new Status(RaftError.ECORRUPTED, "First entry %d doesn't match first log index %d",
                            index, this.firstLogIndex);
                    }
                    this.firstLogIndex = index;
                    expected = index;
                }
                if (index != expected) {
                    return new Status(RaftError.ECORRUPTED, "Gap in log storage, expect index %d but found %d",
                        expected, index);
                }
                final LogEntry entry = this.logEntryDecoder.decode(bs);
                if (entry == null) {
                    LOG.error("Bad log entry format for index={}, the log data is: {}.", index, BytesUtil.toHex(bs));
                    return new Status(RaftError.ECORRUPTED, "Fail to decode entry at index %d", index);
                }
                if (entry.getId().getIndex() != index) {
                    return new Status(RaftError.ECORRUPTED, "Entry at key %d carries index %d", index, entry.getId()
                        .getIndex());
                }
                if (entry.isCorrupted()) {
                    return new Status(RaftError.ECORRUPTED, "Checksum mismatch for entry at index %d", index);
                }
                if (entry.getType() == EntryType.ENTRY_TYPE_CONFIGURATION && confManager != null) {
                    confManager.add(ConfigurationEntry.fromLogEntry(entry));
                }
                expected++;
                it.next();
            }
            this.lastLogIndex = this.firstLogIndex - 1;
            if (expected > 0) {
                this.lastLogIndex = expected - 1;
            }
            it.status();
        }
        return Status.OK();
    }

    private Status executeBatch(final WriteBatchTemplate template) {
        if (this.db == null) {
            LOG.warn("DB not initialized or destroyed.");
            return new Status(RaftError.EINVAL, "DB not initialized or destroyed");
        }
        try (final WriteBatch batch = new WriteBatch()) {
            template.execute(batch);
            this.db.write(this.writeOptions, batch);
        } catch (final RocksDBException | IOException e) {
            LOG.error("Execute batch failed, path={}.", this.path, e);
            return new Status(RaftError.EIO, "Fail to write rocksdb at %s: %s", this.path, e.getMessage());
        }
        return Status.OK();
    }

    @Override
    public void shutdown() {
        this.writeLock.lock();
        try {
            if (this.db == null) {
                return;
            }
            releaseResources();
            LOG.info("DB destroyed, the db path is: {}.", this.path);
        } finally {
            this.writeLock.unlock();
        }
    }

    private void releaseResources() {
        if (this.confHandle != null) {
            this.confHandle.close();
            this.confHandle = null;
        }
        if (this.defaultHandle != null) {
            this.defaultHandle.close();
            this.defaultHandle = null;
        }
        if (this.db != null) {
            this.db.close();
            this.db = null;
        }
        for (final ColumnFamilyOptions opt : this.cfOptions) {
            opt.close();
        }
        this.cfOptions.clear();
        if (this.bloomFilter != null) {
            this.bloomFilter.close();
            this.bloomFilter = null;
        }
        if (this.blockCache != null) {
            this.blockCache.close();
            this.blockCache = null;
        }
        if (this.dbOptions != null) {
            this.dbOptions.close();
            this.dbOptions = null;
        }
        if (this.writeOptions != null) {
            this.writeOptions.close();
            this.writeOptions = null;
        }
        if (this.totalOrderReadOptions != null) {
            this.totalOrderReadOptions.close();
            this.totalOrderReadOptions = null;
        }
    }

    @Override
    public long getFirstLogIndex() {
        this.readLock.lock();
        try {
            return this.firstLogIndex;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public long getLastLogIndex() {
        this.readLock.lock();
        try {
            return this.lastLogIndex;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public LogEntry getEntry(final long index) {
        this.readLock.lock();
        try {
            final byte[] bs = getValueBytes(index);
            if (bs == null) {
                return null;
            }
            final LogEntry entry = this.logEntryDecoder.decode(bs);
            if (entry == null) {
                LOG.error("Bad log entry format for index={}, the log data is: {}.", index, BytesUtil.toHex(bs));
            }
            return entry;
        } finally {
            this.readLock.unlock();
        }
    }

    @Override
    public long getTerm(final long index) {
        this.readLock.lock();
        try {
            final byte[] bs = getValueBytes(index);
            if (bs == null) {
                return 0;
            }
            final LogId id = this.logEntryDecoder.decodeId(bs);
            if (id == null) {
                LOG.error("Bad log entry header for index={}.", index);
                return 0;
            }
            return id.getTerm();
        } finally {
            this.readLock.unlock();
        }
    }

    private byte[] getValueBytes(final long index) {
        if (this.db == null || index < this.firstLogIndex || index > this.lastLogIndex) {
            return null;
        }
        try {
            return this.db.get(this.defaultHandle, getKeyBytes(index));
        } catch (final RocksDBException e) {
            LOG.error("Fail to get log entry at index {}, path={}.", index, this.path, e);
            return null;
        }
    }

    protected byte[] getKeyBytes(final long index) {
        final byte[] ks = new byte[8];
        Bits.putLong(ks, 0, index);
        return ks;
    }

    @Override
    public Status appendEntry(final LogEntry entry) {
        if (entry == null || entry.getId() == null) {
            return new Status(RaftError.EINVAL, "Null log entry");
        }
        this.writeLock.lock();
        try {
            final long expectedIndex = this.lastLogIndex + 1;
            if (entry.getId().getIndex() != expectedIndex) {
                return new Status(RaftError.EINVAL, "Expect log index %d but got %d", expectedIndex, entry.getId()
                    .getIndex());
            }
            final long startMs = Utils.monotonicMs();
            final Status st = executeBatch(batch -> batch.put(this.defaultHandle, getKeyBytes(expectedIndex),
                this.logEntryEncoder.encode(entry)));
            if (st.isOk()) {
                this.lastLogIndex = expectedIndex;
                this.metrics.recordLatency("append-logs", Utils.monotonicMs() - startMs);
                this.metrics.recordTimes("append-logs-count", 1);
            }
            return st;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public int appendEntries(final List<LogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        this.writeLock.lock();
        try {
            final long startIndex = this.lastLogIndex + 1;
            int count = 0;
            for (final LogEntry entry : entries) {
                if (entry == null || entry.getId() == null || entry.getId().getIndex() != startIndex + count) {
                    break;
                }
                count++;
            }
            if (count < entries.size()) {
                LOG.warn("Only the first {} of {} entries are contiguous from index {}, path={}.", count,
                    entries.size(), startIndex, this.path);
            }
            if (count == 0) {
                return 0;
            }
            final int validCount = count;
            final long startMs = Utils.monotonicMs();
            final Status st = executeBatch(batch -> {
                for (int i = 0; i < validCount; i++) {
                    final LogEntry entry = entries.get(i);
                    batch.put(this.defaultHandle, getKeyBytes(entry.getId().getIndex()),
                        this.logEntryEncoder.encode(entry));
                }
            });
            if (!st.isOk()) {
                return 0;
            }
            this.lastLogIndex = startIndex + validCount - 1;
            this.metrics.recordLatency("append-logs", Utils.monotonicMs() - startMs);
            this.metrics.recordSize("append-logs-entries", validCount);
            this.metrics.recordTimes("append-logs-count", validCount);
            return validCount;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status truncatePrefix(final long firstIndexKept) {
        this.writeLock.lock();
        try {
            final long startIndex = this.firstLogIndex;
            if (firstIndexKept <= startIndex) {
                return Status.OK();
            }
            final long startMs = Utils.monotonicMs();
            final long endIndex = Math.min(firstIndexKept, this.lastLogIndex + 1);
            final Status st = executeBatch(batch -> {
                batch.put(this.confHandle, FIRST_LOG_IDX_KEY, getKeyBytes(firstIndexKept));
                if (endIndex > startIndex) {
                    batch.deleteRange(this.defaultHandle, getKeyBytes(startIndex), getKeyBytes(endIndex));
                }
            });
            if (st.isOk()) {
                this.firstLogIndex = firstIndexKept;
                if (firstIndexKept > this.lastLogIndex + 1) {
                    this.lastLogIndex = firstIndexKept - 1;
                }
                this.metrics.recordLatency("truncate-log-prefix", Utils.monotonicMs() - startMs);
            } else {
                LOG.error("Fail to truncatePrefix {}, path={}, status={}.", firstIndexKept, this.path, st);
            }
            return st;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status truncateSuffix(final long lastIndexKept) {
        this.writeLock.lock();
        try {
            final long lastIndex = this.lastLogIndex;
            if (lastIndexKept >= lastIndex) {
                return Status.OK();
            }
            if (lastIndexKept < this.firstLogIndex - 1) {
                return new Status(RaftError.EINVAL, "Last index kept %d is before first log index %d",
                    lastIndexKept, this.firstLogIndex);
            }
            final long startMs = Utils.monotonicMs();
            final Status st = executeBatch(batch -> batch.deleteRange(this.defaultHandle,
                getKeyBytes(lastIndexKept + 1), getKeyBytes(lastIndex + 1)));
            if (st.isOk()) {
                this.lastLogIndex = lastIndexKept;
                this.metrics.recordLatency("truncate-log-suffix", Utils.monotonicMs() - startMs);
            } else {
                LOG.error("Fail to truncateSuffix {}, path={}, status={}.", lastIndexKept, this.path, st);
            }
            return st;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public Status reset(final long nextLogIndex) {
        if (nextLogIndex <= 0) {
            return new Status(RaftError.EINVAL, "Invalid next log index %d", nextLogIndex);
        }
        this.writeLock.lock();
        try {
            final long startMs = Utils.monotonicMs();
            final long firstIndex = this.firstLogIndex;
            final long lastIndex = this.lastLogIndex;
            final Status st = executeBatch(batch -> {
                if (lastIndex >= firstIndex) {
                    batch.deleteRange(this.defaultHandle, getKeyBytes(firstIndex), getKeyBytes(lastIndex + 1));
                }
                batch.put(this.confHandle, FIRST_LOG_IDX_KEY, getKeyBytes(nextLogIndex));
            });
            if (st.isOk()) {
                this.firstLogIndex = nextLogIndex;
                this.lastLogIndex = nextLogIndex - 1;
                this.metrics.recordLatency("reset-log", Utils.monotonicMs() - startMs);
                LOG.info("Reset log storage {} to next log index {}.", this.path, nextLogIndex);
            } else {
                LOG.error("Fail to reset next log index to {}, path={}, status={}.", nextLogIndex, this.path, st);
            }
            return st;
        } finally {
            this.writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "RocksDBLogStorage{path=" + this.path + ", opts=" + this.opts + '}';
    }
}
