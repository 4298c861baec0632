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
package com.alipay.sofa.raftstore.option;

import java.util.Map;

import com.alipay.sofa.raftstore.util.Copiable;
import com.alipay.sofa.raftstore.util.SystemPropertyUtil;

/**
 * Durability and transfer options shared by the storage backends.
 * Defaults come from system properties and may be overridden by
 * connection URI parameters.
 */
public class StorageOptions implements Copiable<StorageOptions> {

    public static final String SYNC_KEY                       = "raftstore.sync";
    public static final String SYNC_META_KEY                  = "raftstore.sync_meta";
    public static final String MAX_BYTE_COUNT_PER_RPC_KEY     = "raftstore.max_byte_count_per_rpc";
    public static final String CREATE_PARENT_DIRECTORIES_KEY  = "raftstore.create_parent_directories";
    public static final String ENABLE_METRICS_KEY             = "raftstore.enable_metrics";

    public static final String SYNC_PARAM                     = "sync";
    public static final String SYNC_META_PARAM                = "sync_meta";
    public static final String CREATE_PARENT_DIRECTORIES_PARAM = "create_parent_directories";

    /** fsync log writes */
    private boolean            sync                           = SystemPropertyUtil.getBoolean(SYNC_KEY, true);
    /** fsync raft meta and snapshot meta writes */
    private boolean            syncMeta                       = SystemPropertyUtil.getBoolean(SYNC_META_KEY, true);
    /** chunk size when copying snapshot files */
    private int                maxByteCountPerRpc             = SystemPropertyUtil.getInt(MAX_BYTE_COUNT_PER_RPC_KEY,
                                                                  128 * 1024);
    private boolean            createParentDirectories        = SystemPropertyUtil.getBoolean(
                                                                  CREATE_PARENT_DIRECTORIES_KEY, true);
    private boolean            enableMetrics                  = SystemPropertyUtil.getBoolean(ENABLE_METRICS_KEY,
                                                                  false);

    public static StorageOptions defaults() {
        return new StorageOptions();
    }

    /**
     * Returns a copy of this options with the recognized URI params applied.
     */
    public StorageOptions withParams(final Map<String, String> params) {
        final StorageOptions opts = copy();
        if (params.containsKey(SYNC_PARAM)) {
            opts.setSync(parseBoolean(SYNC_PARAM, params.get(SYNC_PARAM)));
        }
        if (params.containsKey(SYNC_META_PARAM)) {
            opts.setSyncMeta(parseBoolean(SYNC_META_PARAM, params.get(SYNC_META_PARAM)));
        }
        if (params.containsKey(CREATE_PARENT_DIRECTORIES_PARAM)) {
            opts.setCreateParentDirectories(parseBoolean(CREATE_PARENT_DIRECTORIES_PARAM,
                params.get(CREATE_PARENT_DIRECTORIES_PARAM)));
        }
        return opts;
    }

    public static boolean parseBoolean(final String key, final String value) {
        if (value == null || value.isEmpty() || "true".equalsIgnoreCase(value) || "1".equals(value)
            || "yes".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value) || "no".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean value '" + value + "' for param " + key);
    }

    public boolean isSync() {
        return this.sync;
    }

    public void setSync(final boolean sync) {
        this.sync = sync;
    }

    public boolean isSyncMeta() {
        return this.syncMeta;
    }

    public void setSyncMeta(final boolean syncMeta) {
        this.syncMeta = syncMeta;
    }

    public int getMaxByteCountPerRpc() {
        return this.maxByteCountPerRpc;
    }

    public void setMaxByteCountPerRpc(final int maxByteCountPerRpc) {
        this.maxByteCountPerRpc = maxByteCountPerRpc;
    }

    public boolean isCreateParentDirectories() {
        return this.createParentDirectories;
    }

    public void setCreateParentDirectories(final boolean createParentDirectories) {
        this.createParentDirectories = createParentDirectories;
    }

    public boolean isEnableMetrics() {
        return this.enableMetrics;
    }

    public void setEnableMetrics(final boolean enableMetrics) {
        this.enableMetrics = enableMetrics;
    }

    @Override
    public StorageOptions copy() {
        final StorageOptions opts = new StorageOptions();
        opts.sync = this.sync;
        opts.syncMeta = this.syncMeta;
        opts.maxByteCountPerRpc = this.maxByteCountPerRpc;
        opts.createParentDirectories = this.createParentDirectories;
        opts.enableMetrics = this.enableMetrics;
        return opts;
    }

    @Override
    public String toString() {
        return "StorageOptions{sync=" + this.sync + ", syncMeta=" + this.syncMeta + ", maxByteCountPerRpc="
               + this.maxByteCountPerRpc + ", createParentDirectories=" + this.createParentDirectories
               + ", enableMetrics=" + this.enableMetrics + '}';
    }
}
