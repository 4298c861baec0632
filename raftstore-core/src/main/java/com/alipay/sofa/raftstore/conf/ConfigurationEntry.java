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
package com.alipay.sofa.raftstore.conf;

import java.util.HashSet;
import java.util.Set;

import com.alipay.sofa.raftstore.entity.LogEntry;
import com.alipay.sofa.raftstore.entity.LogId;
import com.alipay.sofa.raftstore.entity.PeerId;

/**
 * A configuration entry with current peers and old peers.
 */
public class ConfigurationEntry {

    private LogId         id      = new LogId(0, 0);
    private Configuration conf    = new Configuration();
    private Configuration oldConf = new Configuration();

    public ConfigurationEntry() {
        super();
    }

    public ConfigurationEntry(final LogId id, final Configuration conf, final Configuration oldConf) {
        super();
        this.id = id;
        this.conf = conf;
        this.oldConf = oldConf;
    }

    /**
     * Builds the entry carried by a configuration log entry.
     *
     * @param entry a log entry of type ENTRY_TYPE_CONFIGURATION
     * @return configuration entry
     */
    public static ConfigurationEntry fromLogEntry(final LogEntry entry) {
        final ConfigurationEntry confEntry = new ConfigurationEntry();
        confEntry.setId(new LogId(entry.getId().getIndex(), entry.getId().getTerm()));
        confEntry.setConf(new Configuration(entry.getPeers()));
        if (entry.getOldPeers() != null) {
            confEntry.setOldConf(new Configuration(entry.getOldPeers()));
        }
        return confEntry;
    }

    public LogId getId() {
        return this.id;
    }

    public void setId(final LogId id) {
        this.id = id;
    }

    public Configuration getConf() {
        return this.conf;
    }

    public void setConf(final Configuration conf) {
        this.conf = conf;
    }

    public Configuration getOldConf() {
        return this.oldConf;
    }

    public void setOldConf(final Configuration oldConf) {
        this.oldConf = oldConf;
    }

    public boolean isStable() {
        return this.oldConf.isEmpty();
    }

    public boolean isEmpty() {
        return this.conf.isEmpty();
    }

    public Set<PeerId> listPeers() {
        final Set<PeerId> ret = new HashSet<>(this.conf.listPeers());
        ret.addAll(this.oldConf.listPeers());
        return ret;
    }

    public boolean contains(final PeerId peer) {
        return this.conf.contains(peer) || this.oldConf.contains(peer);
    }

    @Override
    public String toString() {
        return "ConfigurationEntry [id=" + this.id + ", conf=" + this.conf + ", oldConf=" + this.oldConf + "]";
    }
}
