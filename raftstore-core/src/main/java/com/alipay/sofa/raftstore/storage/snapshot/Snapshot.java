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
package com.alipay.sofa.raftstore.storage.snapshot;

import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;

/**
 * Represents a state machine snapshot: a directory-like set of files plus
 * the raft metadata. The outcome of the operations done on it is kept in
 * {@link #status()}.
 */
public abstract class Snapshot {

    private static final Logger LOG                        = LoggerFactory.getLogger(Snapshot.class);

    /**
     * Snapshot metadata file name.
     */
    public static final String  JRAFT_SNAPSHOT_META_FILE   = "__raft_snapshot_meta";
    /**
     * Snapshot file prefix.
     */
    public static final String  JRAFT_SNAPSHOT_PREFIX      = "snapshot_";
    /** Snapshot uri scheme for remote peer */
    public static final String  REMOTE_SNAPSHOT_URI_SCHEME = "remote://";

    private final Status        status                     = Status.OK();

    /**
     * Get the path of the Snapshot
     */
    public abstract String getPath();

    /**
     * List all the existing files in the Snapshot currently
     */
    public abstract Set<String> listFiles();

    /**
     * Get file meta by fileName, the record kept by the backend or null
     * if the file is not in the snapshot.
     */
    public abstract Message getFileMeta(final String fileName);

    /**
     * Get file meta by fileName as the caller's message type. Returns the
     * default instance of the template type when the file is absent or has
     * no meta readable as that type.
     *
     * @param fileName file name
     * @param template any instance of the expected type
     */
    @SuppressWarnings("unchecked")
    public <T extends Message> T getFileMeta(final String fileName, final T template) {
        final T defaultMeta = (T) template.getDefaultInstanceForType();
        final Message meta = getFileMeta(fileName);
        if (meta == null) {
            return defaultMeta;
        }
        if (defaultMeta.getClass().isInstance(meta)) {
            return (T) meta;
        }
        try {
            return (T) defaultMeta.getParserForType().parseFrom(meta.toByteString());
        } catch (final InvalidProtocolBufferException e) {
            LOG.warn("File meta of {} is not a {}.", fileName, defaultMeta.getDescriptorForType().getFullName(), e);
            return defaultMeta;
        }
    }

    public Status status() {
        return this.status;
    }

    public boolean isOk() {
        return this.status.isOk();
    }

    public void setError(final RaftError error, final String fmt, final Object... args) {
        this.status.setError(error, fmt, args);
    }

    public void setError(final int code, final String fmt, final Object... args) {
        this.status.setError(code, fmt, args);
    }
}
