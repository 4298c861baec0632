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
package com.alipay.sofa.raftstore.error;

import java.util.HashMap;
import java.util.Map;

/**
 * Storage error code.
 */
public enum RaftError {

    /**
     * Unknown error
     */
    UNKNOWN(-1),

    /**
     * Success, no error.
     */
    SUCCESS(0),

    /**
     * Try again later, for example when a chunk read is throttled.
     */
    EAGAIN(1002),

    /**
     * Internal exception
     */
    EINTERNAL(1004),

    /**
     * Task is canceled
     */
    ECANCELED(1005),

    /**
     * Device or resource busy, for example a second live snapshot writer.
     */
    EBUSY(1009),

    /**
     * No such file or directory
     */
    ENOENT(1012),

    /**
     * File exists
     */
    EEXISTS(1013),

    /**
     * I/O error
     */
    EIO(1014),

    /**
     * Invalid argument
     */
    EINVAL(1015),

    /**
     * Persisted data fails its structural or consistency checks.
     */
    ECORRUPTED(1017),

    /**
     * Operation not supported by this backend.
     */
    ENOTSUP(1018);

    private static final Map<Integer, RaftError> RAFT_ERROR_MAP = new HashMap<>();

    static {
        for (final RaftError error : RaftError.values()) {
            RAFT_ERROR_MAP.put(error.getNumber(), error);
        }
    }

    public final int getNumber() {
        return this.value;
    }

    public static RaftError forNumber(final int value) {
        return RAFT_ERROR_MAP.getOrDefault(value, UNKNOWN);
    }

    public static String describeCode(final int code) {
        RaftError e = forNumber(code);
        return e != null ? e.name() : "<Unknown:" + code + ">";
    }

    private final int value;

    RaftError(final int value) {
        this.value = value;
    }
}
