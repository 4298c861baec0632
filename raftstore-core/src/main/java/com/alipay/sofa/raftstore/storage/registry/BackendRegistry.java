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

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.storage.Storage;
import com.alipay.sofa.raftstore.util.Requires;

/**
 * Maps URI schemes to backend prototypes of one storage kind.
 *
 * @param <T> the storage kind
 */
public class BackendRegistry<T extends Storage<T>> {

    private static final Logger           LOG        = LoggerFactory.getLogger(BackendRegistry.class);

    private final String                  kind;
    private final ConcurrentMap<String, T> prototypes = new ConcurrentHashMap<>();

    public BackendRegistry(final String kind) {
        this.kind = kind;
    }

    /**
     * Registers a prototype under a scheme, replacing any earlier one.
     */
    public void register(final String scheme, final T prototype) {
        Requires.requireNonNull(scheme, "scheme");
        Requires.requireNonNull(prototype, "prototype");
        final T prev = this.prototypes.put(scheme, prototype);
        if (prev != null && prev != prototype) {
            LOG.warn("Replaced {} backend for scheme {}: {} -> {}.", this.kind, scheme, prev.getClass().getName(),
                prototype.getClass().getName());
        } else {
            LOG.debug("Registered {} backend for scheme {}: {}.", this.kind, scheme, prototype.getClass().getName());
        }
    }

    public T unregister(final String scheme) {
        return this.prototypes.remove(scheme);
    }

    public T getPrototype(final String scheme) {
        return this.prototypes.get(scheme);
    }

    public Set<String> schemes() {
        return new TreeSet<>(this.prototypes.keySet());
    }

    /**
     * Resolves a connection URI to a new uninitialized backend instance.
     *
     * @throws IllegalArgumentException on a malformed URI or an unknown scheme
     */
    public T create(final String uri) {
        final StorageUri parsed = StorageUri.parse(uri);
        final T prototype = this.prototypes.get(parsed.getScheme());
        if (prototype == null) {
            throw new IllegalArgumentException("Unknown " + this.kind + " scheme '" + parsed.getScheme()
                                               + "' in uri " + uri + ", registered: " + schemes());
        }
        final T instance = prototype.newInstance(uri);
        if (instance == null) {
            throw new IllegalArgumentException("Fail to create " + this.kind + " from uri " + uri);
        }
        return instance;
    }
}
