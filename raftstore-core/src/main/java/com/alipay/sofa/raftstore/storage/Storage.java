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

/**
 * A storage backend resolvable from a connection URI.
 *
 * @param <T> the storage kind
 */
public interface Storage<T> {

    /**
     * Creates a fresh, uninitialized instance of this backend configured
     * by the given connection URI.
     *
     * @param uri connection URI, {@code scheme://path[?key=value&...]}
     * @return the new instance
     * @throws IllegalArgumentException if the URI params are invalid for this backend
     */
    T newInstance(final String uri);
}
