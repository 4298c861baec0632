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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

/**
 * A parsed storage connection URI: {@code scheme://path[?key=value[&key=value...]]}.
 */
public final class StorageUri {

    private static final String       SCHEME_SEPARATOR = "://";

    private final String              scheme;
    private final String              path;
    private final Map<String, String> params;

    private StorageUri(final String scheme, final String path, final Map<String, String> params) {
        this.scheme = scheme;
        this.path = path;
        this.params = Collections.unmodifiableMap(params);
    }

    /**
     * Parses a connection URI.
     *
     * @throws IllegalArgumentException if the URI has no scheme or a malformed parameter list
     */
    public static StorageUri parse(final String uri) {
        if (StringUtils.isBlank(uri)) {
            throw new IllegalArgumentException("Blank storage uri");
        }
        final int schemeEnd = uri.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd <= 0) {
            throw new IllegalArgumentException("Missing scheme in storage uri: " + uri);
        }
        final String scheme = uri.substring(0, schemeEnd).trim();
        if (scheme.isEmpty() || !StringUtils.isAlphanumeric(scheme.replace('-', 'a').replace('_', 'a'))) {
            throw new IllegalArgumentException("Invalid scheme in storage uri: " + uri);
        }
        String rest = uri.substring(schemeEnd + SCHEME_SEPARATOR.length());
        final Map<String, String> params = new LinkedHashMap<>();
        final int queryStart = rest.indexOf('?');
        if (queryStart >= 0) {
            final String query = rest.substring(queryStart + 1);
            rest = rest.substring(0, queryStart);
            for (final String pair : StringUtils.split(query, '&')) {
                final int eq = pair.indexOf('=');
                final String key = (eq < 0 ? pair : pair.substring(0, eq)).trim();
                if (key.isEmpty()) {
                    throw new IllegalArgumentException("Empty param name in storage uri: " + uri);
                }
                params.put(key, eq < 0 ? "" : pair.substring(eq + 1).trim());
            }
        }
        return new StorageUri(scheme, rest, params);
    }

    /**
     * Returns the path of a URI, everything between the scheme and the parameters.
     */
    public static String parsePath(final String uri) {
        return parse(uri).getPath();
    }

    public String getScheme() {
        return this.scheme;
    }

    public String getPath() {
        return this.path;
    }

    public Map<String, String> getParams() {
        return this.params;
    }

    public String getParam(final String key) {
        return this.params.get(key);
    }

    public boolean hasParam(final String key) {
        return this.params.containsKey(key);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(this.scheme).append(SCHEME_SEPARATOR).append(this.path);
        char sep = '?';
        for (final Map.Entry<String, String> param : this.params.entrySet()) {
            sb.append(sep).append(param.getKey()).append('=').append(param.getValue());
            sep = '&';
        }
        return sb.toString();
    }
}
