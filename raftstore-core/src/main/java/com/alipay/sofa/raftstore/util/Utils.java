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
package com.alipay.sofa.raftstore.util;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper methods for storage implementations.
 */
public final class Utils {

    private static final Logger            LOG                  = LoggerFactory.getLogger(Utils.class);

    /**
     * The configured number of available processors. The default is
     * {@link Runtime#availableProcessors()}. This can be overridden by setting the system property
     * "raftstore.available_processors".
     */
    private static final int               CPUS                 = SystemPropertyUtil.getInt(
                                                                    "raftstore.available_processors", Runtime
                                                                        .getRuntime().availableProcessors());

    /**
     * Default max threads of the closure executor, it's used to run copy jobs and sessions.
     */
    public static final int                MAX_CLOSURE_THREADS  = SystemPropertyUtil.getInt(
                                                                    "raftstore.closure.threadpool.size.max",
                                                                    Math.max(100, cpus() * 5));

    /**
     * ANY IP address 0.0.0.0
     */
    public static final String             IP_ANY               = "0.0.0.0";

    private static final boolean           IS_WINDOWS           = SystemPropertyUtil.get("os.name", "")
                                                                    .toLowerCase().startsWith("windows");

    /**
     * Global thread pool to run closures and copy jobs.
     */
    private static final ThreadPoolExecutor CLOSURE_EXECUTOR    = new ThreadPoolExecutor(cpus(),
                                                                    MAX_CLOSURE_THREADS, 60L, TimeUnit.SECONDS,
                                                                    new LinkedBlockingQueue<>(),
                                                                    new NamedThreadFactory(
                                                                        "RaftStore-Closure-Executor-", true));

    static {
        CLOSURE_EXECUTOR.allowCoreThreadTimeOut(true);
    }

    /**
     * Get system CPUs count.
     */
    public static int cpus() {
        return CPUS;
    }

    /**
     * Run a task in thread pool, returns the future object.
     */
    public static Future<?> runInThread(final Runnable runnable) {
        return CLOSURE_EXECUTOR.submit(runnable);
    }

    /**
     * Close a closeable.
     */
    public static int closeQuietly(final Closeable closeable) {
        if (closeable == null) {
            return 0;
        }
        try {
            closeable.close();
            return 0;
        } catch (final IOException e) {
            LOG.error("Fail to close {}.", closeable, e);
            return -1;
        }
    }

    /**
     * Gets the current monotonic time in milliseconds.
     */
    public static long monotonicMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    /**
     * Gets the current monotonic time in microseconds.
     */
    public static long monotonicUs() {
        return TimeUnit.NANOSECONDS.toMicros(System.nanoTime());
    }

    /**
     * Get string bytes in UTF-8 charset.
     */
    public static byte[] getBytes(final String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    public static boolean isWindows() {
        return IS_WINDOWS;
    }

    /**
     * Get current process id, or the fallback value when it can't be resolved.
     */
    public static long getProcessId(final long fallback) {
        // Note: may fail in some JVM implementations
        // therefore fallback has to be provided
        final String jvmName = ManagementFactory.getRuntimeMXBean().getName();
        final int index = jvmName.indexOf('@');

        if (index < 1) {
            // part before '@' empty (index = 0) / '@' not found (index = -1)
            return fallback;
        }

        try {
            return Long.parseLong(jvmName.substring(0, index));
        } catch (final NumberFormatException e) {
            // ignore
        }
        return fallback;
    }

    /**
     * Atomically move one file to another file.
     *
     * @param source the source file
     * @param target the target file
     * @param sync   whether to fsync the parent directory after moving
     * @return true if success
     * @throws IOException if the move fails, including when the file system can't move atomically
     */
    public static boolean atomicMoveFile(final File source, final File target, final boolean sync)
                                                                                                  throws IOException {
        // Move temp file to target path atomically.
        // The code comes from
        // https://github.com/jenkinsci/jenkins/blob/master/core/src/main/java/hudson/util/AtomicFileWriter.java#L187
        Requires.requireNonNull(source, "source");
        Requires.requireNonNull(target, "target");
        Files.move(source.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE);
        if (sync) {
            fsync(target.getAbsoluteFile().getParentFile());
        }
        return true;
    }

    /**
     * Calls fsync on a file or directory.
     *
     * @param file file or directory
     * @throws IOException if an I/O error occurs
     */
    public static void fsync(final File file) throws IOException {
        final boolean isDir = file.isDirectory();
        // can't fsync on windows.
        if (isDir && isWindows()) {
            LOG.warn("Unable to fsync directory {} on windows.", file);
            return;
        }
        try (final FileChannel fc = FileChannel.open(file.toPath(), isDir ? StandardOpenOption.READ
            : StandardOpenOption.WRITE)) {
            fc.force(true);
        }
    }

    private Utils() {
    }
}
