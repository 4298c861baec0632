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
package com.alipay.sofa.raftstore.storage.snapshot.remote;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.option.CopyOptions;
import com.alipay.sofa.raftstore.rpc.FileClientService;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.storage.SnapshotThrottle;
import com.alipay.sofa.raftstore.storage.io.PosixFileSystemAdaptor;
import com.alipay.sofa.raftstore.util.ByteBufferCollector;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.TimerManager;
import com.google.protobuf.ByteString;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CopySessionTest {

    @TempDir
    Path                      tempDir;

    private FileClientService client;
    private TimerManager      timerManager;
    private CopySession       session;
    private final Endpoint    endpoint = new Endpoint("127.0.0.1", 8081);

    @BeforeEach
    public void setup() {
        this.client = mock(FileClientService.class);
        this.timerManager = new TimerManager();
        this.timerManager.init(1);
        this.session = newSession(null);
    }

    @AfterEach
    public void teardown() {
        this.timerManager.shutdown();
    }

    private CopySession newSession(final SnapshotThrottle throttle) {
        final CopySession copySession = new CopySession(this.client, this.timerManager, throttle, 16,
            GetFileRequest.newBuilder().setReaderId(99).setFilename("data"), this.endpoint);
        final CopyOptions opts = new CopyOptions();
        opts.setMaxRetry(3);
        opts.setRetryIntervalMs(10);
        copySession.setCopyOptions(opts);
        return copySession;
    }

    private static GetFileResponse response(final String data, final boolean eof) {
        return GetFileResponse.newBuilder() //
            .setData(ByteString.copyFromUtf8(data)) //
            .setEof(eof) //
            .setReadSize(data.length()) //
            .build();
    }

    private List<GetFileRequest> sentRequests(final int count) {
        final ArgumentCaptor<GetFileRequest> captor = ArgumentCaptor.forClass(GetFileRequest.class);
        verify(this.client, times(count)).getFile(any(), captor.capture(), anyInt(), any());
        return captor.getAllValues();
    }

    @Test
    public void testCopyToBuffer() throws Exception {
        final ByteBufferCollector buf = ByteBufferCollector.allocate(0);
        this.session.setDestBuf(buf);
        this.session.sendNextRpc();

        final GetFileRequest first = sentRequests(1).get(0);
        assertEquals(99, first.getReaderId());
        assertEquals("data", first.getFilename());
        assertEquals(0, first.getOffset());
        assertEquals(Integer.MAX_VALUE, first.getCount());
        assertTrue(first.getReadPartly());

        this.session.onRpcReturned(Status.OK(), response("hello", true));
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertTrue(this.session.status().isOk());
        assertEquals(5, this.session.getCopiedBytes());
        final ByteBuffer data = buf.getBuffer();
        assertEquals(5, data.remaining());
        assertEquals("hello", StandardCharsets.UTF_8.decode(data).toString());
    }

    @Test
    public void testCopyToFileInChunks() throws Exception {
        final File dest = new File(this.tempDir.toFile(), "data");
        this.session.setDestPath(dest.getAbsolutePath());
        this.session.setOutputFile(PosixFileSystemAdaptor.getInstance().open(dest.getAbsolutePath(), true, true));
        this.session.sendNextRpc();

        this.session.onRpcReturned(Status.OK(), response("0123456789", false));
        this.session.onRpcReturned(Status.OK(), response("ab", true));
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertTrue(this.session.status().isOk());
        assertEquals(12, this.session.getCopiedBytes());
        assertEquals("0123456789ab", FileUtils.readFileToString(dest, StandardCharsets.UTF_8));

        final List<GetFileRequest> requests = sentRequests(2);
        assertEquals(0, requests.get(0).getOffset());
        assertEquals(16, requests.get(0).getCount());
        assertEquals(10, requests.get(1).getOffset());
        assertEquals(16, requests.get(1).getCount());
    }

    @Test
    public void testRetryUntilMaxRetry() throws Exception {
        this.session.setDestBuf(ByteBufferCollector.allocate(0));
        this.session.sendNextRpc();
        this.session.onRpcReturned(new Status(RaftError.EIO, "broken pipe"), null);
        assertEquals(1, this.session.getRetryTimes());
        assertFalse(this.session.join(20, TimeUnit.MILLISECONDS));
        // the retry is sent from the timer
        verify(this.client, timeout(5000).times(2)).getFile(any(), any(), anyInt(), any());

        this.session.onRpcReturned(new Status(RaftError.EIO, "broken pipe"), null);
        this.session.onRpcReturned(new Status(RaftError.EIO, "broken pipe"), null);
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertEquals(RaftError.EIO, this.session.status().getRaftError());
        assertEquals("broken pipe", this.session.status().getErrorMsg());
    }

    @Test
    public void testEagainIsNotCounted() throws Exception {
        this.session.setDestBuf(ByteBufferCollector.allocate(0));
        this.session.sendNextRpc();
        for (int i = 0; i < 10; i++) {
            this.session.onRpcReturned(new Status(RaftError.EAGAIN, "busy"), null);
        }
        assertEquals(0, this.session.getRetryTimes());
        assertFalse(this.session.join(20, TimeUnit.MILLISECONDS));

        this.session.cancel();
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertEquals(RaftError.ECANCELED, this.session.status().getRaftError());
    }

    @Test
    public void testSuccessResetsRetryCount() throws Exception {
        this.session.setDestBuf(ByteBufferCollector.allocate(0));
        this.session.sendNextRpc();
        this.session.onRpcReturned(new Status(RaftError.EIO, "broken pipe"), null);
        this.session.onRpcReturned(new Status(RaftError.EIO, "broken pipe"), null);
        assertEquals(2, this.session.getRetryTimes());
        this.session.onRpcReturned(Status.OK(), response("abc", false));
        assertEquals(0, this.session.getRetryTimes());
        this.session.cancel();
    }

    @Test
    public void testCanceledResponseFinishesAtOnce() throws Exception {
        this.session.setDestBuf(ByteBufferCollector.allocate(0));
        this.session.sendNextRpc();
        this.session.onRpcReturned(new Status(RaftError.ECANCELED, "stopped by peer"), null);
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertEquals(RaftError.ECANCELED, this.session.status().getRaftError());
        // late responses are dropped
        this.session.onRpcReturned(Status.OK(), response("late", true));
        assertEquals(0, this.session.getCopiedBytes());
    }

    @Test
    public void testThrottledRequestIsDelayed() throws Exception {
        final SnapshotThrottle throttle = mock(SnapshotThrottle.class);
        when(throttle.throttledByThroughput(anyLong())).thenReturn(0L);
        this.session = newSession(throttle);
        this.session.setDestBuf(ByteBufferCollector.allocate(0));
        this.session.sendNextRpc();
        verify(this.client, never()).getFile(any(), any(), anyInt(), any());
        assertNotNull(this.session.getTimer());
        verify(throttle, timeout(5000).atLeast(2)).throttledByThroughput(anyLong());

        this.session.cancel();
        assertTrue(this.session.join(1, TimeUnit.SECONDS));
        assertEquals(RaftError.ECANCELED, this.session.status().getRaftError());
    }
}
