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

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.error.RaftError;
import com.alipay.sofa.raftstore.error.RetryAgainException;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.storage.io.FileReader;
import com.alipay.sofa.raftstore.storage.io.LocalDirReader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class FileServiceTest {

    @TempDir
    Path                tempDir;

    private FileService fileService;
    private long        readerId;
    private String      content;

    @BeforeEach
    public void setup() throws Exception {
        this.fileService = FileService.getInstance();
        this.fileService.clear();
        this.content = StringUtils.repeat("0123456789", 10);
        FileUtils.writeStringToFile(new File(this.tempDir.toFile(), "data"), this.content, StandardCharsets.UTF_8);
        this.readerId = this.fileService.addReader(new LocalDirReader(this.tempDir.toString()));
        assertTrue(this.readerId > 0);
    }

    @AfterEach
    public void teardown() {
        this.fileService.clear();
    }

    private GetFileRequest request(final long readerId, final String filename, final long offset, final long count) {
        return GetFileRequest.newBuilder() //
            .setReaderId(readerId) //
            .setFilename(filename) //
            .setOffset(offset) //
            .setCount(count) //
            .setReadPartly(true) //
            .build();
    }

    @Test
    public void testReadInChunks() {
        final Status st = new Status();
        final GetFileResponse first = this.fileService.handleGetFile(request(this.readerId, "data", 0, 16), st);
        assertTrue(st.isOk());
        assertFalse(first.getEof());
        assertEquals(16, first.getReadSize());
        assertEquals(this.content.substring(0, 16), first.getData().toStringUtf8());

        final GetFileResponse last = this.fileService.handleGetFile(request(this.readerId, "data", 96, 16), st);
        assertTrue(st.isOk());
        assertTrue(last.getEof());
        assertEquals("6789", last.getData().toStringUtf8());
    }

    @Test
    public void testReadWholeFile() {
        final Status st = new Status();
        final GetFileResponse response = this.fileService.handleGetFile(
            request(this.readerId, "data", 0, Integer.MAX_VALUE), st);
        assertTrue(st.isOk());
        assertTrue(response.getEof());
        assertEquals(this.content, response.getData().toStringUtf8());
    }

    @Test
    public void testReadPastEnd() {
        final Status st = new Status();
        final GetFileResponse response = this.fileService.handleGetFile(request(this.readerId, "data", 200, 16), st);
        assertTrue(st.isOk());
        assertTrue(response.getEof());
        assertTrue(response.getData().isEmpty());
    }

    @Test
    public void testInvalidRequest() {
        final Status st = new Status();
        assertNull(this.fileService.handleGetFile(request(this.readerId, "data", 0, 0), st));
        assertEquals(RaftError.EINVAL, st.getRaftError());

        final Status negative = new Status();
        assertNull(this.fileService.handleGetFile(request(this.readerId, "data", -1, 16), negative));
        assertEquals(RaftError.EINVAL, negative.getRaftError());
    }

    @Test
    public void testUnknownReaderAndFile() {
        final Status st = new Status();
        assertNull(this.fileService.handleGetFile(request(this.readerId + 1000, "data", 0, 16), st));
        assertEquals(RaftError.ENOENT, st.getRaftError());

        final Status missing = new Status();
        assertNull(this.fileService.handleGetFile(request(this.readerId, "missing", 0, 16), missing));
        assertEquals(RaftError.EIO, missing.getRaftError());
    }

    @Test
    public void testThrottledRead() throws Exception {
        final FileReader reader = mock(FileReader.class);
        when(reader.getPath()).thenReturn("/throttled");
        when(reader.readFile(any(), anyString(), anyLong(), anyLong())).thenThrow(
            new RetryAgainException("throttled"));
        final long id = this.fileService.addReader(reader);
        final Status st = new Status();
        assertNull(this.fileService.handleGetFile(request(id, "data", 0, 16), st));
        assertEquals(RaftError.EAGAIN, st.getRaftError());
    }

    @Test
    public void testRemoveReader() {
        assertEquals(1, this.fileService.readerCount());
        assertTrue(this.fileService.removeReader(this.readerId));
        assertFalse(this.fileService.removeReader(this.readerId));
        assertEquals(0, this.fileService.readerCount());
        final Status st = new Status();
        assertNull(this.fileService.handleGetFile(request(this.readerId, "data", 0, 16), st));
        assertEquals(RaftError.ENOENT, st.getRaftError());
        assertNotNull(st.getErrorMsg());
    }
}
