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
package com.alipay.sofa.raftstore.rpc;

import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.alipay.sofa.raftstore.Status;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.storage.FileService;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.alipay.sofa.raftstore.util.Utils;
import com.google.protobuf.Message;

/**
 * In-process {@link FileClientService} served by a {@link FileService}.
 * Every request runs on the closure executor, so callbacks never run on the
 * caller's thread.
 */
public class LocalFileClientService implements FileClientService {

    private static final Logger                 LOG      = LoggerFactory.getLogger(LocalFileClientService.class);

    private static final LocalFileClientService INSTANCE = new LocalFileClientService(FileService.getInstance());

    private final FileService                   fileService;

    public static LocalFileClientService getInstance() {
        return INSTANCE;
    }

    public LocalFileClientService(final FileService fileService) {
        this.fileService = fileService;
    }

    @Override
    public boolean connect(final Endpoint endpoint) {
        if (endpoint == null || endpoint.getPort() <= 0) {
            LOG.error("Invalid endpoint to connect: {}.", endpoint);
            return false;
        }
        return true;
    }

    @Override
    public Future<Message> getFile(final Endpoint endpoint, final GetFileRequest request, final int timeoutMs,
                                   final RpcResponseClosure<GetFileResponse> done) {
        final FutureTask<Message> task = new FutureTask<>(() -> {
            final Status st = new Status();
            final GetFileResponse response = this.fileService.handleGetFile(request, st);
            if (response != null) {
                done.setResponse(response);
            }
            done.run(st);
            return response;
        });
        Utils.runInThread(task);
        return task;
    }
}
