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

import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileRequest;
import com.alipay.sofa.raftstore.rpc.RpcRequests.GetFileResponse;
import com.alipay.sofa.raftstore.util.Endpoint;
import com.google.protobuf.Message;

/**
 * Client side of the snapshot file transfer. Copy sessions pull snapshot
 * chunks through it; the transport behind it is pluggable.
 */
public interface FileClientService {

    /**
     * Prepares a channel to the given endpoint.
     *
     * @param endpoint server address
     * @return true when the endpoint is reachable
     */
    boolean connect(final Endpoint endpoint);

    /**
     * Reads one chunk of a remote snapshot file. The closure is always run
     * unless the returned future is cancelled first.
     *
     * @param endpoint  server address
     * @param request   chunk request
     * @param timeoutMs rpc timeout in milliseconds
     * @param done      callback
     * @return a future of the response message
     */
    Future<Message> getFile(final Endpoint endpoint, final GetFileRequest request, final int timeoutMs,
                            final RpcResponseClosure<GetFileResponse> done);
}
