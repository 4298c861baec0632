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

import java.util.HashMap;
import java.util.Map;

import com.alipay.sofa.raftstore.entity.LocalFileMetaOutter.LocalFileMeta;
import com.alipay.sofa.raftstore.entity.LocalStorageOutter.LocalSnapshotPbMeta;
import com.alipay.sofa.raftstore.entity.LocalStorageOutter.StablePBMeta;
import com.alipay.sofa.raftstore.entity.RaftOutter.SnapshotMeta;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;

/**
 * Creates protobuf messages by their full descriptor name.
 */
public final class ProtobufMsgFactory {

    private static final Map<String, Parser<? extends Message>> PARSE_METHODS_4PROTO = new HashMap<>();

    static {
        register(StablePBMeta.getDefaultInstance());
        register(LocalSnapshotPbMeta.getDefaultInstance());
        register(LocalFileMeta.getDefaultInstance());
        register(SnapshotMeta.getDefaultInstance());
        register(RpcRequests.GetFileRequest.getDefaultInstance());
        register(RpcRequests.GetFileResponse.getDefaultInstance());
    }

    private static synchronized void register(final Message defaultInstance) {
        PARSE_METHODS_4PROTO.put(defaultInstance.getDescriptorForType().getFullName(),
            defaultInstance.getParserForType());
    }

    @SuppressWarnings("unchecked")
    public static synchronized <T extends Message> T newMessageByProtoClassName(final String className,
                                                                                final byte[] bs) {
        final Parser<? extends Message> parser = PARSE_METHODS_4PROTO.get(className);
        if (parser == null) {
            throw new MessageClassNotFoundException(className + " not found");
        }
        try {
            return (T) parser.parseFrom(bs);
        } catch (final InvalidProtocolBufferException e) {
            throw new SerializationException(e);
        }
    }

    /**
     * Unknown message name.
     */
    public static class MessageClassNotFoundException extends RuntimeException {

        private static final long serialVersionUID = 4684584394785943114L;

        public MessageClassNotFoundException(final String message) {
            super(message);
        }
    }

    /**
     * Undecodable message body.
     */
    public static class SerializationException extends RuntimeException {

        private static final long serialVersionUID = 6170357389498466398L;

        public SerializationException(final Throwable cause) {
            super(cause);
        }
    }

    private ProtobufMsgFactory() {
    }
}
