package me.golemcore.dialogs.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.dialogs.domain.model.RpcRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the single network primitive the dialog engine consumes. Framing,
 * encryption and retries are the implementation's concern.
 */
public interface RpcTransportPort {

    /**
     * Sends a request and decodes the reply into the request's result type.
     *
     * @return future completing with the result, or failing with
     *         {@link me.golemcore.dialogs.domain.model.RpcInvocationException}
     *         for transport or server errors and with
     *         {@link me.golemcore.dialogs.domain.model.ProtocolContractViolationException}
     *         for replies that cannot be decoded into a known variant.
     *         Cancelling the future abandons the call.
     */
    <R> CompletableFuture<R> invoke(RpcRequest<R> request);
}
