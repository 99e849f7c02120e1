package me.golemcore.dialogs.domain.model;

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

/**
 * Remote procedure call with a typed result. Implementations are plain data
 * and are serialized as-is by the transport.
 *
 * @param <R>
 *            result type the transport decodes the reply into
 */
public interface RpcRequest<R> {

    /**
     * Platform method name, e.g. {@code messages.getDialogs}.
     */
    String method();

    Class<R> responseType();
}
