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
 * {@code messages.deleteHistory}: clears the history of a one-to-one dialog.
 */
public record DeleteHistoryRequest(boolean justClear, boolean revoke, InputPeer peer, int maxId)
        implements RpcRequest<AffectedHistory> {

    public static final String METHOD = "messages.deleteHistory";

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public Class<AffectedHistory> responseType() {
        return AffectedHistory.class;
    }
}
