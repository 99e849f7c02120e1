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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Mutable request template for {@code messages.getDialogs}, doubling as the
 * pagination cursor of a {@code DialogIterator}. Offsets point at the oldest
 * dialog seen so far; the server returns dialogs strictly older than it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GetDialogsRequest implements RpcRequest<DialogsResponse> {

    public static final String METHOD = "messages.getDialogs";

    private boolean excludePinned;
    private Integer folderId;
    private int offsetDate;
    private int offsetId;

    @Builder.Default
    private InputPeer offsetPeer = new InputPeer.Empty();

    private int limit;

    // Always 0: no cached dialog list is ever offered to the server
    private long hash;

    /**
     * Cursor positioned before the first page.
     */
    public static GetDialogsRequest initial() {
        return GetDialogsRequest.builder().build();
    }

    /**
     * Detached copy, so the request in flight is unaffected by later cursor
     * updates.
     */
    public GetDialogsRequest snapshot() {
        return toBuilder().build();
    }

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public Class<DialogsResponse> responseType() {
        return DialogsResponse.class;
    }
}
