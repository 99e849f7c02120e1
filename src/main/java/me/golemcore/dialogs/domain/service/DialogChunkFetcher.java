package me.golemcore.dialogs.domain.service;

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

import me.golemcore.dialogs.domain.model.DialogsResponse;
import me.golemcore.dialogs.domain.model.EntitySet;
import me.golemcore.dialogs.domain.model.GetDialogsRequest;
import me.golemcore.dialogs.domain.model.ProtocolContractViolationException;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Performs a single {@code messages.getDialogs} round trip and classifies the
 * reply. Holds no pagination state of its own.
 */
@Slf4j
@RequiredArgsConstructor
public class DialogChunkFetcher {

    @NonNull
    private final RpcTransportPort transport;

    /**
     * Fetches one page starting at the cursor's offsets. The cursor itself is
     * not modified; a detached copy with the given limit is sent instead.
     */
    public CompletableFuture<DialogChunk> fetch(GetDialogsRequest cursor, int limit) {
        GetDialogsRequest request = cursor.snapshot();
        request.setLimit(limit);
        log.debug("[Dialogs] Fetching page: limit={}, offsetDate={}, offsetId={}, offsetPeer={}",
                limit, request.getOffsetDate(), request.getOffsetId(), request.getOffsetPeer());

        CompletableFuture<DialogsResponse> call = transport.invoke(request);
        CompletableFuture<DialogChunk> chunk = call.thenApply(response -> classify(request, response));
        chunk.whenComplete((ignored, error) -> {
            if (chunk.isCancelled()) {
                call.cancel(true);
            }
        });
        return chunk;
    }

    static DialogChunk classify(GetDialogsRequest request, DialogsResponse response) {
        if (response == null) {
            throw new ProtocolContractViolationException("Transport returned no dialogs response");
        }
        return switch (response.kind()) {
        case FULL -> {
            DialogsResponse.Full full = (DialogsResponse.Full) response;
            EntitySet entities = EntitySet.of(full.users(), full.chats());
            log.debug("[Dialogs] Received full list of {} dialogs, {} entities",
                    full.dialogs().size(), entities.size());
            yield new DialogChunk(true, full.dialogs().size(), full.dialogs(), full.messages(), entities);
        }
        case SLICE -> {
            DialogsResponse.Slice slice = (DialogsResponse.Slice) response;
            EntitySet entities = EntitySet.of(slice.users(), slice.chats());
            log.debug("[Dialogs] Received slice of {} dialogs, {} entities (server count {})",
                    slice.dialogs().size(), entities.size(), slice.count());
            yield new DialogChunk(false, slice.count(), slice.dialogs(), slice.messages(), entities);
        }
        case NOT_MODIFIED -> throw new ProtocolContractViolationException(
                "Server returned messages.dialogsNotModified even though hash = " + request.getHash());
        };
    }
}
