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

import me.golemcore.dialogs.domain.model.InputPeer;
import me.golemcore.dialogs.infrastructure.config.DialogsProperties;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for working with the account's dialog list.
 *
 * <p>
 * Each call to {@link #iterDialogs()} starts an independent enumeration with
 * its own cursor, so several may run side by side. Deletion goes through
 * {@link DialogDeleteDispatcher}.
 */
@Slf4j
public class DialogService {

    private final DialogChunkFetcher fetcher;
    private final DialogDeleteDispatcher deleteDispatcher;
    private final int pageSize;

    public DialogService(RpcTransportPort transport, DialogsProperties properties) {
        this.fetcher = new DialogChunkFetcher(transport);
        this.deleteDispatcher = new DialogDeleteDispatcher(transport);
        this.pageSize = properties.getIteration().resolvePageSize();
        log.info("[Dialogs] Dialog service ready, page size {}", pageSize);
    }

    /**
     * Returns a new iterator over the dialogs, newest first.
     */
    public DialogIterator iterDialogs() {
        return new DialogIterator(fetcher, pageSize);
    }

    /**
     * Deletes a dialog, removing it from your list of open conversations.
     *
     * <p>
     * The dialog is only deleted for yourself. For one-to-one dialogs the
     * history is cleared; for groups and channels this is the same as leaving
     * them. The chat itself is <b>not</b> deleted: it still exists and the
     * other members remain inside.
     */
    public CompletableFuture<Void> deleteDialog(InputPeer peer) {
        return deleteDispatcher.delete(peer);
    }
}
