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

import me.golemcore.dialogs.domain.model.Dialog;
import me.golemcore.dialogs.domain.model.EntitySet;
import me.golemcore.dialogs.domain.model.RawDialog;
import me.golemcore.dialogs.domain.model.RawMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * One classified page of dialogs with the side-tables needed to decode it.
 *
 * @param complete
 *            the server sent the whole list in this page
 * @param count
 *            server-declared total for a slice, page length otherwise
 */
public record DialogChunk(
        boolean complete,
        int count,
        List<RawDialog> dialogs,
        List<RawMessage> messages,
        EntitySet entities) {

    public List<Dialog> decode() {
        List<Dialog> decoded = new ArrayList<>(dialogs.size());
        for (RawDialog dialog : dialogs) {
            decoded.add(Dialog.decode(dialog, messages, entities));
        }
        return decoded;
    }
}
