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
 * Dialog summary as returned by the server. The peer and the last message are
 * references that must be resolved against the rest of the response.
 *
 * @param topMessage
 *            id of the latest message in the dialog
 * @param folderId
 *            {@code null} when the dialog is not in a folder
 */
public record RawDialog(
        Peer peer,
        int topMessage,
        boolean pinned,
        int unreadCount,
        int unreadMentionsCount,
        Integer folderId) {
}
