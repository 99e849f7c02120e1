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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A dialog resolved against the page it arrived in: the raw summary, the
 * chat it belongs to and its latest message, if the server sent one.
 */
public final class Dialog {

    private final RawDialog raw;
    private final Chat chat;
    private final RawMessage lastMessage;

    public Dialog(RawDialog raw, Chat chat, RawMessage lastMessage) {
        this.raw = Objects.requireNonNull(raw, "raw");
        this.chat = Objects.requireNonNull(chat, "chat");
        this.lastMessage = lastMessage;
    }

    /**
     * Decodes a raw dialog using the messages and entities of its page.
     *
     * @throws ProtocolContractViolationException
     *             if the dialog's peer is not among the entities
     */
    public static Dialog decode(RawDialog raw, List<RawMessage> messages, EntitySet entities) {
        Chat chat = entities.require(raw.peer());
        RawMessage last = null;
        for (RawMessage message : messages) {
            if (message.id() == raw.topMessage()
                    && (message.peerId() == null || message.peerId().equals(raw.peer()))) {
                last = message;
                break;
            }
        }
        return new Dialog(raw, chat, last);
    }

    public RawDialog getRaw() {
        return raw;
    }

    public Chat getChat() {
        return chat;
    }

    public Optional<RawMessage> getLastMessage() {
        return Optional.ofNullable(lastMessage);
    }

    public boolean isPinned() {
        return raw.pinned();
    }

    public int getUnreadCount() {
        return raw.unreadCount();
    }

    public String getTitle() {
        return chat.name();
    }

    /**
     * Endpoint of this dialog, used both to address it and as the anchor of
     * the next dialogs page.
     */
    public InputPeer inputPeer() {
        return chat.inputPeer();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dialog)) {
            return false;
        }
        Dialog other = (Dialog) o;
        return raw.equals(other.raw) && chat.equals(other.chat) && Objects.equals(lastMessage, other.lastMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, chat, lastMessage);
    }

    @Override
    public String toString() {
        return "Dialog{" + chat.name() + ", peer=" + raw.peer() + ", topMessage=" + raw.topMessage() + "}";
    }
}
