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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Message as shipped in the {@code messages} collection of a dialogs page.
 * Only the variant decides which pagination offsets it can provide: an
 * {@link Empty} placeholder has no date.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RawMessage.Delivered.class, name = "message"),
        @JsonSubTypes.Type(value = RawMessage.Service.class, name = "messageService"),
        @JsonSubTypes.Type(value = RawMessage.Empty.class, name = "messageEmpty")
})
public sealed interface RawMessage permits RawMessage.Delivered, RawMessage.Service, RawMessage.Empty {

    int id();

    /**
     * Peer the message was sent in. May be {@code null} for {@link Empty}.
     */
    Peer peerId();

    Kind kind();

    enum Kind {
        DELIVERED, SERVICE, EMPTY
    }

    record Delivered(int id, Peer peerId, int date, String message, boolean out) implements RawMessage {
        @Override
        public Kind kind() {
            return Kind.DELIVERED;
        }
    }

    record Service(int id, Peer peerId, int date, String action) implements RawMessage {
        @Override
        public Kind kind() {
            return Kind.SERVICE;
        }
    }

    record Empty(int id, Peer peerId) implements RawMessage {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }
    }
}
