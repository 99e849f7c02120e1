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
 * Identifies the owner of a dialog or message by bare id. Used as the key of
 * the {@link EntitySet} side-table.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Peer.User.class, name = "peerUser"),
        @JsonSubTypes.Type(value = Peer.Chat.class, name = "peerChat"),
        @JsonSubTypes.Type(value = Peer.Channel.class, name = "peerChannel")
})
public sealed interface Peer permits Peer.User, Peer.Chat, Peer.Channel {

    long id();

    record User(long userId) implements Peer {
        @Override
        public long id() {
            return userId;
        }
    }

    record Chat(long chatId) implements Peer {
        @Override
        public long id() {
            return chatId;
        }
    }

    record Channel(long channelId) implements Peer {
        @Override
        public long id() {
            return channelId;
        }
    }
}
