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
 * Addressable conversation endpoint, carrying whatever credentials the remote
 * API needs to reach it.
 *
 * <p>
 * The set of variants is closed. Consumers switch over {@link #kind()} in a
 * switch expression without a {@code default} branch, so adding a variant
 * breaks compilation at every dispatch site until it is handled.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InputPeer.Empty.class, name = "inputPeerEmpty"),
        @JsonSubTypes.Type(value = InputPeer.PeerSelf.class, name = "inputPeerSelf"),
        @JsonSubTypes.Type(value = InputPeer.User.class, name = "inputPeerUser"),
        @JsonSubTypes.Type(value = InputPeer.UserFromMessage.class, name = "inputPeerUserFromMessage"),
        @JsonSubTypes.Type(value = InputPeer.Chat.class, name = "inputPeerChat"),
        @JsonSubTypes.Type(value = InputPeer.Channel.class, name = "inputPeerChannel"),
        @JsonSubTypes.Type(value = InputPeer.ChannelFromMessage.class, name = "inputPeerChannelFromMessage")
})
public sealed interface InputPeer permits InputPeer.Empty, InputPeer.PeerSelf, InputPeer.User,
        InputPeer.UserFromMessage, InputPeer.Chat, InputPeer.Channel, InputPeer.ChannelFromMessage {

    Kind kind();

    enum Kind {
        EMPTY, SELF, USER, USER_FROM_MESSAGE, CHAT, CHANNEL, CHANNEL_FROM_MESSAGE
    }

    record Empty() implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }
    }

    record PeerSelf() implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.SELF;
        }
    }

    record User(long userId, long accessHash) implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.USER;
        }
    }

    /**
     * A user only known through a message seen in another peer.
     */
    record UserFromMessage(InputPeer peer, int msgId, long userId) implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.USER_FROM_MESSAGE;
        }
    }

    record Chat(long chatId) implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.CHAT;
        }
    }

    record Channel(long channelId, long accessHash) implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.CHANNEL;
        }
    }

    /**
     * A channel only known through a message seen in another peer.
     */
    record ChannelFromMessage(InputPeer peer, int msgId, long channelId) implements InputPeer {
        @Override
        public Kind kind() {
            return Kind.CHANNEL_FROM_MESSAGE;
        }
    }
}
