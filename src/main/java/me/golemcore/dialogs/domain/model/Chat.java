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
 * Decoded conversation partner of a dialog: a user, a basic group or a
 * channel (including megagroups). Self-contained, so it can be used without
 * the page it was decoded from.
 */
public sealed interface Chat permits Chat.User, Chat.Group, Chat.Channel {

    long id();

    /**
     * Display name: full name for users, title for groups and channels.
     */
    String name();

    Peer peer();

    /**
     * Endpoint to address this chat in further requests.
     */
    InputPeer inputPeer();

    record User(long id, long accessHash, boolean self, boolean bot, String firstName, String lastName,
            String username) implements Chat {

        @Override
        public String name() {
            String first = firstName != null ? firstName : "";
            String last = lastName != null ? lastName : "";
            if (first.isEmpty()) {
                return last;
            }
            return last.isEmpty() ? first : first + " " + last;
        }

        @Override
        public Peer peer() {
            return new Peer.User(id);
        }

        @Override
        public InputPeer inputPeer() {
            if (self) {
                return new InputPeer.PeerSelf();
            }
            return new InputPeer.User(id, accessHash);
        }
    }

    /**
     * @param forbidden
     *            the account is no longer a member
     */
    record Group(long id, String title, int participantsCount, boolean forbidden) implements Chat {

        @Override
        public String name() {
            return title != null ? title : "";
        }

        @Override
        public Peer peer() {
            return new Peer.Chat(id);
        }

        @Override
        public InputPeer inputPeer() {
            return new InputPeer.Chat(id);
        }
    }

    record Channel(long id, long accessHash, String title, String username, boolean broadcast, boolean megagroup,
            boolean forbidden) implements Chat {

        @Override
        public String name() {
            return title != null ? title : "";
        }

        @Override
        public Peer peer() {
            return new Peer.Channel(id);
        }

        @Override
        public InputPeer inputPeer() {
            return new InputPeer.Channel(id, accessHash);
        }
    }

    static Chat.User fromUser(RawUser raw) {
        if (raw instanceof RawUser.User user) {
            long accessHash = user.accessHash() != null ? user.accessHash() : 0L;
            return new Chat.User(user.id(), accessHash, user.self(), user.bot(), user.firstName(), user.lastName(),
                    user.username());
        }
        if (raw instanceof RawUser.Empty empty) {
            return new Chat.User(empty.id(), 0L, false, false, null, null, null);
        }
        throw new ProtocolContractViolationException("Unsupported user variant: " + raw);
    }

    static Chat fromChat(RawChat raw) {
        if (raw instanceof RawChat.Chat chat) {
            return new Chat.Group(chat.id(), chat.title(), chat.participantsCount(), false);
        }
        if (raw instanceof RawChat.Forbidden forbidden) {
            return new Chat.Group(forbidden.id(), forbidden.title(), 0, true);
        }
        if (raw instanceof RawChat.Channel channel) {
            long accessHash = channel.accessHash() != null ? channel.accessHash() : 0L;
            return new Chat.Channel(channel.id(), accessHash, channel.title(), channel.username(),
                    channel.broadcast(), channel.megagroup(), false);
        }
        if (raw instanceof RawChat.ChannelForbidden forbidden) {
            return new Chat.Channel(forbidden.id(), forbidden.accessHash(), forbidden.title(), null,
                    forbidden.broadcast(), forbidden.megagroup(), true);
        }
        throw new ProtocolContractViolationException("Unsupported chat variant: " + raw);
    }
}
