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

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table of the users and chats shipped alongside one page of results,
 * keyed by {@link Peer}. Built once per page and read-only afterwards.
 */
public final class EntitySet {

    private final Map<Peer, Chat> chats;
    private final Chat.User self;

    private EntitySet(Map<Peer, Chat> chats, Chat.User self) {
        this.chats = chats;
        this.self = self;
    }

    public static EntitySet of(Collection<RawUser> users, Collection<RawChat> chats) {
        Map<Peer, Chat> map = new HashMap<>();
        Chat.User self = null;
        if (users != null) {
            for (RawUser raw : users) {
                Chat.User user = Chat.fromUser(raw);
                map.put(user.peer(), user);
                if (user.self()) {
                    self = user;
                }
            }
        }
        if (chats != null) {
            for (RawChat raw : chats) {
                Chat chat = Chat.fromChat(raw);
                map.put(chat.peer(), chat);
            }
        }
        return new EntitySet(Map.copyOf(map), self);
    }

    public static EntitySet empty() {
        return of(List.of(), List.of());
    }

    public Optional<Chat> get(Peer peer) {
        return Optional.ofNullable(chats.get(peer));
    }

    /**
     * Resolves a peer that the server is obliged to have included in this
     * page.
     *
     * @throws ProtocolContractViolationException
     *             if the peer is missing
     */
    public Chat require(Peer peer) {
        Chat chat = chats.get(peer);
        if (chat == null) {
            throw new ProtocolContractViolationException("Peer " + peer + " is missing from the response entities");
        }
        return chat;
    }

    /**
     * The logged-in user, if it was part of this page.
     */
    Optional<Chat.User> self() {
        return Optional.ofNullable(self);
    }

    public int size() {
        return chats.size();
    }
}
