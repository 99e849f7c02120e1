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
 * Group or channel record from the {@code chats} side-collection of a
 * response. Forbidden variants describe chats the account was removed from.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RawChat.Chat.class, name = "chat"),
        @JsonSubTypes.Type(value = RawChat.Forbidden.class, name = "chatForbidden"),
        @JsonSubTypes.Type(value = RawChat.Channel.class, name = "channel"),
        @JsonSubTypes.Type(value = RawChat.ChannelForbidden.class, name = "channelForbidden")
})
public sealed interface RawChat permits RawChat.Chat, RawChat.Forbidden, RawChat.Channel, RawChat.ChannelForbidden {

    long id();

    String title();

    record Chat(long id, String title, int participantsCount) implements RawChat {
    }

    record Forbidden(long id, String title) implements RawChat {
    }

    record Channel(long id, Long accessHash, String title, String username, boolean broadcast, boolean megagroup)
            implements RawChat {
    }

    record ChannelForbidden(long id, long accessHash, String title, boolean broadcast, boolean megagroup)
            implements RawChat {
    }
}
