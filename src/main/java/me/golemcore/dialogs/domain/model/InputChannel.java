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

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InputChannel.Channel.class, name = "inputChannel"),
        @JsonSubTypes.Type(value = InputChannel.FromMessage.class, name = "inputChannelFromMessage")
})
public sealed interface InputChannel permits InputChannel.Channel, InputChannel.FromMessage {

    long channelId();

    record Channel(long channelId, long accessHash) implements InputChannel {
    }

    record FromMessage(InputPeer peer, int msgId, long channelId) implements InputChannel {
    }
}
