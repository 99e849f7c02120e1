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

import java.util.List;

/**
 * Result of {@code messages.getDialogs}.
 *
 * <ul>
 * <li>{@link Full} - the complete list fit in one response</li>
 * <li>{@link Slice} - one page of a longer list, with the server's count</li>
 * <li>{@link NotModified} - only valid as a reply to a non-zero hash</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DialogsResponse.Full.class, name = "messages.dialogs"),
        @JsonSubTypes.Type(value = DialogsResponse.Slice.class, name = "messages.dialogsSlice"),
        @JsonSubTypes.Type(value = DialogsResponse.NotModified.class, name = "messages.dialogsNotModified")
})
public sealed interface DialogsResponse permits DialogsResponse.Full, DialogsResponse.Slice,
        DialogsResponse.NotModified {

    Kind kind();

    enum Kind {
        FULL, SLICE, NOT_MODIFIED
    }

    record Full(List<RawDialog> dialogs, List<RawMessage> messages, List<RawChat> chats, List<RawUser> users)
            implements DialogsResponse {

        public Full {
            dialogs = copyOf(dialogs);
            messages = copyOf(messages);
            chats = copyOf(chats);
            users = copyOf(users);
        }

        @Override
        public Kind kind() {
            return Kind.FULL;
        }
    }

    record Slice(int count, List<RawDialog> dialogs, List<RawMessage> messages, List<RawChat> chats,
            List<RawUser> users) implements DialogsResponse {

        public Slice {
            dialogs = copyOf(dialogs);
            messages = copyOf(messages);
            chats = copyOf(chats);
            users = copyOf(users);
        }

        @Override
        public Kind kind() {
            return Kind.SLICE;
        }
    }

    record NotModified(int count) implements DialogsResponse {
        @Override
        public Kind kind() {
            return Kind.NOT_MODIFIED;
        }
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source == null ? List.of() : List.copyOf(source);
    }
}
