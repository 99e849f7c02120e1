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
 * User record from the {@code users} side-collection of a response.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RawUser.User.class, name = "user"),
        @JsonSubTypes.Type(value = RawUser.Empty.class, name = "userEmpty")
})
public sealed interface RawUser permits RawUser.User, RawUser.Empty {

    long id();

    /**
     * @param accessHash
     *            absent for "min" users the server could not fully share
     */
    record User(long id, Long accessHash, boolean self, boolean bot, String firstName, String lastName,
            String username) implements RawUser {
    }

    record Empty(long id) implements RawUser {
    }
}
