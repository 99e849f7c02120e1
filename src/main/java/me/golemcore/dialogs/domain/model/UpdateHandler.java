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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.function.Consumer;

/**
 * A callback bound to a text pattern for one type of update.
 */
@Value
@Builder
public class UpdateHandler {

    /** Unique name within a registry. */
    @NonNull
    String name;

    /**
     * Literal text, command name (without the leading slash) or regular
     * expression, depending on the flags.
     */
    @NonNull
    String pattern;

    @NonNull
    UpdateType type;

    /** Treat {@link #pattern} as a regular expression. */
    @Builder.Default
    boolean regex = false;

    /** Match {@code /pattern} commands, with or without {@code @botname}. */
    @Builder.Default
    boolean command = false;

    @NonNull
    Consumer<IncomingUpdate> action;
}
