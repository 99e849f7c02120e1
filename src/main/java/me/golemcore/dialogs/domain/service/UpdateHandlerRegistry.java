package me.golemcore.dialogs.domain.service;

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

import me.golemcore.dialogs.domain.model.IncomingUpdate;
import me.golemcore.dialogs.domain.model.UpdateHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runtime registry of update handlers, populated with ordinary
 * {@link #register(UpdateHandler)} calls at startup.
 *
 * <p>
 * Matching per handler:
 * <ul>
 * <li>command - the first word is {@code /pattern} or
 * {@code /pattern@botname}, case-insensitive; with the regex flag the command
 * name must fully match the pattern</li>
 * <li>regex - the pattern is found anywhere in the text</li>
 * <li>otherwise - the text equals the pattern</li>
 * </ul>
 */
@Slf4j
public class UpdateHandlerRegistry {

    private static final String COMMAND_PREFIX = "/";
    private static final char BOT_MENTION_SEPARATOR = '@';

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public synchronized void register(UpdateHandler handler) {
        if (handler.getPattern().isBlank()) {
            throw new IllegalArgumentException("Handler '" + handler.getName() + "' has a blank pattern");
        }
        for (Registration registration : registrations) {
            if (registration.handler().getName().equals(handler.getName())) {
                throw new IllegalArgumentException("Handler already registered: " + handler.getName());
            }
        }
        registrations.add(new Registration(handler, compile(handler)));
        log.info("[Updates] Registered {} handler '{}' for pattern '{}'",
                handler.getType(), handler.getName(), handler.getPattern());
    }

    public synchronized boolean unregister(String name) {
        return registrations.removeIf(registration -> registration.handler().getName().equals(name));
    }

    public List<UpdateHandler> handlers() {
        List<UpdateHandler> handlers = new ArrayList<>();
        for (Registration registration : registrations) {
            handlers.add(registration.handler());
        }
        return handlers;
    }

    /**
     * Runs every handler whose type and pattern match the update, in
     * registration order. A failing handler is logged and skipped.
     *
     * @return names of the handlers that ran
     */
    public List<String> dispatch(IncomingUpdate update) {
        List<String> matched = new ArrayList<>();
        String text = update.text() != null ? update.text() : "";
        for (Registration registration : registrations) {
            UpdateHandler handler = registration.handler();
            if (handler.getType() != update.type() || !registration.matcher().test(text)) {
                continue;
            }
            matched.add(handler.getName());
            try {
                handler.getAction().accept(update);
            } catch (RuntimeException e) {
                log.warn("[Updates] Handler '{}' failed: {}", handler.getName(), e.getMessage(), e);
            }
        }
        return matched;
    }

    private static Predicate<String> compile(UpdateHandler handler) {
        String pattern = handler.getPattern();
        if (handler.isCommand()) {
            String name = pattern.startsWith(COMMAND_PREFIX) ? pattern.substring(1) : pattern;
            if (handler.isRegex()) {
                Pattern regex = compileRegex(handler.getName(), name, Pattern.CASE_INSENSITIVE);
                return text -> {
                    String command = commandName(text);
                    return command != null && regex.matcher(command).matches();
                };
            }
            String expected = name.toLowerCase(Locale.ROOT);
            return text -> expected.equals(commandName(text));
        }
        if (handler.isRegex()) {
            Pattern regex = compileRegex(handler.getName(), pattern, 0);
            return text -> regex.matcher(text).find();
        }
        return pattern::equals;
    }

    private static Pattern compileRegex(String handlerName, String pattern, int flags) {
        try {
            return Pattern.compile(pattern, flags);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Handler '" + handlerName + "' has an invalid pattern: "
                    + e.getDescription(), e);
        }
    }

    /**
     * Lower-cased command name of a {@code /command@bot args} text, or
     * {@code null} if the text is not a command.
     */
    static String commandName(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith(COMMAND_PREFIX) || trimmed.length() == 1) {
            return null;
        }
        String[] words = trimmed.substring(1).split("\\s+", 2);
        String command = words[0];
        int mention = command.indexOf(BOT_MENTION_SEPARATOR);
        if (mention >= 0) {
            command = command.substring(0, mention);
        }
        return command.isEmpty() ? null : command.toLowerCase(Locale.ROOT);
    }

    private record Registration(UpdateHandler handler, Predicate<String> matcher) {
    }
}
