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

import me.golemcore.dialogs.domain.model.GetDialogsRequest;
import me.golemcore.dialogs.domain.model.RawMessage;

/**
 * Derives the date/id offsets of the next dialogs page from the last message
 * of the current one.
 */
public final class DialogOffsets {

    private DialogOffsets() {
    }

    public record Offset(int date, int id) {
    }

    /**
     * Delivered and service messages move both offsets. An empty placeholder
     * carries no timestamp and only moves the id.
     */
    public static Offset next(Offset current, RawMessage message) {
        return switch (message.kind()) {
        case DELIVERED -> {
            RawMessage.Delivered delivered = (RawMessage.Delivered) message;
            yield new Offset(delivered.date(), delivered.id());
        }
        case SERVICE -> {
            RawMessage.Service service = (RawMessage.Service) message;
            yield new Offset(service.date(), service.id());
        }
        case EMPTY -> new Offset(current.date(), message.id());
        };
    }

    public static void apply(GetDialogsRequest request, RawMessage message) {
        Offset next = next(new Offset(request.getOffsetDate(), request.getOffsetId()), message);
        request.setOffsetDate(next.date());
        request.setOffsetId(next.id());
    }
}
