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

import me.golemcore.dialogs.domain.model.Dialog;
import me.golemcore.dialogs.domain.model.GetDialogsRequest;
import me.golemcore.dialogs.domain.model.RawMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lazily walks the account's dialog list, page by page.
 *
 * <p>
 * Dialogs are fetched in chunks of at most {@link #MAX_PAGE_SIZE} and handed
 * out one at a time from an internal buffer; a new chunk is only requested
 * once the buffer is drained. The next page is addressed by the date, id and
 * peer of the oldest dialog received so far, not by a server-issued cursor.
 *
 * <p>
 * An iterator owns mutable state and must not be shared: callers must wait
 * for the future returned by {@link #next()} or {@link #total()} before
 * calling either again. Cancelling such a future before it completes leaves
 * the iterator exactly as it was.
 */
@Slf4j
public class DialogIterator {

    public static final int MAX_PAGE_SIZE = 100;

    private final DialogChunkFetcher fetcher;
    private final int pageSize;
    private final GetDialogsRequest request;
    private final Deque<Dialog> buffer = new ArrayDeque<>();

    private Integer total;
    private Integer lastDeclaredCount;
    private boolean lastChunk;
    private Integer limit;
    private int fetched;

    public DialogIterator(DialogChunkFetcher fetcher, int pageSize) {
        this(fetcher, pageSize, GetDialogsRequest.initial());
    }

    DialogIterator(DialogChunkFetcher fetcher, int pageSize, GetDialogsRequest request) {
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE + ": " + pageSize);
        }
        this.fetcher = fetcher;
        this.pageSize = pageSize;
        this.request = request;
    }

    /**
     * Stops the iteration after {@code limit} dialogs have been returned.
     */
    public DialogIterator limit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        return this;
    }

    /**
     * Determines how many dialogs there are in total.
     *
     * <p>
     * Only performs a network call if no page has been fetched yet. The value
     * is remembered: later pages never change what this returns.
     *
     * <p>
     * The result is the first count the server reported, even when a later
     * full page turns out to hold a different number of dialogs.
     */
    public CompletableFuture<Integer> total() {
        if (total != null) {
            return CompletableFuture.completedFuture(total);
        }
        CompletableFuture<DialogChunk> chunk = fetcher.fetch(request, 1);
        CompletableFuture<Integer> result = chunk.thenApply(probe -> {
            request.setLimit(1);
            rememberTotal(probe.count());
            return total;
        });
        cancelWith(result, chunk);
        return result;
    }

    /**
     * Returns the next dialog, fetching a new page first if the buffer is
     * empty.
     *
     * @return empty once the limit is reached or there are no dialogs left
     */
    public CompletableFuture<Optional<Dialog>> next() {
        if (limitReached()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!buffer.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.of(popItem()));
        }
        if (lastChunk) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        int fetchLimit = determineLimit();
        CompletableFuture<DialogChunk> chunk = fetcher.fetch(request, fetchLimit);
        CompletableFuture<Optional<Dialog>> result = chunk.thenApply(page -> accept(page, fetchLimit));
        cancelWith(result, chunk);
        return result;
    }

    /**
     * Drains the remaining dialogs into a list.
     */
    public CompletableFuture<List<Dialog>> collectAll() {
        return collectInto(new ArrayList<>());
    }

    public boolean isLastChunk() {
        return lastChunk;
    }

    /**
     * Most recent count declared by the server, which may drift from the
     * remembered {@link #total()} while iterating.
     */
    Optional<Integer> getLastDeclaredCount() {
        return Optional.ofNullable(lastDeclaredCount);
    }

    /**
     * Copy of the cursor the next page would be requested with.
     */
    public GetDialogsRequest getRequest() {
        return request.snapshot();
    }

    private Optional<Dialog> accept(DialogChunk page, int fetchLimit) {
        // Decode before touching any state, so a malformed page leaves the cursor as it was
        List<Dialog> dialogs = page.decode();

        request.setLimit(fetchLimit);
        if (page.complete()) {
            lastChunk = true;
        } else {
            lastChunk = dialogs.size() < fetchLimit;
        }
        rememberTotal(page.count());
        buffer.addAll(dialogs);

        // No offsets needed if nothing else will be fetched
        if (!lastChunk && !buffer.isEmpty()) {
            request.setExcludePinned(true);
            RawMessage lastMessage = findLastMessage();
            if (lastMessage != null) {
                DialogOffsets.apply(request, lastMessage);
            }
            request.setOffsetPeer(buffer.peekLast().inputPeer());
            log.debug("[Dialogs] Next page anchored at date={}, id={}, peer={}",
                    request.getOffsetDate(), request.getOffsetId(), request.getOffsetPeer());
        }

        return Optional.ofNullable(popItem());
    }

    private RawMessage findLastMessage() {
        Iterator<Dialog> reversed = buffer.descendingIterator();
        while (reversed.hasNext()) {
            Optional<RawMessage> message = reversed.next().getLastMessage();
            if (message.isPresent()) {
                return message.get();
            }
        }
        return null;
    }

    private void rememberTotal(int count) {
        lastDeclaredCount = count;
        if (total == null) {
            total = count;
        } else if (total != count) {
            log.debug("[Dialogs] Server count changed from {} to {}, keeping {}", total, count, total);
        }
    }

    private int determineLimit() {
        if (limit == null) {
            return pageSize;
        }
        if (fetched < limit) {
            return Math.min(limit - fetched, pageSize);
        }
        return 1;
    }

    private boolean limitReached() {
        return limit != null && fetched >= limit;
    }

    private Dialog popItem() {
        Dialog dialog = buffer.pollFirst();
        if (dialog != null) {
            fetched++;
        }
        return dialog;
    }

    private CompletableFuture<List<Dialog>> collectInto(List<Dialog> out) {
        while (true) {
            CompletableFuture<Optional<Dialog>> next = next();
            if (!next.isDone() || next.isCompletedExceptionally()) {
                return next.thenCompose(item -> {
                    if (item.isEmpty()) {
                        return CompletableFuture.completedFuture(out);
                    }
                    out.add(item.get());
                    return collectInto(out);
                });
            }
            Optional<Dialog> item = next.join();
            if (item.isEmpty()) {
                return CompletableFuture.completedFuture(out);
            }
            out.add(item.get());
        }
    }

    private static void cancelWith(CompletableFuture<?> result, CompletableFuture<?> upstream) {
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                upstream.cancel(true);
            }
        });
    }
}
