package me.golemcore.dialogs.domain.service;

import me.golemcore.dialogs.domain.model.Dialog;
import me.golemcore.dialogs.domain.model.DialogsResponse;
import me.golemcore.dialogs.domain.model.GetDialogsRequest;
import me.golemcore.dialogs.domain.model.InputPeer;
import me.golemcore.dialogs.domain.model.Peer;
import me.golemcore.dialogs.domain.model.ProtocolContractViolationException;
import me.golemcore.dialogs.domain.model.RawDialog;
import me.golemcore.dialogs.domain.model.RawMessage;
import me.golemcore.dialogs.domain.model.RawUser;
import me.golemcore.dialogs.domain.model.RpcInvocationException;
import me.golemcore.dialogs.testsupport.DialogFixtures;
import me.golemcore.dialogs.testsupport.ScriptedRpcTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialogIteratorTest {

    private ScriptedRpcTransport transport;
    private DialogIterator iterator;

    @BeforeEach
    void setUp() {
        transport = new ScriptedRpcTransport();
        iterator = new DialogIterator(new DialogChunkFetcher(transport), DialogIterator.MAX_PAGE_SIZE);
    }

    @Test
    void shouldYieldAllChunksInArrivalOrder() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 100))
                .reply(DialogFixtures.slice(250, 101, 100))
                .reply(DialogFixtures.slice(250, 201, 50));

        List<Long> ids = new ArrayList<>();
        Optional<Dialog> next = iterator.next().get();
        while (next.isPresent()) {
            ids.add(next.get().getChat().id());
            next = iterator.next().get();
        }

        assertEquals(250, ids.size());
        for (int i = 0; i < ids.size(); i++) {
            assertEquals(i + 1L, ids.get(i));
        }
        assertEquals(3, transport.getCallCount());
        assertTrue(iterator.isLastChunk());
    }

    @Test
    void shouldStartFromDefaultCursor() throws Exception {
        transport.reply(DialogFixtures.full(1, 1));

        iterator.next().get();

        GetDialogsRequest first = transport.dialogsRequest(0);
        assertFalse(first.isExcludePinned());
        assertEquals(null, first.getFolderId());
        assertEquals(0, first.getOffsetDate());
        assertEquals(0, first.getOffsetId());
        assertEquals(new InputPeer.Empty(), first.getOffsetPeer());
        assertEquals(100, first.getLimit());
        assertEquals(0, first.getHash());
    }

    @Test
    void shouldAnchorNextPageAtOldestDialog() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 100))
                .reply(DialogFixtures.slice(250, 101, 100));

        drain(100);
        iterator.next().get();

        GetDialogsRequest second = transport.dialogsRequest(1);
        assertTrue(second.isExcludePinned());
        assertEquals(DialogFixtures.date(100), second.getOffsetDate());
        assertEquals(DialogFixtures.messageId(100), second.getOffsetId());
        assertEquals(new InputPeer.User(100, DialogFixtures.accessHash(100)), second.getOffsetPeer());
    }

    @Test
    void shouldKeepOffsetDateWhenLastMessageIsEmpty() throws Exception {
        iterator = new DialogIterator(new DialogChunkFetcher(transport), 2);
        Peer first = new Peer.User(1);
        Peer second = new Peer.User(2);
        Peer third = new Peer.User(3);
        Peer fourth = new Peer.User(4);
        transport.reply(DialogFixtures.slice(10,
                List.of(dialog(first, 8), dialog(second, 9)),
                List.of(new RawMessage.Delivered(8, first, 600, "a", false),
                        new RawMessage.Delivered(9, second, 500, "b", false)),
                List.of(), users(1, 2)))
                .reply(DialogFixtures.slice(10,
                        List.of(dialog(third, 6), dialog(fourth, 7)),
                        List.of(new RawMessage.Service(6, third, 400, "join"),
                                new RawMessage.Empty(7, fourth)),
                        List.of(), users(3, 4)))
                .reply(DialogFixtures.slice(10, List.of(), List.of(), List.of(), List.of()));

        drain(4);
        assertTrue(iterator.next().get().isEmpty());

        GetDialogsRequest afterFirst = transport.dialogsRequest(1);
        assertEquals(500, afterFirst.getOffsetDate());
        assertEquals(9, afterFirst.getOffsetId());

        GetDialogsRequest afterSecond = transport.dialogsRequest(2);
        assertEquals(500, afterSecond.getOffsetDate());
        assertEquals(7, afterSecond.getOffsetId());
        assertEquals(new InputPeer.User(4, DialogFixtures.accessHash(4)), afterSecond.getOffsetPeer());
    }

    @Test
    void shouldUseLatestDialogWithMessageForOffsetsButLastDialogForPeer() throws Exception {
        iterator = new DialogIterator(new DialogChunkFetcher(transport), 2);
        Peer first = new Peer.User(1);
        Peer second = new Peer.User(2);
        transport.reply(DialogFixtures.slice(10,
                List.of(dialog(first, 8), dialog(second, 9)),
                List.of(new RawMessage.Delivered(8, first, 600, "a", false)),
                List.of(), users(1, 2)))
                .reply(DialogFixtures.full(3, 1));

        drain(2);
        iterator.next().get();

        GetDialogsRequest next = transport.dialogsRequest(1);
        assertEquals(600, next.getOffsetDate());
        assertEquals(8, next.getOffsetId());
        assertEquals(new InputPeer.User(2, DialogFixtures.accessHash(2)), next.getOffsetPeer());
    }

    @Test
    void shouldKeepFirstObservedTotalAcrossSlices() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 100))
                .reply(DialogFixtures.slice(250, 101, 100));

        iterator.next().get();
        assertEquals(250, iterator.total().get());

        drain(100);
        assertEquals(250, iterator.total().get());
        assertEquals(2, transport.getCallCount());
    }

    @Test
    void shouldNotChangeObservedTotalWhenServerCountDrifts() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 100))
                .reply(DialogFixtures.slice(260, 101, 100));

        iterator.next().get();
        int before = iterator.total().get();
        drain(100);

        assertEquals(before, iterator.total().get());
        assertEquals(Optional.of(260), iterator.getLastDeclaredCount());
    }

    @Test
    void shouldProbeTotalWithSingleItemRequestBeforeIterating() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 1))
                .reply(DialogFixtures.slice(250, 1, 100));

        assertEquals(250, iterator.total().get());
        assertEquals(1, transport.dialogsRequest(0).getLimit());
        assertEquals(250, iterator.total().get());
        assertEquals(1, transport.getCallCount());

        Dialog first = iterator.next().get().orElseThrow();

        assertEquals(1L, first.getChat().id());
        assertEquals(100, transport.dialogsRequest(1).getLimit());
        assertEquals(0, transport.dialogsRequest(1).getOffsetId());
        assertEquals(250, iterator.total().get());
        assertEquals(2, transport.getCallCount());
    }

    @Test
    void shouldKeepProbedTotalWhenFullPageHasDifferentSize() throws Exception {
        transport.reply(DialogFixtures.slice(250, 1, 1))
                .reply(DialogFixtures.full(1, 3));

        assertEquals(250, iterator.total().get());
        iterator.next().get();

        assertTrue(iterator.isLastChunk());
        assertEquals(250, iterator.total().get());
        assertEquals(Optional.of(3), iterator.getLastDeclaredCount());
        assertEquals(2, transport.getCallCount());
    }

    @Test
    void shouldBecomeTerminalOnFullResponse() throws Exception {
        transport.reply(DialogFixtures.full(1, 3));

        assertTrue(iterator.next().get().isPresent());
        assertTrue(iterator.isLastChunk());
        assertEquals(3, iterator.total().get());
        assertTrue(iterator.next().get().isPresent());
        assertTrue(iterator.next().get().isPresent());

        assertTrue(iterator.next().get().isEmpty());
        assertTrue(iterator.next().get().isEmpty());
        assertEquals(1, transport.getCallCount());
    }

    @Test
    void shouldNotUpdateOffsetsOnTerminalSlice() throws Exception {
        transport.reply(DialogFixtures.slice(40, 1, 40));

        iterator.next().get();

        assertTrue(iterator.isLastChunk());
        GetDialogsRequest cursor = iterator.getRequest();
        assertFalse(cursor.isExcludePinned());
        assertEquals(0, cursor.getOffsetId());
        assertEquals(new InputPeer.Empty(), cursor.getOffsetPeer());
    }

    @Test
    void shouldEndOnEmptyChunkWithoutTouchingOffsets() throws Exception {
        transport.reply(DialogFixtures.slice(10, List.of(), List.of(), List.of(), List.of()));

        assertTrue(iterator.next().get().isEmpty());
        assertTrue(iterator.isLastChunk());
        assertEquals(0, iterator.getRequest().getOffsetId());
        assertTrue(iterator.next().get().isEmpty());
        assertEquals(1, transport.getCallCount());
    }

    @Test
    void shouldFailOnNotModifiedResponse() {
        transport.reply(new DialogsResponse.NotModified(5));

        ExecutionException error = assertThrows(ExecutionException.class, () -> iterator.next().get());

        assertInstanceOf(ProtocolContractViolationException.class, error.getCause());
        assertFalse(iterator.isLastChunk());
    }

    @Test
    void shouldFailTotalOnNotModifiedResponse() {
        transport.reply(new DialogsResponse.NotModified(5));

        ExecutionException error = assertThrows(ExecutionException.class, () -> iterator.total().get());

        assertInstanceOf(ProtocolContractViolationException.class, error.getCause());
    }

    @Test
    void shouldPropagateTransportErrorUnchangedAndAllowRetry() throws Exception {
        RpcInvocationException flood = new RpcInvocationException(420, "FLOOD_WAIT_3");
        transport.fail(flood).reply(DialogFixtures.full(1, 2));

        ExecutionException error = assertThrows(ExecutionException.class, () -> iterator.next().get());
        assertSame(flood, error.getCause());
        assertFalse(iterator.isLastChunk());

        assertEquals(1L, iterator.next().get().orElseThrow().getChat().id());
        assertEquals(2, transport.getCallCount());
    }

    @Test
    void shouldRejectPageReferencingUnknownPeer() {
        transport.reply(DialogFixtures.slice(10,
                List.of(dialog(new Peer.Channel(77), 1)), List.of(), List.of(), List.of()));

        ExecutionException error = assertThrows(ExecutionException.class, () -> iterator.next().get());

        assertInstanceOf(ProtocolContractViolationException.class, error.getCause());
        assertFalse(iterator.isLastChunk());
        assertEquals(0, iterator.getRequest().getOffsetId());
    }

    @Test
    void shouldLeaveStateUntouchedWhenPendingFetchIsCancelled() throws Exception {
        CompletableFuture<DialogsResponse> pending = new CompletableFuture<>();
        transport.replyLater(pending).reply(DialogFixtures.slice(250, 1, 100));

        CompletableFuture<Optional<Dialog>> cancelled = iterator.next();
        assertTrue(cancelled.cancel(true));
        pending.complete(DialogFixtures.slice(250, 500, 100));

        assertTrue(pending.isDone());
        GetDialogsRequest cursor = iterator.getRequest();
        assertEquals(0, cursor.getOffsetId());
        assertFalse(cursor.isExcludePinned());
        assertFalse(iterator.isLastChunk());

        assertEquals(1L, iterator.next().get().orElseThrow().getChat().id());
        assertEquals(0, transport.dialogsRequest(1).getOffsetId());
    }

    @Test
    void shouldCancelTransportCallWhenCallerCancels() {
        CompletableFuture<DialogsResponse> pending = new CompletableFuture<>();
        transport.replyLater(pending);

        iterator.next().cancel(true);

        assertTrue(pending.isCancelled());
    }

    @Test
    void shouldStopAtLimitAndRequestOnlyRemainingQuota() throws Exception {
        iterator.limit(5);
        transport.reply(DialogFixtures.slice(250, 1, 5));

        List<Dialog> dialogs = iterator.collectAll().get();

        assertEquals(5, dialogs.size());
        assertEquals(5, transport.dialogsRequest(0).getLimit());
        assertEquals(1, transport.getCallCount());
    }

    @Test
    void shouldSpreadLimitOverSeveralPages() throws Exception {
        iterator = new DialogIterator(new DialogChunkFetcher(transport), 3).limit(5);
        transport.reply(DialogFixtures.slice(250, 1, 3))
                .reply(DialogFixtures.slice(250, 4, 2));

        List<Dialog> dialogs = iterator.collectAll().get();

        assertEquals(5, dialogs.size());
        assertEquals(3, transport.dialogsRequest(0).getLimit());
        assertEquals(2, transport.dialogsRequest(1).getLimit());
        assertEquals(2, transport.getCallCount());
    }

    @Test
    void shouldCollectAllDialogs() throws Exception {
        transport.reply(DialogFixtures.slice(150, 1, 100))
                .reply(DialogFixtures.slice(150, 101, 50));

        List<Dialog> dialogs = iterator.collectAll().get();

        assertEquals(150, dialogs.size());
        assertEquals(150L, dialogs.get(149).getChat().id());
    }

    @Test
    void shouldCollectAcrossAsynchronousPages() throws Exception {
        CompletableFuture<DialogsResponse> second = new CompletableFuture<>();
        transport.reply(DialogFixtures.slice(3, 1, 2)).replyLater(second);
        iterator = new DialogIterator(new DialogChunkFetcher(transport), 2);

        CompletableFuture<List<Dialog>> all = iterator.collectAll();
        assertFalse(all.isDone());
        second.complete(DialogFixtures.full(3, 1));

        assertEquals(3, all.get().size());
    }

    @Test
    void shouldRejectInvalidLimitAndPageSize() {
        assertThrows(IllegalArgumentException.class, () -> iterator.limit(0));
        DialogChunkFetcher fetcher = new DialogChunkFetcher(transport);
        assertThrows(IllegalArgumentException.class, () -> new DialogIterator(fetcher, 0));
        assertThrows(IllegalArgumentException.class, () -> new DialogIterator(fetcher, 101));
    }

    private void drain(int count) throws Exception {
        for (int i = 0; i < count; i++) {
            assertTrue(iterator.next().get().isPresent(), "expected dialog #" + (i + 1));
        }
    }

    private static RawDialog dialog(Peer peer, int topMessage) {
        return new RawDialog(peer, topMessage, false, 0, 0, null);
    }

    private static List<RawUser> users(long... ids) {
        List<RawUser> users = new ArrayList<>();
        for (long id : ids) {
            users.add(DialogFixtures.user(id));
        }
        return users;
    }
}
