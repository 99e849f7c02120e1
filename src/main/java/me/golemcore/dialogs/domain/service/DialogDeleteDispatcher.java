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

import me.golemcore.dialogs.domain.model.DeleteChatUserRequest;
import me.golemcore.dialogs.domain.model.DeleteHistoryRequest;
import me.golemcore.dialogs.domain.model.InputChannel;
import me.golemcore.dialogs.domain.model.InputPeer;
import me.golemcore.dialogs.domain.model.InputUser;
import me.golemcore.dialogs.domain.model.LeaveChannelRequest;
import me.golemcore.dialogs.port.outbound.RpcTransportPort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Removes a dialog from the account's own list, picking the remote call by
 * the kind of endpoint:
 * <ul>
 * <li>users (including the account itself) - the history is deleted for us
 * only</li>
 * <li>basic groups - we remove ourselves as a member</li>
 * <li>channels and megagroups - we leave the channel</li>
 * </ul>
 * The conversation itself is never deleted; other participants keep it.
 */
@Slf4j
@RequiredArgsConstructor
public class DialogDeleteDispatcher {

    @NonNull
    private final RpcTransportPort transport;

    public CompletableFuture<Void> delete(InputPeer peer) {
        Objects.requireNonNull(peer, "peer");
        log.debug("[Dialogs] Deleting dialog {}", peer);

        return switch (peer.kind()) {
        case EMPTY -> CompletableFuture.completedFuture(null);
        case SELF, USER, USER_FROM_MESSAGE -> discard(transport.invoke(
                new DeleteHistoryRequest(false, false, peer, 0)));
        case CHAT -> {
            InputPeer.Chat chat = (InputPeer.Chat) peer;
            yield discard(transport.invoke(new DeleteChatUserRequest(chat.chatId(), new InputUser.UserSelf())));
        }
        case CHANNEL -> {
            InputPeer.Channel channel = (InputPeer.Channel) peer;
            yield discard(transport.invoke(new LeaveChannelRequest(
                    new InputChannel.Channel(channel.channelId(), channel.accessHash()))));
        }
        case CHANNEL_FROM_MESSAGE -> {
            InputPeer.ChannelFromMessage channel = (InputPeer.ChannelFromMessage) peer;
            yield discard(transport.invoke(new LeaveChannelRequest(
                    new InputChannel.FromMessage(channel.peer(), channel.msgId(), channel.channelId()))));
        }
        };
    }

    private static CompletableFuture<Void> discard(CompletableFuture<?> call) {
        return call.thenAccept(result -> {
        });
    }
}
