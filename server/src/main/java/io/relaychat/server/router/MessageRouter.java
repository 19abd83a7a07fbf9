package io.relaychat.server.router;

import io.relaychat.core.protocol.ClientMessage;
import io.relaychat.core.protocol.ClientMessages;
import io.relaychat.core.protocol.Message;
import io.relaychat.core.protocol.ServerMessages;
import io.relaychat.server.chat.ChatKey;
import io.relaychat.server.chat.IChatStore;
import io.relaychat.server.chat.InvalidPairException;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.session.HandleTakenException;
import io.relaychat.server.session.ISessionRegistry;
import io.relaychat.server.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Applies client requests to the shared registry and chat store.
 * <p>
 * Stateless; one instance serves every connection. Replies and relays are only queued on
 * sessions, so no call here blocks on a socket.
 * </p>
 */
public class MessageRouter {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final ISessionRegistry sessionRegistry;
    private final IChatStore chatStore;
    private final MetricsService metricsService;

    public MessageRouter(ISessionRegistry sessionRegistry, IChatStore chatStore, MetricsService metricsService) {
        this.sessionRegistry = sessionRegistry;
        this.chatStore = chatStore;
        this.metricsService = metricsService;
    }

    /**
     * Registers a fresh session under its handle.
     * <p>
     * On success {@code Registered} is already queued on the session, ahead of any relay that
     * can reach it once it is visible in the registry. On failure the session is untouched
     * apart from that queued frame and must be discarded by the caller.
     * </p>
     * <p>
     * Blank handles (empty or whitespace only) are refused with {@link ServerMessages#BLANK_HANDLE}
     * before the registry is consulted; any other string is accepted as is.
     * </p>
     *
     * @return the error to report before closing, or empty if the session is now registered
     */
    public Optional<ServerMessages.Error> register(Session session) {
        String handle = session.getHandle();
        if (handle.isBlank()) {
            metricsService.recordRegistration(false);
            return Optional.of(new ServerMessages.Error(ServerMessages.BLANK_HANDLE));
        }

        session.send(new ServerMessages.Registered(handle));
        try {
            sessionRegistry.register(session);
        } catch (HandleTakenException e) {
            log.info("Rejected registration from {}: {}", session.getRemoteAddress(), e.getMessage());
            metricsService.recordRegistration(false);
            return Optional.of(new ServerMessages.Error(ServerMessages.HANDLE_TAKEN));
        }

        metricsService.recordRegistration(true);
        log.info("Registered handle {} from {}", handle, session.getRemoteAddress());
        return Optional.empty();
    }

    /**
     * Handles one request from a registered session.
     */
    public void route(Session sender, ClientMessage request) {
        if (request instanceof ClientMessages.ListUsers) {
            sender.send(new ServerMessages.UserList(sessionRegistry.listHandles()));
        } else if (request instanceof ClientMessages.GetMessages getMessages) {
            getMessages(sender, getMessages.getTarget());
        } else if (request instanceof ClientMessages.SendMessage sendMessage) {
            sendMessage(sender, sendMessage.getTarget(), sendMessage.getContent());
        } else if (request instanceof ClientMessages.Register) {
            metricsService.recordAlreadyRegistered();
            sender.send(new ServerMessages.Error("Already registered as " + sender.getHandle() + "."));
        } else {
            throw new IllegalArgumentException("Unsupported request type: " + request.getClass().getName());
        }
    }

    private void getMessages(Session sender, String target) {
        ChatKey key;
        try {
            key = chatStore.normalizeKey(sender.getHandle(), target);
        } catch (InvalidPairException e) {
            metricsService.recordSelfChat();
            sender.send(new ServerMessages.Error(ServerMessages.SELF_CHAT));
            return;
        }

        List<Message> messages = chatStore.getLog(key);
        log.debug("{} fetched {} messages with {}", sender.getHandle(), messages.size(), target);
        sender.send(new ServerMessages.ChatMessages(target, messages));
    }

    private void sendMessage(Session sender, String target, String content) {
        String handle = sender.getHandle();
        ChatKey key;
        try {
            key = chatStore.normalizeKey(handle, target);
        } catch (InvalidPairException e) {
            metricsService.recordSelfChat();
            sender.send(new ServerMessages.Error(ServerMessages.SELF_CHAT));
            return;
        }

        Optional<Session> targetSession = sessionRegistry.lookup(target);
        if (targetSession.isEmpty()) {
            log.debug("{} tried to message unknown handle {}", handle, target);
            metricsService.recordUnknownTarget();
            sender.send(new ServerMessages.Error(ServerMessages.UNKNOWN_TARGET));
            return;
        }

        int length = chatStore.append(key, new Message(handle, content));
        if (targetSession.get().send(new ServerMessages.ChatMessage(handle, content))) {
            metricsService.recordRelayed();
            log.debug("Relayed message from {} to {} (log length {})", handle, target, length);
        } else {
            log.warn("Message from {} to {} stored but not relayed", handle, target);
        }
    }
}
