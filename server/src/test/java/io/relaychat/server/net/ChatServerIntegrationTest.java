package io.relaychat.server.net;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.relaychat.client.ChatClient;
import io.relaychat.core.codec.FrameCodec;
import io.relaychat.core.protocol.ClientMessages;
import io.relaychat.core.protocol.Message;
import io.relaychat.core.protocol.ServerMessage;
import io.relaychat.core.protocol.ServerMessages;
import io.relaychat.server.chat.ChatStore;
import io.relaychat.server.config.ServerConfig;
import io.relaychat.server.metrics.MetricsService;
import io.relaychat.server.session.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests over real sockets on an ephemeral port.
 */
@Timeout(30)
class ChatServerIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final int MAX_FRAME_BYTES = 1024;

    private SessionRegistry sessionRegistry;
    private ChatStore chatStore;
    private ChatServer server;
    private int port;
    private final List<ChatClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        ServerConfig config = ServerConfig.builder()
                .serverId("it")
                .bindHost("127.0.0.1")
                .port(0)
                .adminPort(0)
                .maxFrameBytes(MAX_FRAME_BYTES)
                .perConnBufferSize(64)
                .shutdownGrace(Duration.ofSeconds(2))
                .build();
        sessionRegistry = new SessionRegistry();
        chatStore = new ChatStore();
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry(), config);
        server = new ChatServer(config, sessionRegistry, chatStore, metricsService);
        port = server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        for (ChatClient client : clients) {
            client.close();
        }
        server.stop();
    }

    private ChatClient connect() throws IOException {
        ChatClient client = ChatClient.connect("127.0.0.1", port);
        clients.add(client);
        return client;
    }

    private ChatClient register(String handle) throws Exception {
        ChatClient client = connect();
        client.send(new ClientMessages.Register(handle));
        assertEquals(new ServerMessages.Registered(handle), next(client));
        return client;
    }

    private static ServerMessage next(ChatClient client) throws InterruptedException {
        return client.receive(WAIT).orElseThrow(() -> new AssertionError("No frame within " + WAIT));
    }

    private void awaitUnregistered(String handle) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (sessionRegistry.lookup(handle).isPresent()) {
            assertTrue(System.nanoTime() < deadline, handle + " still registered");
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("alice messages bob, bob receives it live, alice reads the history")
    void endToEndScenario() throws Exception {
        ChatClient alice = register("alice");
        ChatClient bob = register("bob");

        alice.send(new ClientMessages.SendMessage("hi", "bob"));
        assertEquals(new ServerMessages.ChatMessage("alice", "hi"), next(bob));

        alice.send(new ClientMessages.GetMessages("bob"));
        assertEquals(new ServerMessages.ChatMessages("bob", List.of(new Message("alice", "hi"))), next(alice));

        bob.send(new ClientMessages.ListUsers());
        assertEquals(new ServerMessages.UserList(List.of("alice", "bob")), next(bob));
    }

    @Test
    @DisplayName("Messages sent back to back arrive and are stored in order")
    void orderingPreserved() throws Exception {
        ChatClient alice = register("alice");
        ChatClient bob = register("bob");

        for (int i = 0; i < 20; i++) {
            alice.send(new ClientMessages.SendMessage("m" + i, "bob"));
        }
        List<Message> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            assertEquals(new ServerMessages.ChatMessage("alice", "m" + i), next(bob));
            expected.add(new Message("alice", "m" + i));
        }

        bob.send(new ClientMessages.GetMessages("alice"));
        assertEquals(new ServerMessages.ChatMessages("alice", expected), next(bob));
    }

    @Test
    @DisplayName("Second client claiming a live handle gets an error and is disconnected")
    void duplicateHandle() throws Exception {
        register("alice");
        ChatClient impostor = connect();

        impostor.send(new ClientMessages.Register("alice"));

        assertEquals(new ServerMessages.Error(ServerMessages.HANDLE_TAKEN), next(impostor));
        assertTrue(impostor.awaitDisconnect(WAIT));
        assertTrue(sessionRegistry.lookup("alice").isPresent());
    }

    @Test
    @DisplayName("Concurrent registrations of one handle admit exactly one client")
    void concurrentRegistration() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ServerMessage>> replies = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            ChatClient client = connect();
            replies.add(pool.submit(() -> {
                start.await();
                client.send(new ClientMessages.Register("alice"));
                return next(client);
            }));
        }
        start.countDown();

        int registered = 0;
        int rejected = 0;
        for (Future<ServerMessage> reply : replies) {
            ServerMessage message = reply.get();
            if (message instanceof ServerMessages.Registered) {
                registered++;
            } else {
                assertEquals(new ServerMessages.Error(ServerMessages.HANDLE_TAKEN), message);
                rejected++;
            }
        }
        pool.shutdown();

        assertEquals(1, registered);
        assertEquals(contenders - 1, rejected);
    }

    @Test
    @DisplayName("Disconnecting frees the handle for a new connection")
    void disconnectFreesHandle() throws Exception {
        ChatClient alice = register("alice");
        ChatClient bob = register("bob");

        alice.close();
        awaitUnregistered("alice");

        bob.send(new ClientMessages.SendMessage("are you there?", "alice"));
        assertEquals(new ServerMessages.Error(ServerMessages.UNKNOWN_TARGET), next(bob));

        register("alice");
    }

    @Test
    @DisplayName("Message to a handle that never registered is rejected")
    void unknownTarget() throws Exception {
        ChatClient alice = register("alice");

        alice.send(new ClientMessages.SendMessage("boo", "ghost"));

        assertEquals(new ServerMessages.Error(ServerMessages.UNKNOWN_TARGET), next(alice));
        assertEquals(0, chatStore.size());
    }

    @Test
    @DisplayName("A first frame other than Register closes the connection without a reply")
    void firstFrameMustBeRegister() throws Exception {
        ChatClient client = connect();

        client.send(new ClientMessages.ListUsers());

        assertTrue(client.awaitDisconnect(WAIT));
        assertEquals(Optional.empty(), client.receive(Duration.ofMillis(100)));
        assertEquals(0, sessionRegistry.size());
    }

    @Test
    @DisplayName("An undecodable first frame closes the connection without a reply")
    void undecodableFirstFrame() throws Exception {
        FrameCodec codec = new FrameCodec();
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout((int) WAIT.toMillis());
            InputStream in = new BufferedInputStream(socket.getInputStream());

            codec.writeFrame(socket.getOutputStream(), new byte[]{0x00, (byte) 0xff, 0x13, 0x37});

            assertTrue(codec.readFrame(in).isEmpty());
        }
        assertEquals(0, sessionRegistry.size());
    }

    @Test
    @DisplayName("Replies to every request arrive even when the client half-closes right after sending")
    void halfCloseStillReceivesAllReplies() throws Exception {
        int requests = 10;
        FrameCodec codec = new FrameCodec();
        for (int run = 0; run < 20; run++) {
            String handle = "alice" + run;
            try (Socket socket = new Socket("127.0.0.1", port)) {
                socket.setSoTimeout((int) WAIT.toMillis());
                InputStream in = new BufferedInputStream(socket.getInputStream());
                OutputStream out = socket.getOutputStream();

                codec.writeFrame(out, new ClientMessages.Register(handle));
                for (int i = 0; i < requests; i++) {
                    codec.writeFrame(out, new ClientMessages.ListUsers());
                }
                socket.shutdownOutput();

                List<ServerMessage> replies = new ArrayList<>();
                Optional<byte[]> frame;
                while ((frame = codec.readFrame(in)).isPresent()) {
                    replies.add(codec.decodeServerMessage(frame.get()));
                }

                assertEquals(requests + 1, replies.size(), "run " + run);
                assertEquals(new ServerMessages.Registered(handle), replies.get(0));
                for (ServerMessage reply : replies.subList(1, replies.size())) {
                    assertInstanceOf(ServerMessages.UserList.class, reply);
                }
            }
            awaitUnregistered(handle);
        }
    }

    @Test
    @DisplayName("Malformed payload after registration is answered and the connection keeps working")
    void malformedFrameIsRecoverable() throws Exception {
        FrameCodec codec = new FrameCodec();
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout((int) WAIT.toMillis());
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();

            codec.writeFrame(out, new ClientMessages.Register("alice"));
            assertEquals(new ServerMessages.Registered("alice"), codec.decodeServerMessage(codec.readFrame(in).orElseThrow()));

            codec.writeFrame(out, "not a request".getBytes(StandardCharsets.UTF_8));
            ServerMessage reply = codec.decodeServerMessage(codec.readFrame(in).orElseThrow());
            assertInstanceOf(ServerMessages.Error.class, reply);
            assertTrue(((ServerMessages.Error) reply).getMessage().startsWith("Malformed request"));

            codec.writeFrame(out, new ClientMessages.ListUsers());
            assertEquals(new ServerMessages.UserList(List.of("alice")), codec.decodeServerMessage(codec.readFrame(in).orElseThrow()));
        }
    }

    @Test
    @DisplayName("Oversized frame closes the connection and releases the handle")
    void oversizedFrameIsFatal() throws Exception {
        FrameCodec codec = new FrameCodec();
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout((int) WAIT.toMillis());
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();

            codec.writeFrame(out, new ClientMessages.Register("alice"));
            assertEquals(new ServerMessages.Registered("alice"), codec.decodeServerMessage(codec.readFrame(in).orElseThrow()));

            out.write(ByteBuffer.allocate(4).putInt(MAX_FRAME_BYTES + 1).array());
            out.flush();

            assertTrue(codec.readFrame(in).isEmpty());
        }
        awaitUnregistered("alice");
    }

    @Test
    @DisplayName("One client vanishing mid-frame does not disturb the others")
    void truncatedFrameIsolated() throws Exception {
        ChatClient bob = register("bob");
        try (Socket socket = new Socket("127.0.0.1", port)) {
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();
            FrameCodec codec = new FrameCodec();
            codec.writeFrame(out, new ClientMessages.Register("alice"));
            assertEquals(new ServerMessages.Registered("alice"), codec.decodeServerMessage(codec.readFrame(in).orElseThrow()));

            // Length prefix promises more bytes than are sent
            out.write(ByteBuffer.allocate(6).putInt(50).put((byte) '{').put((byte) '"').array());
            out.flush();
        }
        awaitUnregistered("alice");

        bob.send(new ClientMessages.ListUsers());
        assertEquals(new ServerMessages.UserList(List.of("bob")), next(bob));
    }

    @Test
    @DisplayName("Stopping the server disconnects clients and refuses to serve new ones")
    void stopDrainsClients() throws Exception {
        ChatClient alice = register("alice");
        ChatClient idle = connect();

        server.stop();

        assertTrue(server.isDraining());
        assertTrue(alice.awaitDisconnect(WAIT));
        assertTrue(idle.awaitDisconnect(WAIT));
        assertEquals(0, sessionRegistry.size());
    }
}
