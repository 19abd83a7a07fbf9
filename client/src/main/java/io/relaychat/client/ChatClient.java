package io.relaychat.client;

import io.relaychat.core.codec.DecodeException;
import io.relaychat.core.codec.FrameCodec;
import io.relaychat.core.protocol.ClientMessage;
import io.relaychat.core.protocol.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking client for the relay protocol.
 * <p>
 * Requests are written on the caller's thread. A background reader decodes every server
 * frame into a queue consumed with {@link #receive(Duration)}, since relayed chat messages
 * arrive independently of any request.
 * </p>
 */
public class ChatClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    private final Socket socket;
    private final FrameCodec codec;
    private final OutputStream out;
    private final BlockingQueue<ServerMessage> inbox = new LinkedBlockingQueue<>();
    private final CountDownLatch disconnected = new CountDownLatch(1);

    private ChatClient(Socket socket, FrameCodec codec) throws IOException {
        this.socket = socket;
        this.codec = codec;
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    public static ChatClient connect(String host, int port) throws IOException {
        return connect(host, port, new FrameCodec());
    }

    public static ChatClient connect(String host, int port, FrameCodec codec) throws IOException {
        Socket socket = new Socket();
        socket.setTcpNoDelay(true);
        socket.connect(new InetSocketAddress(host, port));

        ChatClient client = new ChatClient(socket, codec);
        InputStream in = new BufferedInputStream(socket.getInputStream());
        Thread reader = new Thread(() -> client.readLoop(in), "chat-client-reader");
        reader.setDaemon(true);
        reader.start();
        return client;
    }

    public synchronized void send(ClientMessage message) throws IOException {
        codec.writeFrame(out, message);
    }

    /**
     * Waits for the next server frame.
     *
     * @return the frame, or empty if none arrived within {@code timeout}
     */
    public Optional<ServerMessage> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Waits until the server closes the connection.
     *
     * @return true if the connection was closed within {@code timeout}
     */
    public boolean awaitDisconnect(Duration timeout) throws InterruptedException {
        return disconnected.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isConnected() {
        return disconnected.getCount() > 0;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private void readLoop(InputStream in) {
        try {
            while (true) {
                Optional<byte[]> frame = codec.readFrame(in);
                if (frame.isEmpty()) {
                    log.debug("Server closed the connection");
                    return;
                }
                try {
                    inbox.add(codec.decodeServerMessage(frame.get()));
                } catch (DecodeException e) {
                    log.warn("Ignoring undecodable server frame: {}", e.getMessage());
                }
            }
        } catch (IOException e) {
            if (!socket.isClosed()) {
                log.debug("Connection lost: {}", e.getMessage());
            }
        } finally {
            disconnected.countDown();
        }
    }
}
