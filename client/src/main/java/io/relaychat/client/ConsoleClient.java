package io.relaychat.client;

import io.relaychat.core.protocol.ClientMessages;
import io.relaychat.core.protocol.Message;
import io.relaychat.core.protocol.ServerMessage;
import io.relaychat.core.protocol.ServerMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Plain line-based console client.
 * <p>
 * Usage: {@code ConsoleClient [host:port]} (default {@code 127.0.0.1:8080}). The first line
 * typed is the handle; after that see {@link #HELP}.
 * </p>
 */
public class ConsoleClient {
    private static final Logger log = LoggerFactory.getLogger(ConsoleClient.class);

    static final String HELP = String.join(System.lineSeparator(),
        "Commands:",
        "  /users        Display available users.",
        "  /chat <user>  Enter a chat with a target user.",
        "  /exit         Exit a chat, or the client from the main console.",
        "  /help         Display this help message.");

    private static final Duration REGISTRATION_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final ChatClient client;
    private final BufferedReader input;
    private final PrintStream output;

    private volatile String partner;

    ConsoleClient(ChatClient client, BufferedReader input, PrintStream output) {
        this.client = client;
        this.input = input;
        this.output = output;
    }

    public static void main(String[] args) throws Exception {
        String address = args.length > 0 ? args[0] : "127.0.0.1:8080";
        InetSocketAddress server;
        try {
            server = parseAddress(address);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.exit(2);
            return;
        }
        String host = server.getHostString();
        int port = server.getPort();

        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (ChatClient client = ChatClient.connect(host, port)) {
            new ConsoleClient(client, stdin, System.out).run();
        } catch (IOException e) {
            log.error("Cannot reach {}: {}", address, e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code address} is not {@code host:port} with a valid port
     */
    static InetSocketAddress parseAddress(String address) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Expected host:port but got '" + address + "'");
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in '" + address + "'");
        }
        return InetSocketAddress.createUnresolved(address.substring(0, colon), port);
    }

    void run() throws IOException, InterruptedException {
        if (!register()) {
            return;
        }
        output.println(HELP);

        Thread printer = new Thread(this::printIncoming, "console-printer");
        printer.setDaemon(true);
        printer.start();

        String line;
        while (client.isConnected() && (line = input.readLine()) != null) {
            if (!handleLine(ConsoleCommand.parse(line))) {
                break;
            }
        }
    }

    private boolean register() throws IOException, InterruptedException {
        String handle = null;
        while (handle == null || handle.isBlank()) {
            output.println("Enter your handle:");
            handle = input.readLine();
            if (handle == null) {
                return false;
            }
            handle = handle.trim();
        }

        client.send(new ClientMessages.Register(handle));
        Optional<ServerMessage> reply = client.receive(REGISTRATION_TIMEOUT);
        if (reply.isPresent() && reply.get() instanceof ServerMessages.Registered) {
            output.println("Registered as " + handle);
            return true;
        }
        output.println(reply.map(this::render).orElse("No reply from server"));
        return false;
    }

    /**
     * @return false when the user asked to quit
     */
    private boolean handleLine(ConsoleCommand command) throws IOException {
        switch (command.getKind()) {
            case USERS -> client.send(new ClientMessages.ListUsers());
            case CHAT -> {
                partner = command.getArgument();
                client.send(new ClientMessages.GetMessages(partner));
            }
            case EXIT -> {
                if (partner == null) {
                    return false;
                }
                output.println("Left chat with " + partner);
                partner = null;
            }
            case HELP -> output.println(HELP);
            case INVALID -> output.println(command.getArgument());
            case TEXT -> {
                if (command.getArgument().isBlank()) {
                    return true;
                }
                if (partner == null) {
                    output.println("Please connect to a chat to send a message.");
                } else {
                    client.send(new ClientMessages.SendMessage(command.getArgument(), partner));
                }
            }
        }
        return true;
    }

    private void printIncoming() {
        try {
            while (client.isConnected()) {
                client.receive(POLL_INTERVAL).map(this::render).ifPresent(output::println);
            }
            output.println("Disconnected from server");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    String render(ServerMessage message) {
        if (message instanceof ServerMessages.UserList userList) {
            return "Users: " + String.join(", ", userList.getUsers());
        } else if (message instanceof ServerMessages.ChatMessages history) {
            if (history.getMessages().isEmpty()) {
                return "Chat with " + history.getPartner() + " (no messages yet)";
            }
            return "Chat with " + history.getPartner() + System.lineSeparator()
                + history.getMessages().stream()
                    .map(ConsoleClient::format)
                    .collect(Collectors.joining(System.lineSeparator()));
        } else if (message instanceof ServerMessages.ChatMessage chatMessage) {
            if (chatMessage.getSender().equals(partner)) {
                return chatMessage.getSender() + ": " + chatMessage.getContent();
            }
            return String.format("%s just sent you a message. Join the chat using the command '/chat %s'",
                chatMessage.getSender(), chatMessage.getSender());
        } else if (message instanceof ServerMessages.Error error) {
            return "Error: " + error.getMessage();
        } else if (message instanceof ServerMessages.Registered registered) {
            return "Registered as " + registered.getHandle();
        }
        return message.toString();
    }

    void setPartner(String partner) {
        this.partner = partner;
    }

    private static String format(Message message) {
        return message.getSender() + ": " + message.getContent();
    }
}
