package io.relaychat.server.session;

import io.relaychat.core.codec.FrameCodec;
import io.relaychat.core.protocol.ServerMessage;
import io.relaychat.server.metrics.MetricsService;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A registered participant and its outbound path.
 * <p>
 * Every frame for the client, replies and relays alike, is queued on a bounded sink and
 * written by the session's own writer thread. Callers on other connections never touch the socket.
 * </p>
 */
public class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);

    @Getter
    private final String handle;
    @Getter
    private final String remoteAddress;
    private final Sinks.Many<ServerMessage> sink;
    private final MetricsService metricsService;
    private final CountDownLatch writerDone = new CountDownLatch(1);

    private boolean closed;
    private Disposable writer;

    public Session(String handle, String remoteAddress, Sinks.Many<ServerMessage> sink, MetricsService metricsService) {
        this.handle = handle;
        this.remoteAddress = remoteAddress;
        this.sink = sink;
        this.metricsService = metricsService;
    }

    /**
     * Queues a frame for this client without blocking.
     *
     * @param message frame to deliver
     * @return false if the frame was dropped because the buffer is full or the session is closed
     */
    public synchronized boolean send(ServerMessage message) {
        if (closed) {
            metricsService.recordDropClosed();
            log.debug("Dropping {} for closed session {}", message.getClass().getSimpleName(), handle);
            return false;
        }

        Sinks.EmitResult result = sink.tryEmitNext(message);
        if (result.isFailure()) {
            log.warn("Failed to queue {} for {}: {}", message.getClass().getSimpleName(), handle, result);
            if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                metricsService.recordDropBufferFull();
            } else {
                metricsService.recordDropClosed();
            }
            return false;
        }
        return true;
    }

    public Flux<ServerMessage> getOutboundFlux() {
        return sink.asFlux();
    }

    /**
     * Starts draining queued frames to {@code out} on a dedicated thread.
     * <p>
     * When the queue completes or a write fails, {@code transport} is closed, which in turn
     * ends the connection's read loop.
     * </p>
     */
    public synchronized void startWriter(FrameCodec codec, OutputStream out, Closeable transport) {
        if (writer != null) {
            throw new IllegalStateException("Writer already started for " + handle);
        }
        Scheduler scheduler = Schedulers.newSingle("writer-" + handle, true);
        writer = getOutboundFlux()
            .publishOn(scheduler, 1)
            .doFinally(signal -> {
                closeTransport(transport);
                scheduler.dispose();
                writerDone.countDown();
            })
            .subscribe(
                message -> write(codec, out, message),
                err -> log.debug("Writer for {} stopped: {}", handle, err.getMessage()),
                () -> log.debug("Writer for {} drained", handle)
            );
    }

    /**
     * Stops accepting frames. Frames already queued are still written if the writer runs.
     */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        sink.tryEmitComplete();
    }

    /**
     * Waits for the writer to flush every queued frame and close the transport.
     * Only meaningful after {@link #close()}.
     *
     * @return true if the writer finished within {@code timeout}, or was never started
     */
    public boolean awaitWriter(Duration timeout) throws InterruptedException {
        synchronized (this) {
            if (writer == null) {
                return true;
            }
        }
        return writerDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void write(FrameCodec codec, OutputStream out, ServerMessage message) {
        try {
            int bytes = codec.writeFrame(out, message);
            metricsService.recordOutbound(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void closeTransport(Closeable transport) {
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Error closing transport for {}: {}", handle, e.getMessage());
        }
    }
}
