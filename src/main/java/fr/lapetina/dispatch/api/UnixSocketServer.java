package fr.lapetina.dispatch.api;

import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.dispatch.infrastructure.wire.WireCodec;
import jdk.net.ExtendedSocketOptions;
import jdk.net.UnixDomainPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Unix domain stream socket listener. One request per connection.
 *
 * Each accepted connection runs on its own task: read one frame within the read timeout
 * and frame size limit, hand it to the {@link ConnectionHandler}, write the single
 * response frame and close. A connection that delivers no bytes gets no response.
 */
public final class UnixSocketServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnixSocketServer.class);

    private static final int INITIAL_READ_BUFFER = 4096;

    private final Path socketPath;
    private final int maxFrameBytes;
    private final long readTimeoutMs;
    private final int backlog;
    private final ConnectionHandler handler;
    private final MetricsRegistry metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ExecutorService connectionExecutor;
    private ServerSocketChannel serverChannel;
    private Thread acceptor;

    public UnixSocketServer(
            Path socketPath,
            int maxFrameBytes,
            long readTimeoutMs,
            int backlog,
            ConnectionHandler handler,
            MetricsRegistry metrics
    ) {
        this.socketPath = socketPath;
        this.maxFrameBytes = maxFrameBytes;
        this.readTimeoutMs = readTimeoutMs;
        this.backlog = backlog;
        this.handler = handler;
        this.metrics = metrics;
        this.connectionExecutor = Executors.newCachedThreadPool(new ConnectionThreadFactory("conn-handler"));
    }

    public UnixSocketServer(DispatchConfig.ServerConfig config, ConnectionHandler handler, MetricsRegistry metrics) {
        this(Paths.get(config.getSocketPath()), config.getMaxFrameBytes(), config.getReadTimeoutMs(),
                config.getBacklog(), handler, metrics);
    }

    /**
     * Binds the socket, replacing a stale socket file, and starts accepting.
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Path parent = socketPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(socketPath);

        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socketPath), backlog);

        acceptor = new Thread(this::acceptLoop, "uds-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();

        log.info("Unix socket listener started: path={}, maxFrameBytes={}, readTimeoutMs={}",
                socketPath, maxFrameBytes, readTimeoutMs);
    }

    private void acceptLoop() {
        while (running.get()) {
            try {
                SocketChannel channel = serverChannel.accept();
                connectionExecutor.execute(() -> serve(channel));
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (running.get()) {
                    log.error("Accept failed on {}", socketPath, e);
                }
            } catch (RuntimeException e) {
                log.error("Connection task rejected", e);
            }
        }
        log.debug("Acceptor loop exited: path={}", socketPath);
    }

    private void serve(SocketChannel channel) {
        try (channel) {
            String peer = peerIdentity(channel);
            byte[] frame = readFrame(channel);
            if (frame == null) {
                metrics.incrementListener("read_error");
                log.warn("No request frame received: peer={}", peer);
                return;
            }
            byte[] response = handler.handle(frame, peer);
            ByteBuffer out = ByteBuffer.wrap(response);
            while (out.hasRemaining()) {
                channel.write(out);
            }
        } catch (IOException e) {
            metrics.incrementListener("read_error");
            log.warn("Connection I/O failed: {}", e.toString());
        }
    }

    /**
     * Reads until a complete frame is buffered, the declared frame exceeds the limit, the
     * buffer reaches the limit, the peer closes or the read timeout expires.
     *
     * @return the bytes read, or {@code null} if none arrived
     */
    byte[] readFrame(SocketChannel channel) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(Math.min(INITIAL_READ_BUFFER, maxFrameBytes));
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(readTimeoutMs);

        channel.configureBlocking(false);
        try (Selector selector = Selector.open()) {
            channel.register(selector, SelectionKey.OP_READ);
            while (true) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    log.debug("Read timeout: bytes={}", buf.position());
                    break;
                }
                selector.select(remainingMs);
                selector.selectedKeys().clear();

                int n = channel.read(buf);
                if (n < 0) {
                    break;
                }
                if (n == 0) {
                    continue;
                }

                long required = WireCodec.requiredRequestLength(buf.array(), 0, buf.position());
                if (required >= 0 && (buf.position() >= required || required > maxFrameBytes)) {
                    break;
                }
                if (!buf.hasRemaining()) {
                    if (buf.capacity() >= maxFrameBytes) {
                        break;
                    }
                    ByteBuffer bigger = ByteBuffer.allocate((int) Math.min((long) buf.capacity() * 2, maxFrameBytes));
                    buf.flip();
                    bigger.put(buf);
                    buf = bigger;
                }
            }
        }
        channel.configureBlocking(true);

        return buf.position() == 0 ? null : Arrays.copyOf(buf.array(), buf.position());
    }

    private static String peerIdentity(SocketChannel channel) {
        try {
            UnixDomainPrincipal principal = channel.getOption(ExtendedSocketOptions.SO_PEERCRED);
            return principal != null ? principal.user().getName() : null;
        } catch (IOException | UnsupportedOperationException e) {
            return null;
        }
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            serverChannel.close();
        } catch (IOException e) {
            log.warn("Error closing server channel", e);
        }
        connectionExecutor.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            connectionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Could not remove socket file {}", socketPath, e);
        }
        log.info("Unix socket listener stopped: path={}", socketPath);
    }

    private static final class ConnectionThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        ConnectionThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
