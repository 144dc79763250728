package com.jobd.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts client connections on the daemon's Unix socket.
 * <p>
 * Every connection gets a reader thread and its own framer. Requests are handled on a
 * shared worker pool, so a long {@code triggerJob} never holds up other requests, and
 * responses may leave in a different order than their requests arrived.
 */
public class DaemonServer {
    private static final Logger log = LoggerFactory.getLogger(DaemonServer.class);

    private final Path socketPath;
    private final RequestDispatcher dispatcher;
    private final ObjectMapper mapper;
    private final int maxBufferBytes;
    private final Set<Connection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocketChannel server;
    private ExecutorService readers;
    private ExecutorService workers;
    private Thread acceptor;
    private volatile boolean running;

    public DaemonServer(Path socketPath, RequestDispatcher dispatcher, ObjectMapper mapper, int maxBufferBytes) {
        this.socketPath = socketPath;
        this.dispatcher = dispatcher;
        this.mapper = mapper;
        this.maxBufferBytes = maxBufferBytes;
    }

    /** Binds the socket, replacing a stale socket file, and starts accepting. */
    public synchronized void start() throws IOException {
        if (running) return;
        Files.deleteIfExists(socketPath);
        if (socketPath.getParent() != null) Files.createDirectories(socketPath.getParent());

        server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        server.bind(UnixDomainSocketAddress.of(socketPath));
        try {
            Files.setPosixFilePermissions(socketPath, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.warn("Cannot restrict permissions of {}: {}", socketPath, e.getMessage());
        }

        readers = Executors.newCachedThreadPool(named("jobd-conn-"));
        workers = Executors.newCachedThreadPool(named("jobd-worker-"));
        running = true;
        acceptor = new Thread(this::acceptLoop, "jobd-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Listening on {}", socketPath);
    }

    public boolean isRunning() {
        return running;
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public int connectionCount() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running) {
            try {
                SocketChannel channel = server.accept();
                Connection conn = new Connection(channel);
                connections.add(conn);
                readers.execute(conn::readLoop);
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (running) log.warn("Accept failed: {}", e.getMessage());
            } catch (RejectedExecutionException e) {
                break;
            }
        }
    }

    /** Stops accepting, closes every connection and removes the socket file. */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        try {
            server.close();
        } catch (IOException e) {
            log.debug("Error closing server socket: {}", e.getMessage());
        }
        for (Connection conn : connections) conn.close();
        readers.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            log.warn("Could not remove socket file {}: {}", socketPath, e.getMessage());
        }
        log.info("Server stopped");
    }

    private final class Connection {
        private final SocketChannel channel;
        private final MessageFramer framer = new MessageFramer(mapper, maxBufferBytes);
        private final Object writeLock = new Object();

        Connection(SocketChannel channel) {
            this.channel = channel;
        }

        void readLoop() {
            ByteBuffer buffer = ByteBuffer.allocate(8192);
            try {
                while (running && channel.isOpen()) {
                    buffer.clear();
                    int n = channel.read(buffer);
                    if (n < 0) break;
                    for (JsonNode message : framer.frameIncoming(buffer.array(), 0, n)) {
                        workers.execute(() -> handle(message));
                    }
                }
            } catch (IOException e) {
                log.debug("Connection closed: {}", e.getMessage());
            } catch (RejectedExecutionException e) {
                log.debug("Server shutting down, dropping request");
            } finally {
                close();
            }
        }

        private void handle(JsonNode message) {
            RequestDispatcher.Reply reply = dispatcher.dispatch(message);
            write(reply.getResponse());
            reply.getFollowUp().ifPresent(action -> {
                Thread t = new Thread(action, "jobd-control");
                t.start();
            });
        }

        private void write(DaemonResponse response) {
            byte[] bytes;
            try {
                bytes = mapper.writeValueAsBytes(response);
            } catch (IOException e) {
                log.error("Cannot encode response {}: {}", response.getId(), e.getMessage());
                return;
            }
            synchronized (writeLock) {
                try {
                    ByteBuffer out = ByteBuffer.wrap(bytes);
                    while (out.hasRemaining()) channel.write(out);
                } catch (IOException e) {
                    log.debug("Could not deliver response {}: {}", response.getId(), e.getMessage());
                }
            }
        }

        void close() {
            connections.remove(this);
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("Error closing connection: {}", e.getMessage());
            }
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
