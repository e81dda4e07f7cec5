package com.intteq.payment.messaging.connection;

import com.intteq.payment.messaging.exception.BrokerConnectionException;
import com.intteq.payment.messaging.exception.MessagingSetupException;
import com.intteq.payment.messaging.retry.DelayScheduler;
import com.intteq.payment.messaging.topology.TopologyDescriptor;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the single logical RabbitMQ connection and channel shared by publishers and consumers.
 *
 * <p><b>Lifecycle:</b></p>
 * <ul>
 *     <li>{@link #connect()} is idempotent: a live channel is reused, otherwise a new
 *     connection and channel are opened and the {@link TopologyDescriptor} is applied.</li>
 *     <li>A connection or channel shutdown that was not requested through {@link #close()}
 *     is logged and triggers a reconnect after {@code reconnectDelay}, forever unless
 *     {@code maxReconnectAttempts} is set.</li>
 *     <li>Connectivity failures are never fatal. Topology setup failures are, and are
 *     propagated without retry.</li>
 * </ul>
 *
 * <p>This class is the only place the connection and channel references are mutated.
 * Other components obtain the channel through {@link #connect()} on every use and must
 * never hold on to a channel after it has been closed.
 *
 * <p>Automatic recovery of the RabbitMQ client must be disabled on the supplied
 * {@link ConnectionFactory}; recovery is driven from here.
 */
@Slf4j
public class BrokerConnectionManager implements AutoCloseable {

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    private final ConnectionFactory connectionFactory;
    private final TopologyDescriptor topology;
    private final DelayScheduler scheduler;
    private final Duration reconnectDelay;
    private final int maxReconnectAttempts;
    private final String connectionName;

    private final Object lifecycleLock = new Object();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean blocked;
    private volatile boolean closed;

    public BrokerConnectionManager(ConnectionFactory connectionFactory,
                                   TopologyDescriptor topology,
                                   DelayScheduler scheduler,
                                   Duration reconnectDelay,
                                   int maxReconnectAttempts,
                                   String connectionName) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory must not be null");
        this.topology = Objects.requireNonNull(topology, "topology must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.connectionName = connectionName;
    }

    public BrokerConnectionManager(ConnectionFactory connectionFactory,
                                   TopologyDescriptor topology,
                                   DelayScheduler scheduler) {
        this(connectionFactory, topology, scheduler, DEFAULT_RECONNECT_DELAY, 0, "payment-messaging");
    }

    // =====================================================================
    // CONNECT
    // =====================================================================

    /**
     * Return the live channel, establishing connection, channel and topology if needed.
     *
     * @throws BrokerConnectionException if the broker cannot be reached (a reconnect is scheduled)
     * @throws MessagingSetupException   if the broker refuses the topology (no retry)
     * @throws IllegalStateException     if the manager has been closed
     */
    public Channel connect() {
        Channel established;
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Broker connection manager is closed");
            }
            if (isConnected()) {
                return channel;
            }
            established = establish();
        }
        notifyConnected(established);
        return established;
    }

    private Channel establish() {
        releaseStale();
        state = ConnectionState.CONNECTING;

        Connection newConnection = null;
        try {
            newConnection = connectionFactory.newConnection(connectionName);
            Channel newChannel = newConnection.createChannel();
            if (newChannel == null) {
                throw new IOException("Broker refused to open a channel (channel-max reached)");
            }

            topology.declare(newChannel);

            connection = newConnection;
            channel = newChannel;
            blocked = false;
            consecutiveFailures.set(0);
            state = ConnectionState.CONNECTED;
            // registered after the fields are set: a listener added to an already closed
            // connection fires immediately and must be recognized as current
            watch(newConnection, newChannel);

            log.info("RabbitMQ connected successfully: name={} host={} port={}",
                    connectionName, connectionFactory.getHost(), connectionFactory.getPort());
            return newChannel;

        } catch (MessagingSetupException e) {
            state = ConnectionState.ERROR;
            closeQuietly(newConnection);
            log.error("RabbitMQ topology setup failed, not retrying", e);
            throw e;

        } catch (IOException | TimeoutException | RuntimeException e) {
            state = ConnectionState.ERROR;
            closeQuietly(newConnection);
            log.error("Failed to connect to RabbitMQ: {}", e.getMessage(), e);
            scheduleReconnect();
            throw new BrokerConnectionException("Failed to connect to RabbitMQ", e);
        }
    }

    private void watch(Connection conn, Channel ch) {
        conn.addShutdownListener(cause -> onShutdown(conn, "connection", cause));
        ch.addShutdownListener(cause -> onShutdown(conn, "channel", cause));
        conn.addBlockedListener(
                reason -> {
                    blocked = true;
                    log.warn("RabbitMQ connection blocked by broker: {}", reason);
                },
                () -> {
                    blocked = false;
                    log.info("RabbitMQ connection unblocked");
                });
    }

    // =====================================================================
    // RECONNECT
    // =====================================================================

    /**
     * Shutdown listeners run on the client's I/O thread and never take the lifecycle lock;
     * a stale or intentionally closed connection is recognized by identity.
     */
    private void onShutdown(Connection source, String level, ShutdownSignalException cause) {
        if (closed || source != connection) {
            return;
        }
        if (!cause.isInitiatedByApplication()) {
            log.error("RabbitMQ {} error: {}", level, cause.getMessage());
        }
        log.warn("RabbitMQ {} closed. Reconnecting in {}ms...", level, reconnectDelay.toMillis());
        blocked = false;
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        int attempt = consecutiveFailures.incrementAndGet();
        if (maxReconnectAttempts > 0 && attempt > maxReconnectAttempts) {
            reconnectScheduled.set(false);
            state = ConnectionState.ERROR;
            log.error("Giving up on RabbitMQ after {} consecutive reconnect attempts", maxReconnectAttempts);
            return;
        }
        state = ConnectionState.RECONNECTING;
        scheduler.schedule(this::reconnect, reconnectDelay);
    }

    private void reconnect() {
        reconnectScheduled.set(false);
        if (closed) {
            return;
        }
        try {
            connect();
        } catch (BrokerConnectionException e) {
            log.debug("Reconnect attempt failed, next attempt already scheduled");
        } catch (MessagingSetupException e) {
            log.error("Reconnect stopped: broker topology must be fixed by an operator");
        }
    }

    // =====================================================================
    // ACCESSORS
    // =====================================================================

    public boolean isConnected() {
        Connection conn = connection;
        Channel ch = channel;
        return state == ConnectionState.CONNECTED
                && conn != null && conn.isOpen()
                && ch != null && ch.isOpen();
    }

    /**
     * Whether the broker currently refuses to accept publishes (resource alarm).
     */
    public boolean isBlocked() {
        return blocked;
    }

    public ConnectionState getState() {
        return state;
    }

    public TopologyDescriptor getTopology() {
        return topology;
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Run {@code callback} on a short-lived channel of the current connection.
     * A channel-level error raised by the callback then cannot close the shared channel.
     */
    public <T> T withTemporaryChannel(ChannelCallback<T> callback) throws IOException {
        connect();
        Connection conn = connection;
        if (conn == null) {
            throw new IOException("RabbitMQ connection was lost");
        }
        Channel temporary = conn.createChannel();
        if (temporary == null) {
            throw new IOException("Broker refused to open a channel (channel-max reached)");
        }
        try {
            return callback.doInChannel(temporary);
        } finally {
            closeQuietly(temporary);
        }
    }

    private void notifyConnected(Channel established) {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onConnected(established);
            } catch (RuntimeException e) {
                log.error("Connection listener {} failed", listener, e);
            }
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    /**
     * Close channel, then connection, and stop reconnecting. Safe to call more than once.
     */
    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            releaseStale();
            state = ConnectionState.CLOSED;
            log.info("RabbitMQ connection closed");
        }
    }

    /**
     * For use outside a Spring context: close on SIGINT / SIGTERM.
     */
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::close, "messaging-shutdown"));
    }

    private void releaseStale() {
        Channel staleChannel = channel;
        Connection staleConnection = connection;
        channel = null;
        connection = null;
        closeQuietly(staleChannel);
        closeQuietly(staleConnection);
    }

    private static void closeQuietly(Channel ch) {
        if (ch == null || !ch.isOpen()) {
            return;
        }
        try {
            ch.close();
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.warn("Error closing RabbitMQ channel: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null || !conn.isOpen()) {
            return;
        }
        try {
            conn.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Error closing RabbitMQ connection: {}", e.getMessage());
        }
    }
}
