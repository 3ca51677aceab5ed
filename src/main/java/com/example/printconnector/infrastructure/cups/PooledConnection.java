package com.example.printconnector.infrastructure.cups;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Pool-owned wrapper around one {@link PrintServerConnection}.
 * <p>
 * Every call holds the connection's lock for its whole duration, so one request owns the session from start to
 * finish even if a caller leaks the handle to another thread. Sessions older than the configured age are
 * reconnected before the next call.
 */
public final class PooledConnection {

    private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

    private final PrintServerConnection connection;
    private final Duration maxAge;
    private final Clock clock;
    private final ReentrantLock callLock = new ReentrantLock();
    private Instant connectedAt;

    PooledConnection(PrintServerConnection connection, Duration maxAge, Clock clock) {
        this.connection = connection;
        this.maxAge = maxAge;
        this.clock = clock;
        this.connectedAt = clock.instant();
    }

    /**
     * Runs one request on the session.
     *
     * @param operation request to run
     * @param <T>       result type
     * @return result of the request
     */
    public <T> T call(Function<PrintServerConnection, T> operation) {
        callLock.lock();
        try {
            reconnectIfStale();
            return operation.apply(connection);
        } finally {
            callLock.unlock();
        }
    }

    private void reconnectIfStale() {
        Instant now = clock.instant();
        if (Duration.between(connectedAt, now).compareTo(maxAge) > 0) {
            log.debug("Connection older than {}, reconnecting", maxAge);
            connection.reconnect();
            connectedAt = now;
        }
    }

    void close() {
        callLock.lock();
        try {
            connection.close();
        } finally {
            callLock.unlock();
        }
    }
}
