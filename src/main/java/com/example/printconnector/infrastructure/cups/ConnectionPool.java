package com.example.printconnector.infrastructure.cups;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * Gates and reuses connections to the print server.
 * <p>
 * A semaphore counts open connections. A released connection is offered to waiting borrowers for a short grace
 * window on a background thread and closed if nobody takes it, which frees its slot. Waiting borrowers poll
 * the hand-off in short slices so that a slot freed by a close is taken without waiting out the grace window.
 */
public class ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private static final long WAIT_SLICE_MILLIS = 50;

    private final PrintServerConnectionFactory factory;
    private final Semaphore slots;
    private final SynchronousQueue<PooledConnection> handOff = new SynchronousQueue<>();
    private final ExecutorService releaseExecutor;
    private final Duration connectTimeout;
    private final Duration maxConnectionAge;
    private final Duration idleGraceWindow;
    private final Clock clock;
    private volatile boolean shutdown;

    /**
     * @param factory          opens new sessions
     * @param maxConnections   maximum number of open sessions
     * @param connectTimeout   timeout handed to the factory for new sessions
     * @param maxConnectionAge age after which a session is reconnected before use
     * @param idleGraceWindow  how long a released session waits for a new borrower
     * @param releaseExecutor  runs the hand-off of released sessions; shut down with the pool
     * @param clock            time source for connection ages
     */
    public ConnectionPool(PrintServerConnectionFactory factory,
                          int maxConnections,
                          Duration connectTimeout,
                          Duration maxConnectionAge,
                          Duration idleGraceWindow,
                          ExecutorService releaseExecutor,
                          Clock clock) {
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        }
        this.factory = factory;
        this.slots = new Semaphore(maxConnections, true);
        this.connectTimeout = connectTimeout;
        this.maxConnectionAge = maxConnectionAge;
        this.idleGraceWindow = idleGraceWindow;
        this.releaseExecutor = releaseExecutor;
        this.clock = clock;
    }

    /**
     * Borrows a connection: a released one if available, a new one while below the limit, otherwise waits for a
     * released one.
     *
     * @return borrowed connection; must be handed to {@link #release} or {@link #discard}
     * @throws InterruptedException when interrupted while waiting
     */
    public PooledConnection acquire() throws InterruptedException {
        while (true) {
            ensureRunning();
            PooledConnection released = handOff.poll();
            if (released != null) {
                log.debug("Reusing released print server connection");
                return released;
            }
            if (slots.tryAcquire()) {
                return open();
            }
            released = handOff.poll(waitSliceMillis(), TimeUnit.MILLISECONDS);
            if (released != null) {
                log.debug("Reusing released print server connection after waiting");
                return released;
            }
        }
    }

    private long waitSliceMillis() {
        return Math.max(1, Math.min(idleGraceWindow.toMillis(), WAIT_SLICE_MILLIS));
    }

    private PooledConnection open() {
        try {
            PrintServerConnection connection = factory.open(connectTimeout);
            log.debug("Opened print server connection, {} slots left", slots.availablePermits());
            return new PooledConnection(connection, maxConnectionAge, clock);
        } catch (RuntimeException ex) {
            slots.release();
            throw ex;
        }
    }

    /**
     * Returns a healthy connection. The hand-off to a waiting borrower happens asynchronously.
     *
     * @param connection borrowed connection
     */
    public void release(PooledConnection connection) {
        try {
            releaseExecutor.execute(() -> handOffOrClose(connection));
        } catch (RejectedExecutionException ex) {
            closeAndFree(connection);
        }
    }

    /**
     * Closes a connection that failed and frees its slot.
     *
     * @param connection borrowed connection
     */
    public void discard(PooledConnection connection) {
        closeAndFree(connection);
    }

    private void handOffOrClose(PooledConnection connection) {
        try {
            if (!shutdown && handOff.offer(connection, idleGraceWindow.toMillis(), TimeUnit.MILLISECONDS)) {
                return;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        closeAndFree(connection);
    }

    private void closeAndFree(PooledConnection connection) {
        try {
            connection.close();
            log.debug("Closed print server connection");
        } catch (RuntimeException ex) {
            log.warn("Closing print server connection failed: {}", ex.getMessage());
        } finally {
            slots.release();
        }
    }

    /**
     * Stops lending connections. Connections still waiting for a borrower are closed.
     */
    public void shutdown() {
        shutdown = true;
        releaseExecutor.shutdown();
    }

    private void ensureRunning() {
        if (shutdown) {
            throw new IllegalStateException("Connection pool is shut down");
        }
    }
}
