package com.ivamare.ordersaga.router;

import com.ivamare.ordersaga.exception.MalformedMessageException;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.ops.IncidentKind;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.PgmqMessage;
import com.ivamare.ordersaga.pgmq.QueueNames;
import com.ivamare.ordersaga.runtime.SagaOutcome;
import com.ivamare.ordersaga.runtime.SagaRuntime;
import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads the saga inbox and hands each message to the {@link SagaRuntime}.
 *
 * <p>Uses a fixed worker pool bounded by a semaphore, and pg_notify (or plain polling)
 * to wake up when messages arrive. A message is removed from the inbox in the same
 * transaction that records its effect on the saga:
 * <ul>
 *   <li>applied, duplicate and ignored messages are deleted (or archived when configured)</li>
 *   <li>rejected checkouts and contract violations are always archived</li>
 *   <li>undecodable payloads are archived with a MALFORMED_MESSAGE incident</li>
 *   <li>messages whose retries were exhausted stay queued and reappear after the visibility timeout</li>
 *   <li>a message that failed with an unexpected error on its {@code maxReadCount}-th read is archived
 *       with a POISON_MESSAGE incident</li>
 * </ul>
 */
public class SagaMessageRouter {

    private static final Logger log = LoggerFactory.getLogger(SagaMessageRouter.class);

    private final DataSource dataSource;
    private final TransactionTemplate transactionTemplate;
    private final SagaRuntime runtime;
    private final InboundMessageCodec codec;
    private final SagaIncidentQueue incidents;
    private final PgmqClient pgmqClient;
    private final String inboxQueue;
    private final int visibilityTimeout;
    private final int concurrency;
    private final long pollIntervalMs;
    private final boolean useNotify;
    private final boolean archiveMessages;
    private final int maxReadCount;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final Semaphore semaphore;

    private ExecutorService loopExecutor;
    private ExecutorService workers;

    public SagaMessageRouter(
            DataSource dataSource,
            TransactionTemplate transactionTemplate,
            SagaRuntime runtime,
            InboundMessageCodec codec,
            SagaIncidentQueue incidents,
            PgmqClient pgmqClient,
            String inboxQueue,
            int visibilityTimeout,
            int concurrency,
            long pollIntervalMs,
            boolean useNotify,
            boolean archiveMessages,
            int maxReadCount) {
        this.dataSource = dataSource;
        this.transactionTemplate = transactionTemplate;
        this.runtime = runtime;
        this.codec = codec;
        this.incidents = incidents;
        this.pgmqClient = pgmqClient;
        this.inboxQueue = inboxQueue;
        this.visibilityTimeout = visibilityTimeout;
        this.concurrency = concurrency;
        this.pollIntervalMs = pollIntervalMs;
        this.useNotify = useNotify;
        this.archiveMessages = archiveMessages;
        this.maxReadCount = maxReadCount;
        this.semaphore = new Semaphore(concurrency);
    }

    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    public String getInboxQueue() {
        return inboxQueue;
    }

    public int inFlightCount() {
        return inFlightCount.get();
    }

    /**
     * Start the router.
     */
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Saga router for {} already running", inboxQueue);
            return;
        }

        stopping.set(false);
        loopExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "saga-router-" + inboxQueue));
        workers = Executors.newFixedThreadPool(concurrency);

        log.info("Starting saga router on {} (concurrency={}, useNotify={})",
            inboxQueue, concurrency, useNotify);

        loopExecutor.submit(this::runLoop);
    }

    /**
     * Stop the router gracefully, letting in-flight messages finish.
     */
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping saga router for {}, waiting for {} in-flight messages",
            inboxQueue, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight messages", inFlightCount.get());
                }

                running.set(false);
                loopExecutor.shutdown();
                workers.shutdown();

                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
                if (!loopExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                    loopExecutor.shutdownNow();
                }

                log.info("Saga router for {} stopped", inboxQueue);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    /**
     * Stop the router immediately.
     */
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (loopExecutor != null) {
            loopExecutor.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    // --- Main Processing Loop ---

    private void runLoop() {
        log.debug("Saga router loop started for {}", inboxQueue);

        try {
            if (useNotify) {
                runWithNotify();
            } else {
                runWithPolling();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            if (!stopping.get()) {
                log.error("Saga router crashed for {}", inboxQueue, e);
            }
        } finally {
            running.set(false);
            log.debug("Saga router loop ended for {}", inboxQueue);
        }
    }

    private void runWithNotify() throws SQLException, InterruptedException {
        String channel = QueueNames.notifyChannel(inboxQueue);

        try (Connection listenConn = dataSource.getConnection()) {
            listenConn.setAutoCommit(true);

            try (var stmt = listenConn.createStatement()) {
                stmt.execute("LISTEN " + channel);
            }
            log.debug("Listening on channel {}", channel);

            PGConnection pgConn = listenConn.unwrap(PGConnection.class);

            while (running.get() && !stopping.get()) {
                drainQueue();
                if (stopping.get()) return;

                // Delayed timeouts never notify, so the wait doubles as the poll interval
                pgConn.getNotifications((int) pollIntervalMs);
            }
        }
    }

    private void runWithPolling() throws InterruptedException {
        while (running.get() && !stopping.get()) {
            drainQueue();
            if (stopping.get()) return;

            Thread.sleep(pollIntervalMs);
        }
    }

    /**
     * Read and dispatch until the inbox is empty. Returns the number of messages dispatched.
     */
    int drainQueue() throws InterruptedException {
        int dispatched = 0;
        while (running.get() && !stopping.get()) {
            if (!semaphore.tryAcquire(100, TimeUnit.MILLISECONDS)) {
                continue;
            }
            // Holding one permit; take whatever else is free for this batch
            int permits = 1 + semaphore.drainPermits();

            List<PgmqMessage> messages;
            try {
                messages = pgmqClient.read(inboxQueue, visibilityTimeout, permits);
            } catch (RuntimeException e) {
                semaphore.release(permits);
                throw e;
            }

            if (messages.size() < permits) {
                semaphore.release(permits - messages.size());
            }
            if (messages.isEmpty()) {
                break;
            }

            for (PgmqMessage msg : messages) {
                inFlightCount.incrementAndGet();
                workers.submit(() -> processMessage(msg));
                dispatched++;
            }
        }
        return dispatched;
    }

    void processMessage(PgmqMessage msg) {
        InboundMessage message = null;
        try {
            try {
                message = codec.decode(msg.message());
            } catch (MalformedMessageException e) {
                quarantine(msg, e);
                return;
            }

            SagaOutcome outcome = runtime.handle(message, result -> acknowledge(msg.msgId(), result));
            if (!outcome.isSettled()) {
                log.warn("Message {} ({}) for order {} left on {} for redelivery",
                    msg.msgId(), message.type().wireName(), message.orderId(), inboxQueue);
            } else {
                log.debug("Message {} for order {}: {}", msg.msgId(), message.orderId(), outcome.result());
            }
        } catch (Exception e) {
            if (msg.readCount() >= maxReadCount) {
                setAside(msg, message, e);
            } else {
                log.error("Error processing inbox message {} (read {} of {})",
                    msg.msgId(), msg.readCount(), maxReadCount, e);
            }
        } finally {
            inFlightCount.decrementAndGet();
            semaphore.release();
        }
    }

    private void acknowledge(long msgId, SagaOutcome outcome) {
        switch (outcome.result()) {
            case REJECTED, VIOLATION -> pgmqClient.archive(inboxQueue, msgId);
            default -> removeMessage(msgId);
        }
    }

    private void quarantine(PgmqMessage msg, MalformedMessageException e) {
        log.error("Malformed message {} on {}: {}", msg.msgId(), inboxQueue, e.getMessage());
        transactionTemplate.executeWithoutResult(status -> {
            incidents.raise(null, null, IncidentKind.MALFORMED_MESSAGE,
                "msg_id=" + msg.msgId() + ": " + e.getMessage());
            pgmqClient.archive(inboxQueue, msg.msgId());
        });
    }

    private void setAside(PgmqMessage msg, InboundMessage message, Exception cause) {
        String detail = "msg_id=" + msg.msgId() + " failed " + msg.readCount() + " times: " + cause.getMessage();
        log.error("Archiving inbox message {} after {} failed reads", msg.msgId(), msg.readCount(), cause);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                incidents.raise(message != null ? message.orderId() : null,
                    message != null ? message.messageId() : null,
                    IncidentKind.POISON_MESSAGE, detail);
                pgmqClient.archive(inboxQueue, msg.msgId());
            });
        } catch (RuntimeException e) {
            log.error("Could not archive inbox message {}; it stays queued", msg.msgId(), e);
        }
    }

    /**
     * Remove a message from the queue - either delete or archive based on configuration.
     */
    private void removeMessage(long msgId) {
        if (archiveMessages) {
            pgmqClient.archive(inboxQueue, msgId);
        } else {
            pgmqClient.delete(inboxQueue, msgId);
        }
    }
}
