package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.event.MessageDecoder;
import com.buildhook.dispatcher.handler.GroupStatusHandler;
import com.buildhook.dispatcher.handler.HandlerContext;
import com.buildhook.dispatcher.handler.JobHandler;
import com.buildhook.dispatcher.handler.StatusHandler;
import com.buildhook.dispatcher.model.InboxMessage;
import com.buildhook.dispatcher.model.Subscription;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binds the three handlers to their subscriptions and keeps them consuming.
 *
 * Every poll claims messages per subscription and hands each one to the
 * worker pool without waiting for earlier messages, so several messages (even
 * for the same task group) can be in flight at once. A claim never asks for
 * more messages than there are idle workers: a claimed message starts running
 * right away instead of aging in the pool's queue while its lease runs out.
 * The subscription polled first rotates each tick so a backlog on one cannot
 * starve the others.
 *
 * Per message:
 *   - the handler runs with MDC set (subscription, messageId, plus whatever
 *     the handler adds) and is timed
 *   - a thrown error is reported to the {@link Monitor}; the loop goes on
 *     (a JVM {@link Error} is rethrown once the message is settled)
 *   - the message is acknowledged once the handler settles, success or not
 *   - listeners are notified last
 *
 * A message is only delivered again if this process dies while holding it
 * (its lease runs out).
 */
@Component
@EnableScheduling
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    @FunctionalInterface
    interface MessageHandler {
        void handle(HandlerContext ctx, String payload);
    }

    private final MessageQueue    queue;
    private final HandlerContext  context;
    private final Monitor         monitor;
    private final ExecutorService workers;
    private final Semaphore       idleWorkers;
    private final int             batchSize;
    private final Duration        lease;

    private final Map<Subscription, MessageHandler> bindings  = new EnumMap<>(Subscription.class);
    private final List<DispatchListener>            listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started  = new AtomicBoolean(false);
    private final AtomicBoolean stopped  = new AtomicBoolean(false);
    private final AtomicLong    ticks    = new AtomicLong();

    public Dispatcher(MessageQueue queue,
                      MessageDecoder decoder,
                      JobHandler jobHandler,
                      StatusHandler statusHandler,
                      GroupStatusHandler groupStatusHandler,
                      HandlerContext context,
                      Monitor monitor,
                      @Qualifier("handlerWorkers") ExecutorService workers,
                      @Value("${buildhook.dispatcher.worker-count:4}") int workerCount,
                      @Value("${buildhook.dispatcher.batch-size:10}") int batchSize,
                      @Value("${buildhook.dispatcher.lease-seconds:600}") long leaseSeconds) {
        this.queue     = queue;
        this.context   = context;
        this.monitor   = monitor;
        this.workers   = workers;
        this.idleWorkers = new Semaphore(workerCount);
        this.batchSize = batchSize;
        this.lease     = Duration.ofSeconds(leaseSeconds);

        bindings.put(Subscription.JOB,
                (ctx, payload) -> jobHandler.handle(ctx, decoder.decodeJob(payload)));
        bindings.put(Subscription.TASK_STATUS,
                (ctx, payload) -> statusHandler.handle(ctx, decoder.decodeTaskStatus(payload)));
        bindings.put(Subscription.GROUP_STATUS,
                (ctx, payload) -> groupStatusHandler.handle(ctx, decoder.decodeGroupResolved(payload)));
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatcher cannot be started twice");
        }
        log.info("Dispatcher consuming {} (batch {}, workers {}, lease {})",
                bindings.keySet(), batchSize, idleWorkers.availablePermits(), lease);
    }

    @PreDestroy
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Dispatcher stopping");
        }
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public void addListener(DispatchListener listener) {
        listeners.add(listener);
    }

    public void removeListener(DispatchListener listener) {
        listeners.remove(listener);
    }

    // ------------------------------------------------------------------
    // Consumption
    // ------------------------------------------------------------------

    /**
     * Claim and dispatch up to one batch per subscription, bounded by the
     * number of idle workers. With every worker busy nothing is claimed.
     *
     * A failing claim on one subscription (database hiccup) is logged and the
     * other subscriptions are still polled.
     */
    @Scheduled(fixedDelayString = "${buildhook.dispatcher.poll-interval-ms:1000}")
    public void poll() {
        if (!isRunning()) {
            return;
        }
        for (Subscription subscription : pollOrder()) {
            int wanted = Math.min(batchSize, idleWorkers.availablePermits());
            if (wanted == 0 || !idleWorkers.tryAcquire(wanted)) {
                log.debug("No idle worker, skipping {}", subscription);
                continue;
            }
            List<InboxMessage> claimed;
            try {
                claimed = queue.claim(subscription, wanted, lease);
            } catch (RuntimeException e) {
                idleWorkers.release(wanted);
                log.error("Could not claim {} messages: {}", subscription, e.getMessage(), e);
                continue;
            }
            idleWorkers.release(wanted - claimed.size());
            for (InboxMessage message : claimed) {
                submit(subscription, message);
            }
        }
    }

    private List<Subscription> pollOrder() {
        List<Subscription> order = new ArrayList<>(bindings.keySet());
        int first = (int) (ticks.getAndIncrement() % order.size());
        for (int i = 0; i < first; i++) {
            order.add(order.remove(0));
        }
        return order;
    }

    // Each submitted message holds one idle-worker permit until it settles.
    private void submit(Subscription subscription, InboxMessage message) {
        try {
            workers.execute(() -> {
                try {
                    process(subscription, message);
                } finally {
                    idleWorkers.release();
                }
            });
        } catch (RejectedExecutionException e) {
            idleWorkers.release();
            log.warn("Worker pool refused message {}, it will be redelivered after its lease", message.getId());
        }
    }

    void process(Subscription subscription, InboxMessage message) {
        String handlerName = subscription.path();
        MDC.put("subscription", handlerName);
        MDC.put("messageId",    String.valueOf(message.getId()));
        Timer.Sample sample = monitor.startTimer();
        Throwable failure = null;
        try {
            if (message.getDeliveries() > 1) {
                log.info("Redelivery #{} of message {}", message.getDeliveries(), message.getId());
            }
            bindings.get(subscription).handle(context, message.getPayload());
        } catch (Throwable e) {
            failure = e;
            monitor.reportError(handlerName, e);
        } finally {
            monitor.recordCall(handlerName, sample, failure == null);
            acknowledge(message);
            MDC.clear();
        }
        notifyListeners(subscription, message, failure);
        if (failure instanceof Error error) {
            throw error;
        }
    }

    private void acknowledge(InboxMessage message) {
        try {
            queue.ack(message.getId());
        } catch (RuntimeException e) {
            // The lease will expire and the message will be handled again;
            // every handler is idempotent, so that is safe.
            log.error("Could not acknowledge message {}: {}", message.getId(), e.getMessage(), e);
        }
    }

    private void notifyListeners(Subscription subscription, InboxMessage message, Throwable failure) {
        for (DispatchListener listener : listeners) {
            try {
                if (failure == null) {
                    listener.onHandled(subscription, message);
                } else {
                    listener.onRejected(subscription, message, failure);
                }
            } catch (RuntimeException e) {
                log.warn("Dispatch listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
