package in.tradeledger.service.core;

import in.tradeledger.domain.trade.Trade;
import in.tradeledger.infrastructure.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of newly stored trades to live subscribers.
 *
 * Each subscription owns a bounded queue (oldest entry dropped on overflow)
 * drained on a shared daemon pool, one drain task per subscription at a time.
 * publish() only enqueues, so a slow or failing subscriber never delays the
 * sync engine or other subscribers, and each subscriber sees trades in publish
 * order. Late subscribers get no replay.
 */
public final class TradeBroadcastHub {
    private static final Logger log = LoggerFactory.getLogger(TradeBroadcastHub.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final ConcurrentHashMap<Long, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong idSeq = new AtomicLong(0);
    private final AtomicLong deliveryFailures = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final ExecutorService executor;
    private final int queueCapacity;
    private final SyncMetrics metrics;

    public TradeBroadcastHub(SyncMetrics metrics) {
        this(DEFAULT_QUEUE_CAPACITY, metrics);
    }

    public TradeBroadcastHub(int queueCapacity, SyncMetrics metrics) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        this.queueCapacity = queueCapacity;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "trade-broadcast");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a listener. It receives every trade published after this call returns.
     */
    public Subscription subscribe(String name, Consumer<Trade> listener) {
        long id = idSeq.incrementAndGet();
        Subscription sub = new Subscription(id, name, listener, queueCapacity);
        subscriptions.put(id, sub);
        updateGauge();
        log.info("[HUB] Subscribed {} (id={}, total={})", name, id, subscriptions.size());
        return sub;
    }

    public Subscription subscribe(Consumer<Trade> listener) {
        return subscribe("subscriber", listener);
    }

    /**
     * Remove a subscription. Queued trades not yet delivered are discarded. Idempotent.
     */
    public void unsubscribe(Subscription sub) {
        if (sub == null) return;
        sub.active.set(false);
        sub.queue.clear();
        if (subscriptions.remove(sub.id) != null) {
            updateGauge();
            log.info("[HUB] Unsubscribed {} (id={}, total={})", sub.name, sub.id, subscriptions.size());
        }
    }

    /**
     * Enqueue a trade for every current subscriber. Never blocks, never throws
     * because of a subscriber.
     */
    public void publish(Trade trade) {
        for (Subscription sub : subscriptions.values()) {
            sub.enqueue(trade);
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public long deliveryFailures() {
        return deliveryFailures.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Drop all subscriptions and stop the delivery pool.
     */
    public void shutdown() {
        for (Subscription sub : subscriptions.values()) {
            unsubscribe(sub);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[HUB] Shut down");
    }

    private void updateGauge() {
        if (metrics != null) {
            metrics.setSubscribers(subscriptions.size());
        }
    }

    private void recordDelivery(boolean success) {
        if (metrics != null) {
            metrics.recordBroadcast(success);
        }
    }

    // ============================================================

    /**
     * Handle returned by subscribe(). Closing it unsubscribes.
     */
    public final class Subscription implements AutoCloseable {
        private final long id;
        private final String name;
        private final Consumer<Trade> listener;
        private final BlockingDeque<Trade> queue;
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Subscription(long id, String name, Consumer<Trade> listener, int capacity) {
            this.id = id;
            this.name = name;
            this.listener = listener;
            this.queue = new LinkedBlockingDeque<>(capacity);
        }

        public long id() {
            return id;
        }

        public String name() {
            return name;
        }

        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            unsubscribe(this);
        }

        private void enqueue(Trade trade) {
            if (!active.get()) return;

            while (!queue.offerLast(trade)) {
                Trade evicted = queue.pollFirst();
                if (evicted != null) {
                    dropped.incrementAndGet();
                    log.warn("[HUB] {} queue full, dropped trade {}", name, evicted.orderId());
                }
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) return;
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("[HUB] Delivery pool stopped, {} not drained", name);
            }
        }

        private void drain() {
            try {
                Trade trade;
                while (active.get() && (trade = queue.pollFirst()) != null) {
                    deliver(trade);
                }
            } finally {
                draining.set(false);
            }
            // A publish may have landed between the last poll and the flag reset
            if (active.get() && !queue.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(Trade trade) {
            try {
                listener.accept(trade);
                recordDelivery(true);
            } catch (Exception e) {
                deliveryFailures.incrementAndGet();
                recordDelivery(false);
                log.warn("[HUB] Subscriber {} failed on trade {}: {}", name, trade.orderId(), e.getMessage());
            }
        }
    }
}
