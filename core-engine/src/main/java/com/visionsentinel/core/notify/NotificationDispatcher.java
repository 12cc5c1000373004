package com.visionsentinel.core.notify;

import com.visionsentinel.core.alarm.AlarmListener;
import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.model.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue plus fixed worker pool delivering alarms to their channels.
 *
 * <h3>Back-pressure</h3>
 * <p>
 * {@link #submit(NotificationTask)} never blocks: when the queue is full the
 * new task is dropped, counted and logged.
 * </p>
 *
 * <h3>Isolation</h3>
 * <p>
 * Each task is delivered to every channel on its rule. A failing channel is
 * logged and counted; the remaining channels are still attempted.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #shutdown(Duration)} stops accepting tasks, lets the workers drain
 * what is queued and waits for them up to the given timeout.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationDispatcher implements AlarmListener {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final long POLL_TIMEOUT_MS = 1000;

    private final BlockingQueue<NotificationTask> queue;
    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final int workerCount;
    private final Clock clock;

    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService workers;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final Map<ChannelType, AtomicLong> failuresByChannel = new EnumMap<>(ChannelType.class);

    public NotificationDispatcher(int queueCapacity, int workerCount, List<NotificationChannel> channels,
            Clock clock) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.workerCount = workerCount;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.type(), channel);
        }
        for (ChannelType type : ChannelType.values()) {
            failuresByChannel.put(type, new AtomicLong());
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "notify-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerCount; i++) {
            workers.execute(this::workerLoop);
        }
        LOG.info("Notification dispatcher started: {} worker(s), queue capacity {}, channels {}",
                workerCount, queue.remainingCapacity() + queue.size(), channels.keySet());
    }

    /**
     * Stop accepting tasks, drain the queue and stop the workers.
     *
     * @return {@code true} if all workers finished within {@code timeout}
     */
    public synchronized boolean shutdown(Duration timeout) {
        accepting.set(false);
        if (!running.compareAndSet(true, false)) {
            return true;
        }
        workers.shutdown();
        try {
            boolean finished = workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("Notification workers still busy after {} ms; {} task(s) left",
                        timeout.toMillis(), queue.size());
                workers.shutdownNow();
            }
            LOG.info("Notification dispatcher stopped (delivered={}, failed={}, dropped={})",
                    delivered.get(), failed.get(), dropped.get());
            return finished;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    @Override
    public void onAlarm(AlarmEvent event, AlarmRule rule) {
        submit(new NotificationTask(event, rule, clock.instant()));
    }

    /**
     * Enqueue a task without blocking.
     *
     * @return {@code false} if the task was dropped
     */
    public boolean submit(NotificationTask task) {
        Objects.requireNonNull(task, "task must not be null");
        if (!accepting.get()) {
            dropped.incrementAndGet();
            LOG.warn("Dispatcher shut down; dropping {}", task);
            return false;
        }
        if (!queue.offer(task)) {
            long total = dropped.incrementAndGet();
            LOG.warn("Notification queue full; dropping {} ({} dropped so far)", task, total);
            return false;
        }
        submitted.incrementAndGet();
        return true;
    }

    // ---------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------

    private void workerLoop() {
        while (running.get() || !queue.isEmpty()) {
            NotificationTask task;
            try {
                task = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (task != null) {
                process(task);
            }
        }
    }

    void process(NotificationTask task) {
        for (ChannelType type : task.getChannels()) {
            NotificationChannel channel = channels.get(type);
            if (channel == null) {
                failed.incrementAndGet();
                failuresByChannel.get(type).incrementAndGet();
                LOG.warn("Channel {} is not configured; rule [{}] cannot use it", type, task.getRule().getId());
                continue;
            }
            try {
                if (channel.deliver(task)) {
                    delivered.incrementAndGet();
                } else {
                    skipped.incrementAndGet();
                }
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                failuresByChannel.get(type).incrementAndGet();
                LOG.warn("{} channel failed for rule [{}] on session {}: {}",
                        type, task.getRule().getId(), task.getEvent().getSessionId(), e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    public int getQueueDepth() {
        return queue.size();
    }

    public long getSubmittedCount() {
        return submitted.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getSkippedCount() {
        return skipped.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public Map<ChannelType, Long> getFailuresByChannel() {
        Map<ChannelType, Long> counts = new EnumMap<>(ChannelType.class);
        failuresByChannel.forEach((k, v) -> counts.put(k, v.get()));
        return Collections.unmodifiableMap(counts);
    }

    public NotificationChannel channel(ChannelType type) {
        return channels.get(type);
    }

    public boolean isRunning() {
        return running.get();
    }
}
