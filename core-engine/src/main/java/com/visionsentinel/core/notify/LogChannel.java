package com.visionsentinel.core.notify;

import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.ChannelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes one structured line per alarm to the log. Never fails.
 *
 * @since 1.0.0
 */
public class LogChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(LogChannel.class);

    private final AtomicLong delivered = new AtomicLong();

    @Override
    public ChannelType type() {
        return ChannelType.LOG;
    }

    @Override
    public boolean deliver(NotificationTask task) {
        LOG.warn(format(task));
        delivered.incrementAndGet();
        return true;
    }

    static String format(NotificationTask task) {
        AlarmEvent e = task.getEvent();
        return String.format("[ALARM] %s | %s | %s | %.2f | %s | %d",
                task.getRule().getName(), e.getSessionId(), e.getClassName(),
                e.getConfidence(), e.getSeverity(), e.getConsecutiveCount());
    }

    public long getDeliveredCount() {
        return delivered.get();
    }
}
