package com.visionsentinel.core.alarm;

import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.AlarmRule;

/**
 * Receives alarms emitted by {@link AlarmEngine}. Must not block.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlarmListener {

    void onAlarm(AlarmEvent event, AlarmRule rule);
}
