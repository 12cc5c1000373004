package com.visionsentinel.core.alarm;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Consecutive-frame counters and last trigger times of one session.
 *
 * <p>
 * Not thread-safe; the alarm engine guards each instance with its monitor.
 * </p>
 */
final class DebounceState {

    /** rule id to per-rule state */
    private final Map<String, RuleState> rules = new HashMap<>();

    RuleState forRule(String ruleId) {
        return rules.computeIfAbsent(ruleId, k -> new RuleState());
    }

    RuleState peek(String ruleId) {
        return rules.get(ruleId);
    }

    void removeRule(String ruleId) {
        rules.remove(ruleId);
    }

    static final class RuleState {

        /** class name to consecutive count */
        private final Map<String, Integer> counts = new HashMap<>();
        private Instant lastTriggered;

        int increment(String className) {
            return counts.merge(className, 1, Integer::sum);
        }

        int count(String className) {
            return counts.getOrDefault(className, 0);
        }

        void reset(String className) {
            counts.remove(className);
        }

        void resetAll() {
            counts.clear();
        }

        void retainOnly(Set<String> present) {
            counts.keySet().retainAll(present);
        }

        boolean cooldownElapsed(Instant now, Duration cooldown) {
            return lastTriggered == null
                    || Duration.between(lastTriggered, now).compareTo(cooldown) >= 0;
        }

        void triggered(Instant at) {
            if (lastTriggered == null || at.isAfter(lastTriggered)) {
                lastTriggered = at;
            }
        }

        Instant lastTriggered() {
            return lastTriggered;
        }
    }
}
