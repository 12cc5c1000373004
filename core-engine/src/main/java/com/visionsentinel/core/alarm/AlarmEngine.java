package com.visionsentinel.core.alarm;

import com.visionsentinel.core.error.ErrorKind;
import com.visionsentinel.core.error.SentinelException;
import com.visionsentinel.core.model.AlarmEvent;
import com.visionsentinel.core.model.AlarmRule;
import com.visionsentinel.core.model.Detection;
import com.visionsentinel.core.model.DetectionResult;
import com.visionsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Evaluates alarm rules against detection results with consecutive-frame
 * debounce and per-rule cooldown.
 *
 * <h3>Evaluation</h3>
 * <p>
 * For every enabled rule, in registration order:
 * </p>
 * <ol>
 * <li>skip if the rule does not apply to the session;</li>
 * <li>skip if the rule's time-of-day range excludes the result time;</li>
 * <li>keep detections of the rule's classes with at least
 * {@code minConfidence}; each class counts once per frame, represented by
 * its most confident detection;</li>
 * <li>reset the counter of every class that did not qualify on this
 * frame;</li>
 * <li>increment the counter of each qualifying class; when it reaches
 * {@code consecutiveFrames} and the cooldown since the rule last fired on
 * this session has elapsed, emit an alarm, reset the counter and record the
 * trigger time.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * Workers of different sessions call {@link #evaluate(DetectionResult)}
 * concurrently. Debounce state is kept per session and evaluated under that
 * session's monitor; the rule set is read-mostly and swapped under a write
 * lock. Cooldown timing uses result timestamps, so it is deterministic for a
 * given frame sequence.
 * </p>
 *
 * @since 1.0.0
 */
public class AlarmEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlarmEngine.class);

    private final ReentrantReadWriteLock rulesLock = new ReentrantReadWriteLock();
    private final Map<String, AlarmRule> rules = new LinkedHashMap<>();

    private final Map<String, DebounceState> sessions = new ConcurrentHashMap<>();

    private final AlarmListener listener;
    private final ZoneId zone;
    private final double highThreshold;
    private final double mediumThreshold;

    private final AtomicLong evaluated = new AtomicLong();
    private final AtomicLong alarms = new AtomicLong();
    private final Map<Severity, AtomicLong> alarmsBySeverity = new EnumMap<>(Severity.class);

    public AlarmEngine(AlarmListener listener, ZoneId zone, double highThreshold, double mediumThreshold) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
        for (Severity s : Severity.values()) {
            alarmsBySeverity.put(s, new AtomicLong());
        }
    }

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------

    /**
     * Evaluate all enabled rules against one result and hand every emitted
     * alarm to the listener.
     *
     * @return the alarms emitted for this result, possibly empty
     */
    public List<AlarmEvent> evaluate(DetectionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        evaluated.incrementAndGet();

        List<AlarmRule> active = enabledRules();
        if (active.isEmpty()) {
            return List.of();
        }

        String sessionId = result.getSessionId();
        LocalTime timeOfDay = result.getTimestamp().atZone(zone).toLocalTime();
        List<Emitted> emitted = new ArrayList<>();

        DebounceState state = sessions.computeIfAbsent(sessionId, k -> new DebounceState());
        synchronized (state) {
            for (AlarmRule rule : active) {
                if (!rule.appliesToSession(sessionId)) {
                    continue;
                }
                if (!rule.isActiveAt(timeOfDay)) {
                    LOG.trace("Rule [{}] outside its time range at {}", rule.getId(), timeOfDay);
                    continue;
                }
                evaluateRule(rule, result, state.forRule(rule.getId()), emitted);
            }
        }

        List<AlarmEvent> events = new ArrayList<>(emitted.size());
        for (Emitted e : emitted) {
            alarms.incrementAndGet();
            alarmsBySeverity.get(e.event.getSeverity()).incrementAndGet();
            LOG.info("Alarm raised: rule={} session={} class={} confidence={} severity={}",
                    e.rule.getId(), sessionId, e.event.getClassName(),
                    String.format("%.2f", e.event.getConfidence()), e.event.getSeverity());
            try {
                listener.onAlarm(e.event, e.rule);
            } catch (RuntimeException ex) {
                LOG.error("Alarm listener failed for rule [{}] on session {}: {}",
                        e.rule.getId(), sessionId, ex.getMessage(), ex);
            }
            events.add(e.event);
        }
        return events;
    }

    private void evaluateRule(AlarmRule rule, DetectionResult result,
            DebounceState.RuleState ruleState, List<Emitted> emitted) {
        // best detection per qualifying class, in order of first appearance
        Map<String, Detection> qualifying = new LinkedHashMap<>();
        for (Detection d : result.getDetections()) {
            if (!rule.appliesToClass(d.getClassName()) || d.getConfidence() < rule.getMinConfidence()) {
                continue;
            }
            qualifying.merge(d.getClassName(), d,
                    (a, b) -> b.getConfidence() > a.getConfidence() ? b : a);
        }

        ruleState.retainOnly(qualifying.keySet());
        if (qualifying.isEmpty()) {
            return;
        }

        for (Detection d : qualifying.values()) {
            int count = ruleState.increment(d.getClassName());
            if (count < rule.getConsecutiveFrames()) {
                continue;
            }
            if (!ruleState.cooldownElapsed(result.getTimestamp(), rule.cooldown())) {
                LOG.trace("Rule [{}] in cooldown for session {}", rule.getId(), result.getSessionId());
                continue;
            }
            AlarmEvent event = AlarmEvent.builder()
                    .sessionId(result.getSessionId())
                    .ruleId(rule.getId())
                    .ruleName(rule.getName())
                    .timestamp(result.getTimestamp())
                    .severity(Severity.fromConfidence(d.getConfidence(), highThreshold, mediumThreshold))
                    .confidence(d.getConfidence())
                    .className(d.getClassName())
                    .box(d.getBox())
                    .consecutiveCount(count)
                    .mediaUrl(result.getMediaUrl())
                    .target(result.getTarget())
                    .build();
            ruleState.reset(d.getClassName());
            ruleState.triggered(result.getTimestamp());
            emitted.add(new Emitted(event, rule));
        }
    }

    // ---------------------------------------------------------------
    // Rule administration
    // ---------------------------------------------------------------

    /**
     * Register a rule; a copy is stored.
     *
     * @throws SentinelException of kind {@code CONFIG} if the rule is invalid
     *                           or {@code DUPLICATE_ID} if its id exists
     */
    public void addRule(AlarmRule rule) {
        AlarmRule copy = validatedCopy(rule);
        rulesLock.writeLock().lock();
        try {
            if (rules.containsKey(copy.getId())) {
                throw new SentinelException(ErrorKind.DUPLICATE_ID,
                        "Alarm rule already exists: " + copy.getId());
            }
            rules.put(copy.getId(), copy);
        } finally {
            rulesLock.writeLock().unlock();
        }
        LOG.info("Alarm rule added: {}", copy);
    }

    /**
     * Replace an existing rule in place, keeping its evaluation order. Debounce
     * state of the rule is discarded.
     *
     * @throws SentinelException of kind {@code NOT_FOUND} if absent
     */
    public void updateRule(AlarmRule rule) {
        AlarmRule copy = validatedCopy(rule);
        rulesLock.writeLock().lock();
        try {
            if (!rules.containsKey(copy.getId())) {
                throw SentinelException.notFound("Alarm rule", copy.getId());
            }
            rules.put(copy.getId(), copy);
        } finally {
            rulesLock.writeLock().unlock();
        }
        dropRuleState(copy.getId());
        LOG.info("Alarm rule updated: {}", copy);
    }

    /**
     * @return {@code true} if a rule was removed
     */
    public boolean removeRule(String ruleId) {
        AlarmRule removed;
        rulesLock.writeLock().lock();
        try {
            removed = rules.remove(ruleId);
        } finally {
            rulesLock.writeLock().unlock();
        }
        if (removed != null) {
            dropRuleState(ruleId);
            LOG.info("Alarm rule removed: {}", ruleId);
        }
        return removed != null;
    }

    public Optional<AlarmRule> rule(String ruleId) {
        rulesLock.readLock().lock();
        try {
            AlarmRule rule = rules.get(ruleId);
            return rule != null ? Optional.of(rule.copy()) : Optional.empty();
        } finally {
            rulesLock.readLock().unlock();
        }
    }

    /**
     * @return copies of all rules in registration order
     */
    public List<AlarmRule> rules() {
        rulesLock.readLock().lock();
        try {
            return rules.values().stream().map(AlarmRule::copy).toList();
        } finally {
            rulesLock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Session state
    // ---------------------------------------------------------------

    /**
     * Forget debounce counters and cooldowns of a removed session.
     */
    public void clearSession(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            LOG.debug("Cleared alarm state for session {}", sessionId);
        }
    }

    /**
     * @return the current consecutive count of {@code className} for a
     *         (session, rule) pair
     */
    public int consecutiveCount(String sessionId, String ruleId, String className) {
        DebounceState state = sessions.get(sessionId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            DebounceState.RuleState ruleState = state.peek(ruleId);
            return ruleState != null ? ruleState.count(className) : 0;
        }
    }

    /**
     * @return when the rule last fired on the session
     */
    public Optional<Instant> lastTriggered(String sessionId, String ruleId) {
        DebounceState state = sessions.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            DebounceState.RuleState ruleState = state.peek(ruleId);
            return ruleState != null ? Optional.ofNullable(ruleState.lastTriggered()) : Optional.empty();
        }
    }

    public int trackedSessionCount() {
        return sessions.size();
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    public long getEvaluatedCount() {
        return evaluated.get();
    }

    public long getAlarmCount() {
        return alarms.get();
    }

    public Map<Severity, Long> getAlarmCountBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        alarmsBySeverity.forEach((k, v) -> counts.put(k, v.get()));
        return Collections.unmodifiableMap(counts);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AlarmRule> enabledRules() {
        rulesLock.readLock().lock();
        try {
            return rules.values().stream().filter(AlarmRule::isEnabled).toList();
        } finally {
            rulesLock.readLock().unlock();
        }
    }

    private void dropRuleState(String ruleId) {
        for (DebounceState state : sessions.values()) {
            synchronized (state) {
                state.removeRule(ruleId);
            }
        }
    }

    private static AlarmRule validatedCopy(AlarmRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        AlarmRule copy = rule.copy();
        try {
            copy.validate();
        } catch (IllegalStateException e) {
            throw SentinelException.config(e.getMessage());
        }
        return copy;
    }

    private static final class Emitted {
        private final AlarmEvent event;
        private final AlarmRule rule;

        private Emitted(AlarmEvent event, AlarmRule rule) {
            this.event = event;
            this.rule = rule;
        }
    }
}
