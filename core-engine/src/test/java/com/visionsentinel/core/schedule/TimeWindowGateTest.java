package com.visionsentinel.core.schedule;

import com.visionsentinel.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimeWindowGate}.
 */
class TimeWindowGateTest {

    private MutableClock clock;
    private TimeWindowGate gate;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(LocalDateTime.of(2024, 6, 10, 12, 0));
        gate = new TimeWindowGate(clock);
    }

    @Test
    @DisplayName("Should permit sessions without a policy")
    void shouldPermitWithoutPolicy() {
        assertThat(gate.isPermitted("cam-1")).isTrue();
    }

    @Test
    @DisplayName("Should follow the clock through a night window")
    void shouldFollowClock() {
        gate.assign("cam-1", new DailyWindowPolicy(LocalTime.of(22, 0), LocalTime.of(6, 0)));

        assertThat(gate.isPermitted("cam-1")).isFalse();

        clock.set(LocalDateTime.of(2024, 6, 10, 23, 15));
        assertThat(gate.isPermitted("cam-1")).isTrue();
    }

    @Test
    @DisplayName("Should drop the policy when null is assigned or the session is removed")
    void shouldRemovePolicy() {
        gate.assign("cam-1", new DailyWindowPolicy(LocalTime.of(22, 0), LocalTime.of(6, 0)));
        gate.assign("cam-1", null);
        assertThat(gate.policy("cam-1")).isEmpty();

        gate.assign("cam-2", new DailyWindowPolicy(LocalTime.of(22, 0), LocalTime.of(6, 0)));
        gate.remove("cam-2");
        assertThat(gate.isPermitted("cam-2")).isTrue();
    }
}
