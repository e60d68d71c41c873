package com.phillippitts.vibedj.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PhaseTest {

    private static final AudioTargets LOW = new AudioTargets(20, 30, 40, 5, 60, 80, 10, 30);
    private static final AudioTargets HIGH = new AudioTargets(80, 70, 60, 15, 20, 40, 30, 70);

    @Test
    void shouldReturnStartAndEndTargetsAtGradientBounds() {
        Phase p = Phase.gradient(20, LOW, HIGH, "ramp up");

        assertThat(p.targetsAt(0.0)).isEqualTo(LOW);
        assertThat(p.targetsAt(1.0)).isEqualTo(HIGH);
    }

    @Test
    void shouldInterpolateGradientAtMidpoint() {
        Phase p = Phase.gradient(20, LOW, HIGH, "");

        AudioTargets mid = p.targetsAt(0.5);

        assertThat(mid.energy()).isEqualTo(50);
        assertThat(mid.valence()).isEqualTo(50);
        assertThat(mid.tempo()).isEqualTo(50);
    }

    @Test
    void shouldKeepHoldTargetsConstant() {
        Phase p = Phase.hold(30, LOW, "steady");

        assertThat(p.isGradient()).isFalse();
        for (double progress = 0.0; progress <= 1.0; progress += 0.1) {
            assertThat(p.targetsAt(progress)).isEqualTo(LOW);
        }
    }

    @Test
    void shouldClampProgressOutsideUnitInterval() {
        Phase p = Phase.gradient(10, LOW, HIGH, "");

        assertThat(p.targetsAt(-3.0)).isEqualTo(LOW);
        assertThat(p.targetsAt(7.0)).isEqualTo(HIGH);
    }

    @Test
    void shouldClampSlidersOnConstruction() {
        AudioTargets t = new AudioTargets(-5, 130, 50, 50, 50, 50, 50, 50);

        assertThat(t.energy()).isZero();
        assertThat(t.valence()).isEqualTo(100);
    }
}
