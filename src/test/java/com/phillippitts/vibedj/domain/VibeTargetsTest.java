package com.phillippitts.vibedj.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VibeTargetsTest {

    @Test
    void shouldDeriveLegacyEnergyOnOneToTenScale() {
        assertThat(VibeTargets.legacyEnergy(0)).isEqualTo(1);
        assertThat(VibeTargets.legacyEnergy(100)).isEqualTo(10);
        assertThat(VibeTargets.legacyEnergy(55)).isEqualTo(6);
        // 1 + 0.5 * 9 = 5.5 rounds half to even
        assertThat(VibeTargets.legacyEnergy(50)).isEqualTo(6);
    }

    @Test
    void shouldDeriveSignedValence() {
        assertThat(VibeTargets.legacyValence(0)).isEqualTo(-1.0);
        assertThat(VibeTargets.legacyValence(50)).isEqualTo(0.0);
        assertThat(VibeTargets.legacyValence(73)).isEqualTo(0.46);
    }

    @Test
    void shouldDeriveVocalToleranceFromInverseInstrumentalness() {
        assertThat(VibeTargets.vocalTolerance(100)).isEqualTo(1);
        assertThat(VibeTargets.vocalTolerance(0)).isEqualTo(10);
        assertThat(VibeTargets.vocalTolerance(70)).isEqualTo(4);
    }

    @Test
    void shouldUseNeutralLabelsWithoutPlan() {
        VibeTargets t = VibeTargets.decorate(AudioTargets.DEFAULTS, null, null, 0.0);

        assertThat(t.contextBlock()).isEqualTo("unknown");
        assertThat(t.currentMood()).isEqualTo("unknown");
        assertThat(t.currentEnergy()).isEqualTo("unknown");
        assertThat(t.anxietyLevel()).isEqualTo("calm");
        assertThat(t.verbalPlan()).isEmpty();
        assertThat(t.musicFilters()).isEqualTo(MusicFilters.NONE);
    }

    @Test
    void shouldCarryPlanContextAndRoundProgress() {
        VibePlan plan = new VibePlan("focus then wind down", "deep work", "15:00", 45,
                List.of(Phase.hold(45, AudioTargets.DEFAULTS, "hold")), null,
                "focused", "medium", "low", false, "", "");

        VibeTargets t = VibeTargets.decorate(AudioTargets.DEFAULTS, plan, "hold", 0.3333333);

        assertThat(t.contextBlock()).isEqualTo("deep work");
        assertThat(t.currentMood()).isEqualTo("focused");
        assertThat(t.phaseProgress()).isEqualTo(0.33);
        assertThat(t.energyTarget()).isEqualTo(6);
    }
}
