package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.domain.AudioTargets;
import com.phillippitts.vibedj.domain.Phase;
import com.phillippitts.vibedj.domain.VibePlan;
import com.phillippitts.vibedj.exception.OracleException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VibePlanJsonParserTest {

    @Test
    void shouldParseHoldAndGradientPhases() {
        String json = """
                {
                  "verbal_plan": "Ease in, then focus",
                  "current_context_block": "Deep work",
                  "context_block_ends": "11:00",
                  "plan_duration_minutes": 45,
                  "current_mood": "focused",
                  "current_energy": "medium",
                  "anxiety_level": "low",
                  "is_continuation": true,
                  "change_reason": "same block",
                  "phases": [
                    {"duration_minutes": 15, "note": "ramp",
                     "targets_start": {"energy": 30, "valence": 40},
                     "targets_end": {"energy": 60.5, "valence": 50}},
                    {"duration_minutes": 30, "note": "hold",
                     "targets": {"energy": 62, "tempo": 140}}
                  ],
                  "music_filters": {"include_genres": ["jazz", " "], "exclude_artists": [" Kenny G "]}
                }
                """;

        VibePlan plan = VibePlanJsonParser.parse(json, "vibe", 60);

        assertThat(plan.verbalPlan()).isEqualTo("Ease in, then focus");
        assertThat(plan.contextBlock()).isEqualTo("Deep work");
        assertThat(plan.planDurationMinutes()).isEqualTo(45);
        assertThat(plan.anxietyLevel()).isEqualTo("low");
        assertThat(plan.continuation()).isTrue();
        assertThat(plan.phases()).hasSize(2);

        Phase ramp = plan.phases().get(0);
        assertThat(ramp.isGradient()).isTrue();
        assertThat(ramp.start().energy()).isEqualTo(30);
        assertThat(ramp.end().energy()).isEqualTo(60);
        assertThat(ramp.start().loudness()).isEqualTo(AudioTargets.DEFAULTS.loudness());

        Phase hold = plan.phases().get(1);
        assertThat(hold.isGradient()).isFalse();
        assertThat(hold.start().tempo()).isEqualTo(100);
        assertThat(hold.note()).isEqualTo("hold");

        assertThat(plan.musicFilters().includeGenres()).containsExactly("jazz");
        assertThat(plan.musicFilters().excludeArtists()).containsExactly("Kenny G");
    }

    @Test
    void shouldClampDurationsIntoContractRanges() {
        String json = """
                {"plan_duration_minutes": 500,
                 "phases": [{"duration_minutes": 1, "targets": {}}, {"targets": {}}]}
                """;

        VibePlan plan = VibePlanJsonParser.parse(json, "vibe", 60);

        assertThat(plan.planDurationMinutes()).isEqualTo(60);
        assertThat(plan.phases()).extracting(Phase::durationMinutes).containsExactly(5, 30);
    }

    @Test
    void shouldUseDefaultsForMissingFields() {
        VibePlan plan = VibePlanJsonParser.parse("{\"phases\": [{\"targets_start\": {\"energy\": 10}}, 7]}",
                "vibe", 40);

        assertThat(plan.planDurationMinutes()).isEqualTo(40);
        assertThat(plan.currentMood()).isEqualTo("unknown");
        assertThat(plan.currentEnergy()).isEqualTo("unknown");
        assertThat(plan.anxietyLevel()).isEqualTo("calm");
        assertThat(plan.phases()).singleElement().satisfies(p -> {
            assertThat(p.isGradient()).isFalse();
            assertThat(p.start()).isEqualTo(AudioTargets.DEFAULTS);
        });
    }

    @Test
    void shouldRejectEmptyOrMalformedBodies() {
        assertThatThrownBy(() -> VibePlanJsonParser.parse("  ", "vibe", 60))
                .isInstanceOf(OracleException.class);
        assertThatThrownBy(() -> VibePlanJsonParser.parse("[1, 2]", "vibe", 60))
                .isInstanceOf(OracleException.class)
                .hasMessageContaining("Malformed");
    }
}
