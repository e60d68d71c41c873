package com.phillippitts.vibedj.service.weights;

import com.phillippitts.vibedj.domain.WeightScope;
import com.phillippitts.vibedj.testutil.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightOverrideServiceTest {

    private TestDatabase db;
    private WeightOverrideService service;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        service = new WeightOverrideService(new WeightOverrideRepository(db.jdbc()));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void shouldDefaultToOneWhenAbsent() {
        assertThat(service.factor(WeightScope.GENRE, "jazz")).isEqualTo(1.0);
        assertThat(service.current(WeightScope.ARTIST, "Nobody").factor()).isEqualTo(1.0);
    }

    @Test
    void shouldFloorNegativeAdjustmentAtMinimum() {
        WeightChange change = service.adjust(WeightScope.GENRE, "Jazz", -5.0);

        assertThat(change.oldFactor()).isEqualTo(1.0);
        assertThat(change.newFactor()).isEqualTo(WeightOverrideService.MIN_WEIGHT_FACTOR);
        assertThat(change.key()).isEqualTo("jazz");
        assertThat(service.factor(WeightScope.GENRE, "JAZZ")).isEqualTo(WeightOverrideService.MIN_WEIGHT_FACTOR);
    }

    @Test
    void shouldAccumulatePositiveAdjustments() {
        service.adjust(WeightScope.ARTIST, "Miles Davis", 0.5);
        WeightChange change = service.adjust(WeightScope.ARTIST, "miles davis", 0.25);

        assertThat(change.oldFactor()).isCloseTo(1.5, within(1e-9));
        assertThat(change.newFactor()).isCloseTo(1.75, within(1e-9));
    }

    @Test
    void shouldBanOnlyThroughExplicitSet() {
        String key = WeightOverrideService.keyFor(WeightScope.TRACK, "So What", "Miles Davis", null);

        service.set(WeightScope.TRACK, key, 0.0);

        assertThat(service.factor(WeightScope.TRACK, key)).isZero();
        assertThat(service.set(WeightScope.TRACK, key, -2.0).newFactor()).isZero();
    }

    @Test
    void shouldRejectNonFiniteInput() {
        assertThatThrownBy(() -> service.adjust(WeightScope.GENRE, "jazz", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.set(WeightScope.GENRE, "jazz", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRequireTitleAndArtistForTrackKeys() {
        assertThatThrownBy(() -> WeightOverrideService.keyFor(WeightScope.TRACK, "So What", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(WeightOverrideService.keyFor(WeightScope.TRACK, " So What ", "Miles DAVIS", null))
                .isEqualTo("so what|||miles davis");
    }

    @Test
    void shouldComputeEffectiveFactorFromSnapshot() {
        service.set(WeightScope.GENRE, "jazz", 2.0);
        service.set(WeightScope.ARTIST, "Miles Davis", 0.5);
        service.set(WeightScope.TRACK, WeightOverrideService.keyFor(WeightScope.TRACK, "So What", "Miles Davis", null), 3.0);

        WeightOverrides snapshot = service.snapshot(Map.of("jazz", 4));

        assertThat(snapshot.effectiveFactor(1.0, "So What", "Miles Davis", "Jazz")).isCloseTo(0.75, within(1e-9));
        assertThat(snapshot.effectiveFactor(1.0, "Other", "Someone", "pop")).isEqualTo(1.0);
    }
}
