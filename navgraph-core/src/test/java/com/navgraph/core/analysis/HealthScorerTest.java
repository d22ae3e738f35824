package com.navgraph.core.analysis;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HealthScorer}.
 */
class HealthScorerTest {

    @Test
    void score_perfectGraph_isTen() {
        assertThat(HealthScorer.score(0, 0, 1.0)).isEqualTo(10.0);
        assertThat(HealthScorer.score(0, 0, null)).isEqualTo(10.0);
    }

    @Test
    void score_orphanPenalty_isCappedAtThree() {
        assertThat(HealthScorer.score(6, 0, null)).isEqualTo(7.0);
        assertThat(HealthScorer.score(50, 0, null)).isEqualTo(7.0);
        assertThat(HealthScorer.score(1, 0, null)).isEqualTo(9.5);
    }

    @Test
    void score_deadEndPenalty_isCappedAtOne() {
        assertThat(HealthScorer.score(0, 5, null)).isCloseTo(9.0, within(1e-9));
        assertThat(HealthScorer.score(0, 40, null)).isEqualTo(9.0);
        assertThat(HealthScorer.score(0, 2, null)).isCloseTo(9.6, within(1e-9));
    }

    @Test
    void score_journeyPenalty_isTwiceTheMissingCoverage() {
        assertThat(HealthScorer.score(0, 0, 0.5)).isEqualTo(9.0);
        assertThat(HealthScorer.score(0, 0, 0.0)).isEqualTo(8.0);
    }

    @Test
    void score_allPenaltiesAtCap_bottomsOutAtFour() {
        // 10 - 3 (orphans) - 1 (dead ends) - 2 (journeys)
        assertThat(HealthScorer.score(100, 100, 0.0)).isEqualTo(4.0);
        assertThat(HealthScorer.score(Integer.MAX_VALUE, Integer.MAX_VALUE, 0.0)).isEqualTo(4.0);
    }

    @Test
    void score_isDeterministic() {
        double first = HealthScorer.score(3, 7, 0.37);
        for (int i = 0; i < 100; i++) {
            assertThat(HealthScorer.score(3, 7, 0.37)).isEqualTo(first);
        }
    }

    @Test
    void score_invalidInput_throwsException() {
        assertThatThrownBy(() -> HealthScorer.score(-1, 0, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HealthScorer.score(0, -1, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HealthScorer.score(0, 0, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
