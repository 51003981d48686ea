package com.safeops.anomaly.service;

import com.safeops.anomaly.config.DetectorProperties;
import com.safeops.anomaly.engine.IsolationEstimator;
import com.safeops.anomaly.engine.ReconstructionEstimator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreCombinerTest {

    private ScoreCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new ScoreCombiner(new DetectorProperties());
    }

    private static IsolationEstimator.Outcome isolation(double score, boolean anomaly) {
        return new IsolationEstimator.Outcome(anomaly ? -score : 0.1, anomaly, score);
    }

    private static ReconstructionEstimator.Outcome reconstruction(double score, boolean anomaly) {
        return new ReconstructionEstimator.Outcome(score, 1.0, score, anomaly);
    }

    @Test
    void weightsIsolationSixtyReconstructionForty() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.5, false), reconstruction(0.5, false));

        assertThat(combined.score()).isCloseTo(0.5, within(1e-12));
        assertThat(combined.anomaly()).isFalse();
    }

    @Test
    void reconstructionVerdictAlone_flagsRun() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.0, false), reconstruction(1.0, true));

        assertThat(combined.score()).isCloseTo(0.4, within(1e-12));
        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void isolationVerdictAlone_flagsRun() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.05, true), reconstruction(0.1, false));

        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void combinedAboveThreshold_flagsRunWithoutModelVerdicts() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.8, false), reconstruction(0.8, false));

        assertThat(combined.score()).isCloseTo(0.8, within(1e-12));
        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void combinedBelowThreshold_isNotAnomalous() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.6, false), reconstruction(0.8, false));

        assertThat(combined.score()).isCloseTo(0.68, within(1e-12));
        assertThat(combined.anomaly()).isFalse();
    }

    @Test
    void isolationOnly_usesIsolationScore() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.3, true));

        assertThat(combined.score()).isEqualTo(0.3);
        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void nanScore_clampsToZero() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(Double.NaN, false));

        assertThat(combined.score()).isEqualTo(0.0);
        assertThat(combined.anomaly()).isFalse();
    }

    @Test
    void bothScoresZero_combineToZeroAndNormal() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(0.0, false), reconstruction(0.0, false));

        assertThat(combined.score()).isEqualTo(0.0);
        assertThat(combined.anomaly()).isFalse();
    }

    @Test
    void bothScoresSaturated_combineToExactlyOne() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(1.0, true), reconstruction(1.0, true));

        assertThat(combined.score()).isEqualTo(1.0);
        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void isolationOnly_saturatedScore_staysAtOne() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(1.0, true));

        assertThat(combined.score()).isEqualTo(1.0);
        assertThat(combined.anomaly()).isTrue();
    }

    @Test
    void isolationOnly_saturatedScoreWithoutVerdict_flaggedByCombinedThreshold() {
        ScoreCombiner.Combined combined = combiner.combine(isolation(1.0, false));

        assertThat(combined.score()).isEqualTo(1.0);
        assertThat(combined.anomaly()).isTrue();
    }
}
