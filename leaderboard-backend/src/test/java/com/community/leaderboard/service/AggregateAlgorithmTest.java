package com.community.leaderboard.service;

import com.community.leaderboard.dto.TurnAroundSampleDTO;
import com.community.leaderboard.dto.TurnAroundSummaryDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class AggregateAlgorithmTest {

    private AggregateAlgorithm aggregateAlgorithm;

    @BeforeEach
    void setUp() {
        aggregateAlgorithm = new AggregateAlgorithm();
    }

    @Test
    void averagesPerContributorAndGlobally() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(
                sample("alice", "10"),
                sample("alice", "20"),
                sample("alice", "30"),
                sample("bob", "5")));

        assertThat(summary.getContributorMeans()).containsOnly(entry("alice", 20L), entry("bob", 5L));
        // (10 + 20 + 30 + 5) / 4 = 16.25
        assertThat(summary.getGlobalMean()).isEqualTo(Math.round(65 / 4.0));
        assertThat(summary.getGlobalMean()).isEqualTo(16L);
        assertThat(summary.getAcceptedSamples()).isEqualTo(4);
        assertThat(summary.getSkippedSamples()).isZero();
    }

    @Test
    void singleSampleMeanIsTheSampleItself() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(sample("carol", "86400000")));

        assertThat(summary.getContributorMeans()).containsOnly(entry("carol", 86_400_000L));
        assertThat(summary.getGlobalMean()).isEqualTo(86_400_000L);
    }

    @Test
    void roundsHalfUp() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(
                sample("dave", "1"), sample("dave", "2")));

        assertThat(summary.getContributorMeans()).containsOnly(entry("dave", 2L));
    }

    @Test
    void acceptsDecimalValues() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(
                sample("erin", "100.4"), sample("erin", "100.4")));

        assertThat(summary.getContributorMeans()).containsOnly(entry("erin", 100L));
    }

    @Test
    void skipsMalformedValuesWithoutFailing() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(
                sample("alice", "10"),
                sample("alice", "not-a-number"),
                sample("bob", ""),
                sample("bob", "NaN"),
                sample("bob", "Infinity"),
                sample("carol", null)));

        assertThat(summary.getContributorMeans()).containsOnly(entry("alice", 10L));
        assertThat(summary.getGlobalMean()).isEqualTo(10L);
        assertThat(summary.getSkippedSamples()).isEqualTo(5);
    }

    @Test
    void skipsJavaOnlyNumberLiterals() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(
                sample("alice", "10d"),
                sample("alice", "5f"),
                sample("alice", "0x1p4"),
                sample("bob", "1e3"),
                sample("bob", " 3000 ")));

        assertThat(summary.getContributorMeans()).containsOnly(entry("bob", 2000L));
        assertThat(summary.getSkippedSamples()).isEqualTo(3);
    }

    @Test
    void noValidSamplesGivesNoMeans() {
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(List.of(sample("alice", "abc")));

        assertThat(summary.getContributorMeans()).isEmpty();
        assertThat(summary.getGlobalMean()).isNull();

        TurnAroundSummaryDTO empty = aggregateAlgorithm.averageTurnAround(List.of());
        assertThat(empty.getContributorMeans()).isEmpty();
        assertThat(empty.getGlobalMean()).isNull();
    }

    @Test
    void roundedMeanRejectsEmptyInput() {
        assertThatThrownBy(() -> aggregateAlgorithm.roundedMean(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static TurnAroundSampleDTO sample(String contributor, String value) {
        return new TurnAroundSampleDTO(contributor, value);
    }
}
