package com.community.leaderboard.service;

import com.community.leaderboard.achievement.rules.ProblemSolvingRule;
import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.entity.ContributorBadge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BadgeEvaluatorTest {

    private static final LocalDateTime FIRST_MERGE = LocalDateTime.of(2024, 3, 1, 9, 30);

    private BadgeEvaluator badgeEvaluator;
    private ProblemSolvingRule rule;

    @BeforeEach
    void setUp() {
        badgeEvaluator = new BadgeEvaluator();
        rule = new ProblemSolvingRule();
    }

    @Test
    void countOfSixteenEarnsExactlyFirstTwoVariants() {
        List<ContributorBadge> badges = badgeEvaluator.evaluate(rule, List.of(tally("alice", 16)));

        assertThat(variants(badges)).containsExactly("1x", "2x");
    }

    @Test
    void countJustBelowThresholdDoesNotQualify() {
        assertThat(badgeEvaluator.evaluate(rule, List.of(tally("bob", 1)))).isEmpty();
        assertThat(variants(badgeEvaluator.evaluate(rule, List.of(tally("bob", 15))))).containsExactly("1x");
    }

    @Test
    void jumpingSeveralTiersAwardsAllOfThem() {
        List<ContributorBadge> badges = badgeEvaluator.evaluate(rule, List.of(tally("carol", 200)));

        assertThat(variants(badges)).containsExactly("1x", "2x", "3x");
    }

    @Test
    void everyVariantIsDatedAtFirstQualifyingActivity() {
        List<ContributorBadge> badges = badgeEvaluator.evaluate(rule, List.of(tally("alice", 9000)));

        assertThat(badges).hasSize(5);
        assertThat(badges).allSatisfy(badge -> assertThat(badge.getAchievedOn()).isEqualTo(FIRST_MERGE));
    }

    @Test
    void awardCarriesCompositeSlugAndMeta() {
        ContributorBadge badge = badgeEvaluator.evaluate(rule, List.of(tally("alice", 3))).get(0);

        assertThat(badge.getSlug()).isEqualTo("problem_solving__alice__1x");
        assertThat(badge.getBadge()).isEqualTo("problem_solving");
        assertThat(badge.getContributor()).isEqualTo("alice");
        assertThat(badge.getVariant()).isEqualTo("1x");
        assertThat(badge.getMeta()).containsOnly(entry("count", 3L), entry("threshold", 2L));
    }

    @Test
    void evaluationIsDeterministic() {
        List<ActivityTallyDTO> tallies = List.of(tally("alice", 20), tally("bob", 2));

        assertThat(badgeEvaluator.evaluate(rule, tallies)).isEqualTo(badgeEvaluator.evaluate(rule, tallies));
    }

    @Test
    void contributorsWithoutActivityGetNothing() {
        assertThat(badgeEvaluator.evaluate(rule, List.of())).isEmpty();
        assertThat(badgeEvaluator.evaluate(rule, List.of(tally("dave", 0)))).isEmpty();
    }

    private static ActivityTallyDTO tally(String contributor, long count) {
        return new ActivityTallyDTO(contributor, count, FIRST_MERGE);
    }

    private static List<String> variants(List<ContributorBadge> badges) {
        return badges.stream().map(ContributorBadge::getVariant).collect(Collectors.toList());
    }
}
