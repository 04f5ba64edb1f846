package com.community.leaderboard.achievement.rules;

import com.community.leaderboard.achievement.BadgeRule;
import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.model.ActivityType;
import com.community.leaderboard.model.BadgeVariant;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PROBLEM_SOLVING: merged pull requests, 2 / 16 / 128 / 1024 / 8192
 */
@Component
public class ProblemSolvingRule implements BadgeRule {

    public static final String SLUG = "problem_solving";

    private static final String[][] TIERS = {
            // variant, required, level
            {"1x", "2", "Novice"},
            {"2x", "16", "Intermediate"},
            {"3x", "128", "Advanced"},
            {"4x", "1024", "Expert"},
            {"5x", "8192", "Master"},
    };

    private final LinkedHashMap<String, Long> thresholds = new LinkedHashMap<>();
    private final BadgeDefinition definition;

    public ProblemSolvingRule() {
        Map<String, BadgeVariant> variants = new LinkedHashMap<>();
        for (String[] tier : TIERS) {
            String variant = tier[0];
            long required = Long.parseLong(tier[1]);
            thresholds.put(variant, required);
            variants.put(variant, new BadgeVariant(
                    tier[2] + " - " + required + " PRs merged",
                    "/badges/problem-solving-" + variant + ".svg",
                    "Get " + required + " pull requests merged"));
        }
        this.definition = new BadgeDefinition(SLUG, "Problem Solving",
                "Awarded for consistently solving problems through merged PRs", variants);
    }

    @Override
    public String getBadgeSlug() {
        return SLUG;
    }

    @Override
    public ActivityType getActivityType() {
        return ActivityType.PR_MERGED;
    }

    @Override
    public LinkedHashMap<String, Long> getThresholds() {
        return new LinkedHashMap<>(thresholds);
    }

    @Override
    public BadgeDefinition getDefinition() {
        return definition;
    }
}
