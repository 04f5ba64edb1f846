package com.community.leaderboard.achievement;

import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.model.ActivityType;

import java.util.LinkedHashMap;

/**
 * A tiered badge earned by accumulating activities of one kind.
 * <p>
 * Rules are plain Spring beans: adding a badge means implementing this interface
 * and registering it as a component.
 */
public interface BadgeRule {

    /**
     * Badge slug, must match {@link BadgeDefinition#getSlug()} of {@link #getDefinition()}.
     */
    String getBadgeSlug();

    /**
     * Activity kind whose lifetime count is compared against the ladder.
     */
    ActivityType getActivityType();

    /**
     * Variant key to required count, in ascending order. Every variant in the ladder must
     * have a descriptor in the definition.
     */
    LinkedHashMap<String, Long> getThresholds();

    /**
     * Static definition seeded into {@code badge_definition}.
     */
    BadgeDefinition getDefinition();
}
