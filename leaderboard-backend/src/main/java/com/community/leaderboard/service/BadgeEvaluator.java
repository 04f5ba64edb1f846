package com.community.leaderboard.service;

import com.community.leaderboard.achievement.BadgeRule;
import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.entity.ContributorBadge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns activity tallies into badge award candidates.
 * <p>
 * Every threshold is checked on its own, so a contributor receives all variants whose
 * requirement is met, not only the next one. The achievement date is always the first
 * qualifying activity, which keeps regenerated candidates identical from run to run.
 */
@Component
public class BadgeEvaluator {

    public static final String META_COUNT = "count";
    public static final String META_THRESHOLD = "threshold";

    public List<ContributorBadge> evaluate(BadgeRule rule, List<ActivityTallyDTO> tallies) {
        Map<String, Long> thresholds = rule.getThresholds();
        List<ContributorBadge> candidates = new ArrayList<>();

        for (ActivityTallyDTO tally : tallies) {
            if (tally.getCount() <= 0 || tally.getFirstOccurredAt() == null) {
                continue;
            }
            for (Map.Entry<String, Long> threshold : thresholds.entrySet()) {
                if (tally.getCount() >= threshold.getValue()) {
                    Map<String, Object> meta = new LinkedHashMap<>();
                    meta.put(META_COUNT, tally.getCount());
                    meta.put(META_THRESHOLD, threshold.getValue());
                    candidates.add(ContributorBadge.award(rule.getBadgeSlug(), tally.getContributor(),
                            threshold.getKey(), tally.getFirstOccurredAt(), meta));
                }
            }
        }
        return candidates;
    }
}
