package com.community.leaderboard.service;

import com.community.leaderboard.achievement.BadgeRule;
import com.community.leaderboard.dto.PrepareResultDTO;
import com.community.leaderboard.entity.ActivityDefinition;
import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.model.ActivityType;
import com.community.leaderboard.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Seeds the static catalogues: activity kinds, aggregate definitions and badge definitions.
 * Must run before activities are ingested.
 */
@Service
public class DefinitionService {

    private static final Logger log = LoggerFactory.getLogger(DefinitionService.class);

    static final List<ActivityDefinition> ACTIVITY_DEFINITIONS = List.of(
            definition(ActivityType.COMMENT_CREATED, "Commented", "Commented on an Issue/PR", 0, "message-circle"),
            definition(ActivityType.ISSUE_ASSIGNED, "Issue Assigned", "Got an issue assigned", 1, "user-round-check"),
            definition(ActivityType.PR_REVIEWED, "PR Reviewed", "Reviewed a Pull Request", 2, "eye"),
            definition(ActivityType.ISSUE_OPENED, "Issue Opened", "Raised an Issue", 2, "circle-dot"),
            definition(ActivityType.PR_OPENED, "PR Opened", "Opened a Pull Request", 1, "git-pull-request-create-arrow"),
            definition(ActivityType.PR_MERGED, "PR Merged", "Merged a Pull Request", 7, "git-merge"),
            definition(ActivityType.PR_COLLABORATED, "PR Collaborated", "Collaborated on a Pull Request", 2, null),
            definition(ActivityType.ISSUE_CLOSED, "Issue Closed", "Closed an Issue", 0, null),
            definition(ActivityType.COMMIT_CREATED, "Commit Created", "Pushed a commit", 0, "git-commit-horizontal"),
            definition(ActivityType.PR_CLOSED, "PR Closed", "Closed a Pull Request without merging", 0, null));

    private final RecordStore recordStore;
    private final List<BadgeRule> badgeRules;

    public DefinitionService(RecordStore recordStore, List<BadgeRule> badgeRules) {
        this.recordStore = recordStore;
        this.badgeRules = badgeRules;
    }

    public PrepareResultDTO prepare() {
        int activityDefinitions = recordStore.upsertActivityDefinitions(ACTIVITY_DEFINITIONS);

        int globalDefinitions = recordStore.upsertGlobalAggregateDefinitions(
                List.of(AggregateCalculationService.prAverageTurnAroundDefinition()));

        int contributorDefinitions = recordStore.upsertContributorAggregateDefinitions(
                List.of(AggregateCalculationService.prAverageTurnAroundContributorDefinition()));

        List<BadgeDefinition> badgeDefinitions = badgeRules.stream()
                .map(BadgeRule::getDefinition)
                .collect(Collectors.toList());
        for (BadgeRule rule : badgeRules) {
            if (!rule.getDefinition().getVariants().keySet().containsAll(rule.getThresholds().keySet())) {
                throw new IllegalStateException("Badge " + rule.getBadgeSlug() + " has thresholds without a variant descriptor");
            }
        }
        int badges = recordStore.upsertBadgeDefinitions(badgeDefinitions);

        log.info("Definitions upserted: {} activity, {} global aggregate, {} contributor aggregate, {} badge",
                activityDefinitions, globalDefinitions, contributorDefinitions, badges);
        return new PrepareResultDTO(activityDefinitions, globalDefinitions, contributorDefinitions, badges);
    }

    private static ActivityDefinition definition(ActivityType type, String name, String description, int points, String icon) {
        return new ActivityDefinition(type.getSlug(), name, description, points, icon);
    }
}
