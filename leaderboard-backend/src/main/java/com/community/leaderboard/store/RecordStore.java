package com.community.leaderboard.store;

import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.dto.TurnAroundSampleDTO;
import com.community.leaderboard.entity.*;
import com.community.leaderboard.model.ActivityType;

import java.util.List;

/**
 * Durable store of contributors, activities, aggregates and badges.
 * <p>
 * Every write is an idempotent bulk upsert, batched by the implementation, and returns the
 * number of rows actually affected. The conflict policy of each family is fixed:
 * <ul>
 *   <li>contributors, badge awards: {@link ConflictPolicy#IGNORE} (first write wins)</li>
 *   <li>activities, definitions, aggregate values: {@link ConflictPolicy#UPDATE}</li>
 * </ul>
 * Empty input performs no write and returns 0. Failures of the underlying store propagate.
 */
public interface RecordStore {

    /**
     * Inserts unseen contributors with their default avatar and profile links.
     */
    int addContributors(List<String> usernames);

    /**
     * Sets the role of existing contributors. Unknown usernames are not created.
     */
    int updateContributorRoles(List<String> usernames, String role);

    int upsertActivityDefinitions(List<ActivityDefinition> definitions);

    /**
     * On conflict updates contributor, kind, title, occurred_at and link; text, points and meta
     * keep their stored values.
     */
    int upsertActivities(List<Activity> activities);

    /**
     * Creates or renames global aggregates without touching their value.
     */
    int upsertGlobalAggregateDefinitions(List<GlobalAggregate> definitions);

    int upsertGlobalAggregates(List<GlobalAggregate> aggregates);

    int upsertContributorAggregateDefinitions(List<ContributorAggregateDefinition> definitions);

    int upsertContributorAggregates(List<ContributorAggregate> aggregates);

    int upsertBadgeDefinitions(List<BadgeDefinition> definitions);

    /**
     * Inserts badge awards that do not exist yet. Existing awards are never overwritten.
     */
    int awardContributorBadges(List<ContributorBadge> badges);

    /**
     * Turn-around values of every merged pull request that carries one.
     */
    List<TurnAroundSampleDTO> findTurnAroundSamples();

    /**
     * Per contributor: number of activities of the given kind and the earliest occurrence.
     * Contributors without such activity are absent.
     */
    List<ActivityTallyDTO> tallyActivities(ActivityType activityType);
}
