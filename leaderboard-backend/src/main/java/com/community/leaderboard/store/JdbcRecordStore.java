package com.community.leaderboard.store;

import com.community.leaderboard.config.LeaderboardProperties;
import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.dto.TurnAroundSampleDTO;
import com.community.leaderboard.entity.*;
import com.community.leaderboard.model.ActivityType;
import com.community.leaderboard.util.Batches;
import com.community.leaderboard.util.SqlPlaceholders;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * PostgreSQL implementation of {@link RecordStore} on top of {@link JdbcTemplate}.
 * Uses native {@code ON CONFLICT} so every write is idempotent.
 * <p>
 * Timestamps are UTC wall-clock values, bound and read as {@link LocalDateTime}.
 */
@Repository
public class JdbcRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    static final String AVATAR_URL_TEMPLATE = "https://avatars.githubusercontent.com/%s";
    static final String GITHUB_PROFILE_TEMPLATE = "https://github.com/%s";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int batchSize;

    private final BulkUpsert<String> contributorInsert;
    private final BulkUpsert<ActivityDefinition> activityDefinitionUpsert;
    private final BulkUpsert<Activity> activityUpsert;
    private final BulkUpsert<GlobalAggregate> globalAggregateDefinitionUpsert;
    private final BulkUpsert<GlobalAggregate> globalAggregateUpsert;
    private final BulkUpsert<ContributorAggregateDefinition> contributorAggregateDefinitionUpsert;
    private final BulkUpsert<ContributorAggregate> contributorAggregateUpsert;
    private final BulkUpsert<BadgeDefinition> badgeDefinitionUpsert;
    private final BulkUpsert<ContributorBadge> contributorBadgeInsert;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, LeaderboardProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.batchSize = properties.getBatchSize();

        this.contributorInsert = BulkUpsert.<String>into("contributor")
                .columns("username", "avatar_url")
                .jsonColumn("social_profiles")
                .onConflict("username")
                .doNothing()
                .binder(username -> new Object[]{
                        username,
                        String.format(AVATAR_URL_TEMPLATE, username),
                        toJson(Map.of("github", String.format(GITHUB_PROFILE_TEMPLATE, username)))
                })
                .label("new contributors")
                .build();

        this.activityDefinitionUpsert = BulkUpsert.<ActivityDefinition>into("activity_definition")
                .columns("slug", "name", "description", "points", "icon")
                .onConflict("slug")
                .doUpdate("name", "description", "points", "icon")
                .binder(d -> new Object[]{d.getSlug(), d.getName(), d.getDescription(), d.getPoints(), d.getIcon()})
                .label("activity definitions")
                .build();

        this.activityUpsert = BulkUpsert.<Activity>into("activity")
                .columns("slug", "contributor", "activity_definition", "title", "occurred_at", "link", "text", "points")
                .jsonColumn("meta")
                .onConflict("slug")
                .doUpdate("contributor", "activity_definition", "title", "occurred_at", "link")
                .binder(a -> new Object[]{
                        a.getSlug(),
                        a.getContributor(),
                        a.getActivityType().getSlug(),
                        a.getTitle(),
                        a.getOccurredAt(),
                        a.getLink(),
                        a.getText(),
                        a.getPoints(),
                        toJson(a.getMeta())
                })
                .label("activities")
                .build();

        this.globalAggregateDefinitionUpsert = BulkUpsert.<GlobalAggregate>into("global_aggregate")
                .columns("slug", "name", "description")
                .onConflict("slug")
                .doUpdate("name", "description")
                .binder(g -> new Object[]{g.getSlug(), g.getName(), g.getDescription()})
                .label("global aggregate definitions")
                .build();

        this.globalAggregateUpsert = BulkUpsert.<GlobalAggregate>into("global_aggregate")
                .columns("slug", "name", "description")
                .jsonColumn("value")
                .onConflict("slug")
                .doUpdate("name", "description", "value")
                .binder(g -> new Object[]{g.getSlug(), g.getName(), g.getDescription(), toJson(g.getValue())})
                .label("global aggregates")
                .build();

        this.contributorAggregateDefinitionUpsert = BulkUpsert.<ContributorAggregateDefinition>into("contributor_aggregate_definition")
                .columns("slug", "name", "description")
                .onConflict("slug")
                .doUpdate("name", "description")
                .binder(d -> new Object[]{d.getSlug(), d.getName(), d.getDescription()})
                .label("contributor aggregate definitions")
                .build();

        this.contributorAggregateUpsert = BulkUpsert.<ContributorAggregate>into("contributor_aggregate")
                .columns("aggregate", "contributor")
                .jsonColumn("value")
                .onConflict("aggregate", "contributor")
                .doUpdate("value")
                .binder(c -> new Object[]{c.getAggregate(), c.getContributor(), toJson(c.getValue())})
                .label("contributor aggregates")
                .build();

        this.badgeDefinitionUpsert = BulkUpsert.<BadgeDefinition>into("badge_definition")
                .columns("slug", "name", "description")
                .jsonColumn("variants")
                .onConflict("slug")
                .doUpdate("name", "description", "variants")
                .binder(b -> new Object[]{b.getSlug(), b.getName(), b.getDescription(), toJson(b.getVariants())})
                .label("badge definitions")
                .build();

        this.contributorBadgeInsert = BulkUpsert.<ContributorBadge>into("contributor_badge")
                .columns("slug", "badge", "contributor", "variant", "achieved_on")
                .jsonColumn("meta")
                .onConflict("slug")
                .doNothing()
                .binder(b -> new Object[]{
                        b.getSlug(),
                        b.getBadge(),
                        b.getContributor(),
                        b.getVariant(),
                        b.getAchievedOn(),
                        toJson(b.getMeta())
                })
                .label("new contributor badges")
                .build();
    }

    @Override
    public int addContributors(List<String> usernames) {
        List<String> unique = usernames == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(usernames));
        return contributorInsert.execute(jdbcTemplate, unique, batchSize);
    }

    @Override
    public int updateContributorRoles(List<String> usernames, String role) {
        if (usernames == null || usernames.isEmpty()) {
            log.info("No contributors to mark as {}", role);
            return 0;
        }

        List<String> unique = new ArrayList<>(new LinkedHashSet<>(usernames));
        int totalAffected = 0;
        for (List<String> batch : Batches.partition(unique, batchSize)) {
            String sql = "UPDATE contributor SET role = ? WHERE username IN (" + SqlPlaceholders.list(batch.size()) + ")";
            Object[] params = new Object[batch.size() + 1];
            params[0] = role;
            for (int i = 0; i < batch.size(); i++) {
                params[i + 1] = batch.get(i);
            }
            int affected = jdbcTemplate.update(sql, params);
            totalAffected += affected;
            log.info("Updated {}/{} {} contributors", affected, batch.size(), role);
        }
        return totalAffected;
    }

    @Override
    public int upsertActivityDefinitions(List<ActivityDefinition> definitions) {
        return activityDefinitionUpsert.execute(jdbcTemplate, lastPerKey(definitions, ActivityDefinition::getSlug), batchSize);
    }

    @Override
    public int upsertActivities(List<Activity> activities) {
        return activityUpsert.execute(jdbcTemplate, lastPerKey(activities, Activity::getSlug), batchSize);
    }

    @Override
    public int upsertGlobalAggregateDefinitions(List<GlobalAggregate> definitions) {
        return globalAggregateDefinitionUpsert.execute(jdbcTemplate, lastPerKey(definitions, GlobalAggregate::getSlug), batchSize);
    }

    @Override
    public int upsertGlobalAggregates(List<GlobalAggregate> aggregates) {
        return globalAggregateUpsert.execute(jdbcTemplate, lastPerKey(aggregates, GlobalAggregate::getSlug), batchSize);
    }

    @Override
    public int upsertContributorAggregateDefinitions(List<ContributorAggregateDefinition> definitions) {
        return contributorAggregateDefinitionUpsert.execute(jdbcTemplate,
                lastPerKey(definitions, ContributorAggregateDefinition::getSlug), batchSize);
    }

    @Override
    public int upsertContributorAggregates(List<ContributorAggregate> aggregates) {
        return contributorAggregateUpsert.execute(jdbcTemplate,
                lastPerKey(aggregates, a -> new ContributorAggregateId(a.getAggregate(), a.getContributor())), batchSize);
    }

    @Override
    public int upsertBadgeDefinitions(List<BadgeDefinition> definitions) {
        return badgeDefinitionUpsert.execute(jdbcTemplate, lastPerKey(definitions, BadgeDefinition::getSlug), batchSize);
    }

    @Override
    public int awardContributorBadges(List<ContributorBadge> badges) {
        return contributorBadgeInsert.execute(jdbcTemplate, badges, batchSize);
    }

    @Override
    public List<TurnAroundSampleDTO> findTurnAroundSamples() {
        String sql = """
                SELECT contributor, meta->>'pr_avg_tat' AS pr_avg_tat
                FROM activity
                WHERE activity_definition = ?
                  AND meta->>'pr_avg_tat' IS NOT NULL
                """;
        return jdbcTemplate.query(sql,
                (rs, rowNum) -> new TurnAroundSampleDTO(rs.getString("contributor"), rs.getString("pr_avg_tat")),
                ActivityType.PR_MERGED.getSlug());
    }

    @Override
    public List<ActivityTallyDTO> tallyActivities(ActivityType activityType) {
        String sql = """
                SELECT contributor, COUNT(*) AS activity_count, MIN(occurred_at) AS first_occurred_at
                FROM activity
                WHERE activity_definition = ?
                GROUP BY contributor
                """;
        return jdbcTemplate.query(sql,
                (rs, rowNum) -> new ActivityTallyDTO(
                        rs.getString("contributor"),
                        rs.getLong("activity_count"),
                        rs.getObject("first_occurred_at", LocalDateTime.class)),
                activityType.getSlug());
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize value to JSON: " + value, e);
        }
    }

    // ON CONFLICT DO UPDATE cannot touch the same row twice in one statement
    private static <T, K> List<T> lastPerKey(List<T> records, Function<T, K> key) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        Map<K, T> byKey = new LinkedHashMap<>();
        for (T record : records) {
            byKey.put(key.apply(record), record);
        }
        return new ArrayList<>(byKey.values());
    }
}
