package com.community.leaderboard.service;

import com.community.leaderboard.config.LeaderboardProperties;
import com.community.leaderboard.dto.IngestResultDTO;
import com.community.leaderboard.entity.Activity;
import com.community.leaderboard.entity.Contributor;
import com.community.leaderboard.model.ActivityType;
import com.community.leaderboard.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActivityIngestionServiceTest {

    private InMemoryRecordStore recordStore;
    private ActivityIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        recordStore = new InMemoryRecordStore();
        LeaderboardProperties properties = new LeaderboardProperties();
        properties.setBotUsernames(List.of("release-robot"));
        ingestionService = new ActivityIngestionService(recordStore, properties);
    }

    @Test
    void registersContributorsOnceAndStoresActivities() {
        IngestResultDTO result = ingestionService.ingest(List.of(
                activity("pr-1-merged", "alice", ActivityType.PR_MERGED, "Fix login"),
                activity("pr-2-merged", "alice", ActivityType.PR_MERGED, "Add logout"),
                activity("issue-7-opened", "bob", ActivityType.ISSUE_OPENED, "Crash on start")));

        assertThat(result.getSubmittedActivities()).isEqualTo(3);
        assertThat(result.getNewContributors()).isEqualTo(2);
        assertThat(recordStore.contributors).containsOnlyKeys("alice", "bob");
        assertThat(recordStore.contributors.get("alice").getAvatarUrl())
                .isEqualTo("https://avatars.githubusercontent.com/alice");
        assertThat(recordStore.activities).containsOnlyKeys("pr-1-merged", "pr-2-merged", "issue-7-opened");
    }

    @Test
    void existingContributorKeepsProfile() {
        recordStore.putContributor(new Contributor("alice", Contributor.ROLE_MEMBER, "https://example.org/alice.png",
                Map.of("github", "https://github.com/alice")));

        IngestResultDTO result = ingestionService.ingest(List.of(activity("c-1", "alice", ActivityType.COMMIT_CREATED, null)));

        assertThat(result.getNewContributors()).isZero();
        assertThat(recordStore.contributors.get("alice").getAvatarUrl()).isEqualTo("https://example.org/alice.png");
    }

    @Test
    void reingestedActivityTakesNewTitleButKeepsMeta() {
        Activity first = activity("pr-1-merged", "alice", ActivityType.PR_MERGED, "Draft title");
        first.setMeta(Map.of(Activity.META_PR_TURN_AROUND, 1000));
        ingestionService.ingest(List.of(first));

        Activity second = activity("pr-1-merged", "alice", ActivityType.PR_MERGED, "Final title");
        second.setMeta(Map.of(Activity.META_PR_TURN_AROUND, 5000));
        ingestionService.ingest(List.of(second));

        Activity stored = recordStore.activities.get("pr-1-merged");
        assertThat(stored.getTitle()).isEqualTo("Final title");
        assertThat(stored.getActivityType()).isEqualTo(ActivityType.PR_MERGED);
        assertThat(stored.getMeta()).containsEntry(Activity.META_PR_TURN_AROUND, 1000);
    }

    @Test
    void flagsBotAccounts() {
        IngestResultDTO result = ingestionService.ingest(List.of(
                activity("c-1", "dependabot[bot]", ActivityType.PR_OPENED, "Bump lib"),
                activity("c-2", "release-robot", ActivityType.COMMIT_CREATED, null),
                activity("c-3", "alice", ActivityType.COMMIT_CREATED, null)));

        assertThat(result.getBotsUpdated()).isEqualTo(2);
        assertThat(recordStore.contributors.get("dependabot[bot]").getRole()).isEqualTo(Contributor.ROLE_BOT);
        assertThat(recordStore.contributors.get("release-robot").getRole()).isEqualTo(Contributor.ROLE_BOT);
        assertThat(recordStore.contributors.get("alice").getRole()).isEqualTo(Contributor.ROLE_MEMBER);
    }

    @Test
    void emptyBatchWritesNothing() {
        IngestResultDTO result = ingestionService.ingest(List.of());

        assertThat(result.getSubmittedActivities()).isZero();
        assertThat(recordStore.writeCalls).isZero();
    }

    @Test
    void rejectsActivityWithoutKind() {
        Activity broken = activity("x-1", "alice", null, null);

        assertThatThrownBy(() -> ingestionService.ingest(List.of(broken)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("x-1");
        assertThat(recordStore.contributors).isEmpty();
    }

    private static Activity activity(String slug, String contributor, ActivityType type, String title) {
        return Activity.builder()
                .slug(slug)
                .contributor(contributor)
                .activityType(type)
                .title(title)
                .occurredAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .build();
    }
}
