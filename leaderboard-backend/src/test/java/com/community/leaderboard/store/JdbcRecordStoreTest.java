package com.community.leaderboard.store;

import com.community.leaderboard.config.LeaderboardProperties;
import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.entity.Activity;
import com.community.leaderboard.entity.ContributorBadge;
import com.community.leaderboard.model.ActivityType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Timestamp binding of {@link JdbcRecordStore} on a JVM whose default zone observes DST.
 */
@ExtendWith(MockitoExtension.class)
class JdbcRecordStoreTest {

    // 02:30 does not exist in New York on this date (clocks jump 02:00 -> 03:00)
    private static final LocalDateTime SPRING_FORWARD_GAP = LocalDateTime.of(2024, 3, 10, 2, 30);

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private ResultSet resultSet;

    private TimeZone defaultZone;
    private JdbcRecordStore recordStore;

    @BeforeEach
    void setUp() {
        defaultZone = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
        recordStore = new JdbcRecordStore(jdbcTemplate, new ObjectMapper(), new LeaderboardProperties());
    }

    @AfterEach
    void restoreZone() {
        TimeZone.setDefault(defaultZone);
    }

    @Test
    void activityTimestampIsBoundUnshifted() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);

        recordStore.upsertActivities(List.of(Activity.builder()
                .slug("pr-1")
                .contributor("alice")
                .activityType(ActivityType.PR_MERGED)
                .title("Fix login")
                .occurredAt(SPRING_FORWARD_GAP)
                .build()));

        ArgumentCaptor<Object[]> params = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).update(anyString(), params.capture());
        assertThat(params.getValue()[4]).isEqualTo(SPRING_FORWARD_GAP);
    }

    @Test
    void achievementDateIsBoundUnshifted() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(1);

        recordStore.awardContributorBadges(List.of(
                ContributorBadge.award("problem_solving", "alice", "1x", SPRING_FORWARD_GAP, Map.of("count", 2))));

        ArgumentCaptor<Object[]> params = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).update(anyString(), params.capture());
        assertThat(params.getValue()[4]).isEqualTo(SPRING_FORWARD_GAP);
    }

    @SuppressWarnings("unchecked")
    @Test
    void firstActivityIsReadAsLocalDateTime() throws Exception {
        when(resultSet.getString("contributor")).thenReturn("alice");
        when(resultSet.getLong("activity_count")).thenReturn(2L);
        when(resultSet.getObject("first_occurred_at", LocalDateTime.class)).thenReturn(SPRING_FORWARD_GAP);
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class)))
                .thenAnswer(invocation -> {
                    RowMapper<ActivityTallyDTO> mapper = invocation.getArgument(1);
                    return List.of(mapper.mapRow(resultSet, 0));
                });

        List<ActivityTallyDTO> tallies = recordStore.tallyActivities(ActivityType.PR_MERGED);

        assertThat(tallies).singleElement().satisfies(tally -> {
            assertThat(tally.getCount()).isEqualTo(2);
            assertThat(tally.getFirstOccurredAt()).isEqualTo(SPRING_FORWARD_GAP);
        });
    }
}
