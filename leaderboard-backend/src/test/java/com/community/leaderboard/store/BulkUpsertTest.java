package com.community.leaderboard.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BulkUpsertTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private final BulkUpsert<String[]> ignoring = BulkUpsert.<String[]>into("contributor")
            .columns("username")
            .jsonColumn("social_profiles")
            .onConflict("username")
            .doNothing()
            .binder(row -> new Object[]{row[0], row[1]})
            .label("new contributors")
            .build();

    private final BulkUpsert<String[]> updating = BulkUpsert.<String[]>into("activity")
            .columns("slug", "title")
            .onConflict("slug")
            .doUpdate("title")
            .binder(row -> new Object[]{row[0], row[1]})
            .build();

    @Test
    void ignorePolicyRendersDoNothing() {
        assertThat(ignoring.sql(2)).isEqualTo("INSERT INTO contributor (username, social_profiles)\n"
                + "VALUES (?, CAST(? AS jsonb)),\n(?, CAST(? AS jsonb))\n"
                + "ON CONFLICT (username) DO NOTHING");
        assertThat(ignoring.getPolicy()).isEqualTo(ConflictPolicy.IGNORE);
    }

    @Test
    void updatePolicyRendersExcludedAssignments() {
        assertThat(updating.sql(1)).isEqualTo("INSERT INTO activity (slug, title)\n"
                + "VALUES (?, ?)\n"
                + "ON CONFLICT (slug) DO UPDATE SET title = EXCLUDED.title");
    }

    @Test
    void writesOneStatementPerBatchAndSumsAffectedRows() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(2, 0);

        List<String[]> rows = List.of(
                new String[]{"a", "A"}, new String[]{"b", "B"}, new String[]{"c", "C"});
        int affected = updating.execute(jdbcTemplate, rows, 2);

        assertThat(affected).isEqualTo(2);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> params = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate, times(2)).update(sql.capture(), params.capture());
        assertThat(sql.getAllValues().get(0)).contains("(?, ?),\n(?, ?)");
        assertThat(params.getAllValues().get(0)).containsExactly("a", "A", "b", "B");
        assertThat(params.getAllValues().get(1)).containsExactly("c", "C");
    }

    @Test
    void emptyInputSkipsTheWrite() {
        assertThat(updating.execute(jdbcTemplate, List.of(), 1000)).isZero();
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void storeFailurePropagatesAfterCommittedPrefix() {
        when(jdbcTemplate.update(anyString(), any(Object[].class)))
                .thenReturn(1)
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        List<String[]> rows = List.of(new String[]{"a", "A"}, new String[]{"b", "B"});

        assertThatThrownBy(() -> updating.execute(jdbcTemplate, rows, 1))
                .isInstanceOf(DataAccessResourceFailureException.class);
        verify(jdbcTemplate, times(2)).update(anyString(), any(Object[].class));
    }

    @Test
    void incompleteDefinitionIsRejected() {
        assertThatThrownBy(() -> BulkUpsert.<String>into("t").columns("a").onConflict("a").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> BulkUpsert.<String>into("t").columns("a").onConflict("a").doUpdate()
                .binder(s -> new Object[]{s}).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
