package com.community.leaderboard.store;

import com.community.leaderboard.util.Batches;
import com.community.leaderboard.util.SqlPlaceholders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Parameterized multi-row {@code INSERT ... ON CONFLICT} statement for PostgreSQL.
 * <p>
 * Rows are written batch by batch, one statement per batch, so a failure leaves the earlier
 * batches committed and the call can be repeated as a whole.
 *
 * @param <T> record type bound to one row
 */
public final class BulkUpsert<T> {

    private static final Logger log = LoggerFactory.getLogger(BulkUpsert.class);

    private static final String PLAIN = "?";
    private static final String JSONB = "CAST(? AS jsonb)";

    private final String table;
    private final List<String> columns;
    private final List<String> placeholders;
    private final List<String> conflictColumns;
    private final ConflictPolicy policy;
    private final List<String> updateColumns;
    private final Function<T, Object[]> binder;
    private final String label;

    private BulkUpsert(Builder<T> builder) {
        this.table = builder.table;
        this.columns = List.copyOf(builder.columns);
        this.placeholders = List.copyOf(builder.placeholders);
        this.conflictColumns = List.copyOf(builder.conflictColumns);
        this.policy = builder.policy;
        this.updateColumns = List.copyOf(builder.updateColumns);
        this.binder = builder.binder;
        this.label = builder.label;
    }

    public static <T> Builder<T> into(String table) {
        return new Builder<>(table);
    }

    public ConflictPolicy getPolicy() {
        return policy;
    }

    /**
     * Writes all records and returns the total number of affected rows.
     */
    public int execute(JdbcTemplate jdbcTemplate, List<T> records, int batchSize) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        int totalAffected = 0;
        for (List<T> batch : Batches.partition(records, batchSize)) {
            Object[] params = new Object[batch.size() * columns.size()];
            int paramIndex = 0;
            for (T record : batch) {
                Object[] row = binder.apply(record);
                if (row.length != columns.size()) {
                    throw new IllegalStateException("Binder for " + table + " produced " + row.length
                            + " values, expected " + columns.size());
                }
                System.arraycopy(row, 0, params, paramIndex, row.length);
                paramIndex += row.length;
            }

            int affected = jdbcTemplate.update(sql(batch.size()), params);
            totalAffected += affected;
            log.info("{} {}/{} {}", verb(), affected, batch.size(), label);
        }

        log.debug("Bulk upsert into {} finished: {} affected of {} submitted in {} batches", table,
                totalAffected, records.size(), Batches.count(records.size(), batchSize));
        return totalAffected;
    }

    String sql(int rowCount) {
        StringBuilder sql = new StringBuilder()
                .append("INSERT INTO ").append(table)
                .append(" (").append(String.join(", ", columns)).append(")\nVALUES ")
                .append(SqlPlaceholders.rows(rowCount, placeholders))
                .append("\nON CONFLICT (").append(String.join(", ", conflictColumns)).append(")");

        if (policy == ConflictPolicy.IGNORE) {
            sql.append(" DO NOTHING");
        } else {
            sql.append(" DO UPDATE SET ");
            for (int i = 0; i < updateColumns.size(); i++) {
                String column = updateColumns.get(i);
                sql.append(column).append(" = EXCLUDED.").append(column);
                if (i < updateColumns.size() - 1) {
                    sql.append(", ");
                }
            }
        }
        return sql.toString();
    }

    private String verb() {
        return policy == ConflictPolicy.IGNORE ? "Added" : "Upserted";
    }

    public static final class Builder<T> {

        private final String table;
        private final List<String> columns = new ArrayList<>();
        private final List<String> placeholders = new ArrayList<>();
        private final List<String> conflictColumns = new ArrayList<>();
        private final List<String> updateColumns = new ArrayList<>();
        private ConflictPolicy policy;
        private Function<T, Object[]> binder;
        private String label;

        private Builder(String table) {
            this.table = table;
            this.label = table + " rows";
        }

        public Builder<T> columns(String... names) {
            for (String name : names) {
                columns.add(name);
                placeholders.add(PLAIN);
            }
            return this;
        }

        /**
         * Column bound from a JSON string and cast to jsonb.
         */
        public Builder<T> jsonColumn(String name) {
            columns.add(name);
            placeholders.add(JSONB);
            return this;
        }

        public Builder<T> onConflict(String... conflictTarget) {
            conflictColumns.addAll(List.of(conflictTarget));
            return this;
        }

        public Builder<T> doNothing() {
            this.policy = ConflictPolicy.IGNORE;
            return this;
        }

        public Builder<T> doUpdate(String... mutableColumns) {
            this.policy = ConflictPolicy.UPDATE;
            updateColumns.addAll(List.of(mutableColumns));
            return this;
        }

        public Builder<T> binder(Function<T, Object[]> binder) {
            this.binder = binder;
            return this;
        }

        /**
         * Noun used in the per-batch progress line, e.g. "new contributors".
         */
        public Builder<T> label(String label) {
            this.label = label;
            return this;
        }

        public BulkUpsert<T> build() {
            if (columns.isEmpty() || conflictColumns.isEmpty() || policy == null || binder == null) {
                throw new IllegalStateException("Incomplete upsert definition for table " + table);
            }
            if (policy == ConflictPolicy.UPDATE && updateColumns.isEmpty()) {
                throw new IllegalStateException("DO UPDATE on " + table + " needs at least one column");
            }
            return new BulkUpsert<>(this);
        }
    }
}
