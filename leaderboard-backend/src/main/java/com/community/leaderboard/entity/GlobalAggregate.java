package com.community.leaderboard.entity;

import com.community.leaderboard.model.AggregateValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * GlobalAggregate Entity: an organisation-wide statistic.
 * Maps to the {@code global_aggregate} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "global_aggregate")
public class GlobalAggregate {

    @Id
    @Column(name = "slug", length = 100)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description")
    private String description;

    /**
     * value: null until the aggregate is first computed (jsonb)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value")
    private AggregateValue value;
}
