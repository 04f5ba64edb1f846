package com.community.leaderboard.entity;

import com.community.leaderboard.model.AggregateValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * ContributorAggregate Entity: a statistic scoped to one contributor.
 * Maps to the {@code contributor_aggregate} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@IdClass(ContributorAggregateId.class)
@Table(name = "contributor_aggregate")
public class ContributorAggregate {

    /**
     * aggregate: contributor_aggregate_definition.slug (Foreign Key)
     */
    @Id
    @Column(name = "aggregate", length = 100)
    private String aggregate;

    /**
     * contributor: contributor.username (Foreign Key)
     */
    @Id
    @Column(name = "contributor", length = 100)
    private String contributor;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "value", nullable = false)
    private AggregateValue value;
}
