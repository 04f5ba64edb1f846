package com.community.leaderboard.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of {@link ContributorAggregate}: (aggregate, contributor).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributorAggregateId implements Serializable {

    private String aggregate;
    private String contributor;
}
