package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AggregateRunResultDTO {

    private String aggregate;

    private int samples;

    private int skippedSamples;

    // rows written to contributor_aggregate
    private int contributorsUpdated;

    // null when nothing was written
    private Long globalValue;
}
