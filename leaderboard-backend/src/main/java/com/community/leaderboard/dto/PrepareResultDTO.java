package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrepareResultDTO {

    private int activityDefinitions;

    private int globalAggregateDefinitions;

    private int contributorAggregateDefinitions;

    private int badgeDefinitions;
}
