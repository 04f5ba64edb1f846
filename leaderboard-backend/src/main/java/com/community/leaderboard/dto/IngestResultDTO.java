package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestResultDTO {

    private int submittedActivities;

    private int newContributors;

    private int activitiesAffected;

    private int botsUpdated;
}
