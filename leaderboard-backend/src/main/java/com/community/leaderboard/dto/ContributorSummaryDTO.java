package com.community.leaderboard.dto;

import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorBadge;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Everything known about one contributor.
 */
@Data
@NoArgsConstructor
public class ContributorSummaryDTO {

    private String username;

    private String role;

    private String avatarUrl;

    private long activityCount;

    // activity_definition slug -> count
    private Map<String, Long> activityBreakdown;

    private List<ContributorAggregate> aggregates;

    private List<ContributorBadge> badges;
}
