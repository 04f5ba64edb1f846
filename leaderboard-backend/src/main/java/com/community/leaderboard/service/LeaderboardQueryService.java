package com.community.leaderboard.service;

import com.community.leaderboard.dto.ContributorSummaryDTO;
import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorBadge;
import com.community.leaderboard.entity.GlobalAggregate;

import java.util.List;
import java.util.Optional;

public interface LeaderboardQueryService {
    List<GlobalAggregate> getGlobalAggregates();
    List<BadgeDefinition> getBadgeDefinitions();
    List<ContributorAggregate> getContributorAggregates(String username);
    List<ContributorBadge> getContributorBadges(String username);
    Optional<ContributorSummaryDTO> getContributorSummary(String username);
}
