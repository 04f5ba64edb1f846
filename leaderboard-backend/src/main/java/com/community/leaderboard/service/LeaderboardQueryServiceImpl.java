package com.community.leaderboard.service;

import com.community.leaderboard.dto.ContributorSummaryDTO;
import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.entity.Contributor;
import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorBadge;
import com.community.leaderboard.entity.GlobalAggregate;
import com.community.leaderboard.repository.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class LeaderboardQueryServiceImpl implements LeaderboardQueryService {

    private final ContributorRepository contributorRepository;
    private final ActivityRepository activityRepository;
    private final GlobalAggregateRepository globalAggregateRepository;
    private final ContributorAggregateRepository contributorAggregateRepository;
    private final BadgeDefinitionRepository badgeDefinitionRepository;
    private final ContributorBadgeRepository contributorBadgeRepository;

    public LeaderboardQueryServiceImpl(ContributorRepository contributorRepository,
                                       ActivityRepository activityRepository,
                                       GlobalAggregateRepository globalAggregateRepository,
                                       ContributorAggregateRepository contributorAggregateRepository,
                                       BadgeDefinitionRepository badgeDefinitionRepository,
                                       ContributorBadgeRepository contributorBadgeRepository) {
        this.contributorRepository = contributorRepository;
        this.activityRepository = activityRepository;
        this.globalAggregateRepository = globalAggregateRepository;
        this.contributorAggregateRepository = contributorAggregateRepository;
        this.badgeDefinitionRepository = badgeDefinitionRepository;
        this.contributorBadgeRepository = contributorBadgeRepository;
    }

    @Override
    public List<GlobalAggregate> getGlobalAggregates() {
        return globalAggregateRepository.findAllByOrderBySlugAsc();
    }

    @Override
    public List<BadgeDefinition> getBadgeDefinitions() {
        return badgeDefinitionRepository.findAll();
    }

    @Override
    public List<ContributorAggregate> getContributorAggregates(String username) {
        return contributorAggregateRepository.findByContributorOrderByAggregateAsc(username);
    }

    @Override
    public List<ContributorBadge> getContributorBadges(String username) {
        return contributorBadgeRepository.findByContributorOrderByAchievedOnDescSlugDesc(username);
    }

    @Override
    public Optional<ContributorSummaryDTO> getContributorSummary(String username) {
        Optional<Contributor> contributor = contributorRepository.findById(username);
        if (contributor.isEmpty()) {
            return Optional.empty();
        }

        ContributorSummaryDTO dto = new ContributorSummaryDTO();
        dto.setUsername(contributor.get().getUsername());
        dto.setRole(contributor.get().getRole());
        dto.setAvatarUrl(contributor.get().getAvatarUrl());
        dto.setActivityCount(activityRepository.countByContributor(username));

        // [0: activity_definition, 1: count]
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (Object[] row : activityRepository.countByActivityDefinitionForContributor(username)) {
            breakdown.put((String) row[0], ((Number) row[1]).longValue());
        }
        dto.setActivityBreakdown(breakdown);
        dto.setAggregates(getContributorAggregates(username));
        dto.setBadges(getContributorBadges(username));
        return Optional.of(dto);
    }
}
