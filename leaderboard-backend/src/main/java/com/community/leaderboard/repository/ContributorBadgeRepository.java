package com.community.leaderboard.repository;

import com.community.leaderboard.entity.ContributorBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContributorBadgeRepository extends JpaRepository<ContributorBadge, String> {

    List<ContributorBadge> findByContributorOrderByAchievedOnDescSlugDesc(String contributor);
}
