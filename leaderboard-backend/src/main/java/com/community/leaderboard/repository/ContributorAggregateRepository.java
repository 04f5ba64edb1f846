package com.community.leaderboard.repository;

import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorAggregateId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContributorAggregateRepository extends JpaRepository<ContributorAggregate, ContributorAggregateId> {

    List<ContributorAggregate> findByContributorOrderByAggregateAsc(String contributor);
}
