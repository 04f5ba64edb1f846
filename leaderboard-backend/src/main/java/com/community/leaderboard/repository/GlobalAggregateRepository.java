package com.community.leaderboard.repository;

import com.community.leaderboard.entity.GlobalAggregate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GlobalAggregateRepository extends JpaRepository<GlobalAggregate, String> {

    List<GlobalAggregate> findAllByOrderBySlugAsc();
}
