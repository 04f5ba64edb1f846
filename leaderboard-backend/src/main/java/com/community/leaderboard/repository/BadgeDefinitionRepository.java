package com.community.leaderboard.repository;

import com.community.leaderboard.entity.BadgeDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BadgeDefinitionRepository extends JpaRepository<BadgeDefinition, String> {
}
