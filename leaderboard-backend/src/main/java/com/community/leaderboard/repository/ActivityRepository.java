package com.community.leaderboard.repository;

import com.community.leaderboard.entity.Activity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ActivityRepository extends JpaRepository<Activity, String> {

    long countByContributor(String contributor);

    // activity count per kind for one contributor: [activity_definition, count]
    @Query(value = "SELECT a.activity_definition, COUNT(*) FROM activity a WHERE a.contributor = :contributor " +
                   "GROUP BY a.activity_definition ORDER BY a.activity_definition", nativeQuery = true)
    List<Object[]> countByActivityDefinitionForContributor(String contributor);
}
