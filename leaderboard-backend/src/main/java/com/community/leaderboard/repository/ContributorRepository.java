package com.community.leaderboard.repository;

import com.community.leaderboard.entity.Contributor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContributorRepository extends JpaRepository<Contributor, String> {

    List<Contributor> findByRole(String role);
}
