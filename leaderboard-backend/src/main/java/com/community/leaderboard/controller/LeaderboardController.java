package com.community.leaderboard.controller;

import com.community.leaderboard.dto.CommonResponse;
import com.community.leaderboard.dto.ContributorSummaryDTO;
import com.community.leaderboard.entity.BadgeDefinition;
import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorBadge;
import com.community.leaderboard.entity.GlobalAggregate;
import com.community.leaderboard.service.LeaderboardQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class LeaderboardController {

    private final LeaderboardQueryService queryService;

    public LeaderboardController(LeaderboardQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * GET /api/aggregates
     */
    @GetMapping("/aggregates")
    public ResponseEntity<CommonResponse<List<GlobalAggregate>>> getGlobalAggregates() {
        return ResponseEntity.ok(CommonResponse.success(queryService.getGlobalAggregates()));
    }

    /**
     * GET /api/badges
     */
    @GetMapping("/badges")
    public ResponseEntity<CommonResponse<List<BadgeDefinition>>> getBadgeDefinitions() {
        return ResponseEntity.ok(CommonResponse.success(queryService.getBadgeDefinitions()));
    }

    /**
     * GET /api/contributors/{username}
     * 404 when the contributor was never seen.
     */
    @GetMapping("/contributors/{username}")
    public ResponseEntity<CommonResponse<ContributorSummaryDTO>> getContributor(@PathVariable String username) {
        Optional<ContributorSummaryDTO> summary = queryService.getContributorSummary(username);
        if (summary.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(CommonResponse.error(404, "Unknown contributor: " + username));
        }
        return ResponseEntity.ok(CommonResponse.success(summary.get()));
    }

    /**
     * GET /api/contributors/{username}/aggregates
     */
    @GetMapping("/contributors/{username}/aggregates")
    public ResponseEntity<CommonResponse<List<ContributorAggregate>>> getContributorAggregates(@PathVariable String username) {
        return ResponseEntity.ok(CommonResponse.success(queryService.getContributorAggregates(username)));
    }

    /**
     * GET /api/contributors/{username}/badges
     * Newest first.
     */
    @GetMapping("/contributors/{username}/badges")
    public ResponseEntity<CommonResponse<List<ContributorBadge>>> getContributorBadges(@PathVariable String username) {
        return ResponseEntity.ok(CommonResponse.success(queryService.getContributorBadges(username)));
    }
}
