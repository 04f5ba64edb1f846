package com.community.leaderboard.service;

import com.community.leaderboard.dto.AggregateRunResultDTO;
import com.community.leaderboard.dto.BadgeRunResultDTO;
import com.community.leaderboard.dto.PipelineRunDTO;
import com.community.leaderboard.util.PipelineStatusManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Build stage of the pipeline: recomputes aggregates, then awards badges.
 * <p>
 * Stages run sequentially; badge awarding only starts after the aggregate writes returned.
 * Store failures abort the build and propagate to the caller. Every write is idempotent, so a
 * failed build is recovered by running it again.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final AggregateCalculationService aggregateCalculationService;
    private final BadgeAwardService badgeAwardService;
    private final PipelineStatusManager statusManager;

    public PipelineService(AggregateCalculationService aggregateCalculationService,
                           BadgeAwardService badgeAwardService,
                           PipelineStatusManager statusManager) {
        this.aggregateCalculationService = aggregateCalculationService;
        this.badgeAwardService = badgeAwardService;
        this.statusManager = statusManager;
    }

    /**
     * Scheduled trigger, enabled through {@code leaderboard.build-cron}.
     */
    @Scheduled(cron = "${leaderboard.build-cron:-}")
    public void scheduledBuild() {
        if (statusManager.isBuildInProgress()) {
            log.warn("Scheduled build skipped: a build is already running");
            return;
        }
        try {
            build();
        } catch (PipelineBusyException e) {
            log.warn("Scheduled build skipped: {}", e.getMessage());
        }
    }

    public PipelineRunDTO build() {
        if (!statusManager.tryStart()) {
            throw new PipelineBusyException("A pipeline build is already running");
        }
        try {
            return runStages();
        } finally {
            statusManager.finish();
        }
    }

    private PipelineRunDTO runStages() {
        LocalDateTime startedAt = LocalDateTime.now();
        long totalStartTime = System.currentTimeMillis();
        Map<String, Long> timingStats = new LinkedHashMap<>();

        log.info("--- 1. Aggregates ---");
        long aggregateStartTime = System.currentTimeMillis();
        List<AggregateRunResultDTO> aggregates = aggregateCalculationService.calculateAll();
        timingStats.put("1. aggregates", System.currentTimeMillis() - aggregateStartTime);

        log.info("--- 2. Badges ---");
        long badgeStartTime = System.currentTimeMillis();
        List<BadgeRunResultDTO> badges = badgeAwardService.awardAll();
        timingStats.put("2. badges", System.currentTimeMillis() - badgeStartTime);

        long totalTime = System.currentTimeMillis() - totalStartTime;
        timingStats.put("total", totalTime);
        printPerformanceReport(timingStats);

        return new PipelineRunDTO(startedAt, totalTime, aggregates, badges);
    }

    private void printPerformanceReport(Map<String, Long> timingStats) {
        log.info("Pipeline build timings:");
        timingStats.forEach((stage, millis) -> log.info("  {}: {} ms", stage, millis));
    }
}
