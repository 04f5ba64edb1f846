package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of one build: aggregates first, then badges.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunDTO {

    private LocalDateTime startedAt;

    private long durationMs;

    private List<AggregateRunResultDTO> aggregates;

    private List<BadgeRunResultDTO> badges;
}
