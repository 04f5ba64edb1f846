package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Output of the turn-around averaging: rounded means in milliseconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TurnAroundSummaryDTO {

    /**
     * contributor -> mean turn-around, only contributors with at least one valid sample
     */
    private Map<String, Long> contributorMeans;

    /**
     * mean over all valid samples, null when there are none
     */
    private Long globalMean;

    private int acceptedSamples;

    private int skippedSamples;
}
