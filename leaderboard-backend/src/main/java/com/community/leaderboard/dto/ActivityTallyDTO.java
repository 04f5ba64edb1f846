package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Lifetime count of one activity kind for a contributor, with the time of the first one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityTallyDTO {

    private String contributor;

    private long count;

    private LocalDateTime firstOccurredAt;
}
