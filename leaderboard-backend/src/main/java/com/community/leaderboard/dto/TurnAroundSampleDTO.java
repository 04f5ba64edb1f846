package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw turn-around value of one merged pull request, as read from the activity meta.
 * The value is kept as text; parsing and validation belong to the aggregate algorithm.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TurnAroundSampleDTO {

    private String contributor;

    private String rawValue;
}
