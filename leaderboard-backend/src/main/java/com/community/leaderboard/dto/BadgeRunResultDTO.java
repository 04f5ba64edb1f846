package com.community.leaderboard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeRunResultDTO {

    private String badge;

    // contributors with at least one activity of the rule's kind
    private int contributors;

    private int candidates;

    // awards that did not exist before this run
    private int awarded;
}
