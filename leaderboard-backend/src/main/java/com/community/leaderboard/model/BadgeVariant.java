package com.community.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One tier of a badge, stored inside {@code badge_definition.variants}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BadgeVariant {

    private String description;

    @JsonProperty("svg_url")
    private String svgUrl;

    // human readable requirement, optional
    private String requirement;
}
