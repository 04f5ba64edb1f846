package com.community.leaderboard.dto;

import com.community.leaderboard.entity.Activity;
import com.community.leaderboard.model.ActivityType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Activity as submitted to the ingest endpoint. {@code occurred_at} is normalized to UTC;
 * a value without offset is read as UTC.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityDTO {

    private String slug;

    private String contributor;

    @JsonProperty("activity_definition")
    private ActivityType activityDefinition;

    private String title;

    @JsonProperty("occurred_at")
    @JsonDeserialize(using = UtcDateTimeDeserializer.class)
    private LocalDateTime occurredAt;

    private String link;

    private String text;

    private Integer points;

    private Map<String, Object> meta;

    public Activity toEntity() {
        return Activity.builder()
                .slug(slug)
                .contributor(contributor)
                .activityType(activityDefinition)
                .title(title)
                .occurredAt(occurredAt)
                .link(link)
                .text(text)
                .points(points)
                .meta(meta)
                .build();
    }
}
