package com.community.leaderboard.entity;

import com.community.leaderboard.model.ActivityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Activity Entity: one observed contributor event.
 * Maps to the {@code activity} table. All timestamps are UTC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "activity")
public class Activity {

    /**
     * meta key carrying the turn-around time (ms) of a merged pull request
     */
    public static final String META_PR_TURN_AROUND = "pr_avg_tat";

    /**
     * slug: stable identity of the event (Primary Key)
     */
    @Id
    @Column(name = "slug")
    private String slug;

    /**
     * contributor: username (Foreign Key)
     */
    @Column(name = "contributor", nullable = false, length = 100)
    private String contributor;

    /**
     * activity_definition: activity kind (Foreign Key)
     */
    @Convert(converter = ActivityTypeConverter.class)
    @Column(name = "activity_definition", nullable = false, length = 50)
    private ActivityType activityType;

    @Column(name = "title")
    private String title;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @Column(name = "link")
    private String link;

    @Column(name = "text")
    private String text;

    @Column(name = "points")
    private Integer points;

    /**
     * meta: open-ended structured data (jsonb)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meta")
    private Map<String, Object> meta;
}
