package com.community.leaderboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Maps to the {@code activity_definition} table: the catalogue of activity kinds
 * with their display name and point value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "activity_definition")
public class ActivityDefinition {

    /**
     * slug: activity kind, see {@link com.community.leaderboard.model.ActivityType} (Primary Key)
     */
    @Id
    @Column(name = "slug", length = 50)
    private String slug;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description")
    private String description;

    /**
     * points: score granted per activity of this kind
     */
    @Column(name = "points", nullable = false)
    private Integer points;

    /**
     * icon: lucide icon name, nullable
     */
    @Column(name = "icon", length = 100)
    private String icon;
}
