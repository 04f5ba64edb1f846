package com.community.leaderboard.entity;

import com.community.leaderboard.model.BadgeVariant;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;

/**
 * Maps to the {@code badge_definition} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "badge_definition")
public class BadgeDefinition {

    @Id
    @Column(name = "slug", length = 100)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", nullable = false)
    private String description;

    /**
     * variants: variant key ("1x".."5x") -> descriptor (jsonb)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "variants", nullable = false)
    private Map<String, BadgeVariant> variants;
}
