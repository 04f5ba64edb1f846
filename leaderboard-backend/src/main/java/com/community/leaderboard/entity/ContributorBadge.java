package com.community.leaderboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * ContributorBadge Entity: one awarded badge variant. Rows are append-only.
 * Maps to the {@code contributor_badge} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "contributor_badge")
public class ContributorBadge {

    private static final String KEY_SEPARATOR = "__";

    /**
     * slug: {badge}__{contributor}__{variant} (Primary Key)
     */
    @Id
    @Column(name = "slug")
    private String slug;

    @Column(name = "badge", nullable = false, length = 100)
    private String badge;

    @Column(name = "contributor", nullable = false, length = 100)
    private String contributor;

    @Column(name = "variant", nullable = false, length = 20)
    private String variant;

    /**
     * achieved_on: timestamp of the contributor's first qualifying activity
     */
    @Column(name = "achieved_on", nullable = false)
    private LocalDateTime achievedOn;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meta")
    private Map<String, Object> meta;

    public static ContributorBadge award(String badge, String contributor, String variant,
                                         LocalDateTime achievedOn, Map<String, Object> meta) {
        return new ContributorBadge(slugOf(badge, contributor, variant), badge, contributor, variant, achievedOn, meta);
    }

    public static String slugOf(String badge, String contributor, String variant) {
        return badge + KEY_SEPARATOR + contributor + KEY_SEPARATOR + variant;
    }
}
