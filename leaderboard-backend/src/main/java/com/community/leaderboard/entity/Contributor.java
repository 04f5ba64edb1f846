package com.community.leaderboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;

/**
 * Contributor Entity: one row per GitHub handle, created on first sighting.
 * Maps to the {@code contributor} table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "contributor")
public class Contributor {

    public static final String ROLE_MEMBER = "member";
    public static final String ROLE_BOT = "bot";

    /**
     * username: GitHub handle (Primary Key)
     */
    @Id
    @Column(name = "username", length = 100)
    private String username;

    /**
     * role: "member" by default, "bot" for automation accounts
     */
    @Column(name = "role", nullable = false, length = 20)
    private String role = ROLE_MEMBER;

    @Column(name = "avatar_url")
    private String avatarUrl;

    /**
     * social_profiles: network name -> profile URL (jsonb)
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "social_profiles")
    private Map<String, String> socialProfiles;
}
