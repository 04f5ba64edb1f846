package com.community.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of contributor activity. The slug is the primary key of the
 * {@code activity_definition} table and the value stored on every activity row.
 */
public enum ActivityType {

    ISSUE_OPENED("issue_opened"),
    ISSUE_CLOSED("issue_closed"),
    PR_OPENED("pr_opened"),
    PR_CLOSED("pr_closed"),
    PR_MERGED("pr_merged"),
    PR_REVIEWED("pr_reviewed"),
    PR_COLLABORATED("pr_collaborated"),
    ISSUE_ASSIGNED("issue_assigned"),
    COMMENT_CREATED("comment_created"),
    COMMIT_CREATED("commit_created");

    private final String slug;

    ActivityType(String slug) {
        this.slug = slug;
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    @JsonCreator
    public static ActivityType fromSlug(String slug) {
        for (ActivityType type : values()) {
            if (type.slug.equals(slug)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown activity type: " + slug);
    }
}
