package com.community.leaderboard.store;

/**
 * What a bulk upsert does when a submitted row collides with an existing identity.
 */
public enum ConflictPolicy {

    /**
     * Overwrite the declared mutable columns with the submitted values.
     */
    UPDATE,

    /**
     * Keep the stored row; the submitted row is a silent no-op.
     */
    IGNORE
}
