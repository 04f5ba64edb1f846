package com.community.leaderboard.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether a pipeline build is running. At most one build runs at a time.
 */
@Component
public class PipelineStatusManager {

    private static final Logger log = LoggerFactory.getLogger(PipelineStatusManager.class);

    private final AtomicBoolean buildInProgress = new AtomicBoolean(false);

    /**
     * Marks a build as started.
     *
     * @return false when another build already holds the flag
     */
    public boolean tryStart() {
        boolean started = buildInProgress.compareAndSet(false, true);
        if (started) {
            log.info("Pipeline build status: running");
        }
        return started;
    }

    public void finish() {
        buildInProgress.set(false);
        log.info("Pipeline build status: idle");
    }

    public boolean isBuildInProgress() {
        return buildInProgress.get();
    }
}
