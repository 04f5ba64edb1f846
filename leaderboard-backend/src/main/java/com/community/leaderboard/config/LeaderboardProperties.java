package com.community.leaderboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code leaderboard.*} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "leaderboard")
public class LeaderboardProperties {

    public static final int DEFAULT_BATCH_SIZE = 1000;

    /**
     * Maximum number of rows per bulk write statement.
     */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Usernames always treated as bots, in addition to "*[bot]" handles.
     */
    private List<String> botUsernames = new ArrayList<>();

    /**
     * Cron expression of the scheduled build; "-" disables it.
     */
    private String buildCron = "-";

    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    public void setBatchSize(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("leaderboard.batch-size must be positive, got " + batchSize);
        }
        this.batchSize = batchSize;
    }
}
