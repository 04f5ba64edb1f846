package com.community.leaderboard;

import com.community.leaderboard.config.LeaderboardProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LeaderboardProperties.class)
public class LeaderboardBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaderboardBackendApplication.class, args);
    }
}
