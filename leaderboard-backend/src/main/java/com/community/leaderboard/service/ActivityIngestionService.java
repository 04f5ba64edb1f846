package com.community.leaderboard.service;

import com.community.leaderboard.config.LeaderboardProperties;
import com.community.leaderboard.dto.IngestResultDTO;
import com.community.leaderboard.entity.Activity;
import com.community.leaderboard.entity.Contributor;
import com.community.leaderboard.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persists a batch of already-fetched activities: registers unseen contributors first,
 * then upserts the activities, then flags bot accounts.
 */
@Service
public class ActivityIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ActivityIngestionService.class);

    static final String BOT_SUFFIX = "[bot]";

    private final RecordStore recordStore;
    private final LeaderboardProperties properties;

    public ActivityIngestionService(RecordStore recordStore, LeaderboardProperties properties) {
        this.recordStore = recordStore;
        this.properties = properties;
    }

    public IngestResultDTO ingest(List<Activity> activities) {
        if (activities == null || activities.isEmpty()) {
            log.info("No activities to ingest");
            return new IngestResultDTO(0, 0, 0, 0);
        }
        for (Activity activity : activities) {
            validate(activity);
        }

        Set<String> contributors = new LinkedHashSet<>();
        activities.forEach(a -> contributors.add(a.getContributor()));

        int newContributors = recordStore.addContributors(new ArrayList<>(contributors));
        int activitiesAffected = recordStore.upsertActivities(activities);

        List<String> bots = new ArrayList<>();
        for (String contributor : contributors) {
            if (isBot(contributor)) {
                bots.add(contributor);
            }
        }
        int botsUpdated = recordStore.updateContributorRoles(bots, Contributor.ROLE_BOT);

        log.info("Ingested {} activities from {} contributors ({} new contributors, {} bots)",
                activities.size(), contributors.size(), newContributors, bots.size());
        return new IngestResultDTO(activities.size(), newContributors, activitiesAffected, botsUpdated);
    }

    boolean isBot(String username) {
        return username.endsWith(BOT_SUFFIX) || properties.getBotUsernames().contains(username);
    }

    private static void validate(Activity activity) {
        if (activity.getSlug() == null || activity.getSlug().isBlank()) {
            throw new IllegalArgumentException("Activity slug is required");
        }
        if (activity.getContributor() == null || activity.getContributor().isBlank()) {
            throw new IllegalArgumentException("Activity " + activity.getSlug() + " has no contributor");
        }
        if (activity.getActivityType() == null) {
            throw new IllegalArgumentException("Activity " + activity.getSlug() + " has no activity type");
        }
        if (activity.getOccurredAt() == null) {
            throw new IllegalArgumentException("Activity " + activity.getSlug() + " has no occurrence time");
        }
    }
}
