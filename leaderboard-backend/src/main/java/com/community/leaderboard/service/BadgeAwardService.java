package com.community.leaderboard.service;

import com.community.leaderboard.achievement.BadgeRule;
import com.community.leaderboard.dto.ActivityTallyDTO;
import com.community.leaderboard.dto.BadgeRunResultDTO;
import com.community.leaderboard.entity.ContributorBadge;
import com.community.leaderboard.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Badge awarding: evaluates every registered {@link BadgeRule} and stores new awards.
 * <p>
 * Candidates are regenerated from scratch on every run and written with insert-if-absent,
 * so existing awards are never re-dated and a repeated run awards nothing new.
 */
@Service
public class BadgeAwardService {

    private static final Logger log = LoggerFactory.getLogger(BadgeAwardService.class);

    private final List<BadgeRule> rules;
    private final RecordStore recordStore;
    private final BadgeEvaluator badgeEvaluator;

    public BadgeAwardService(List<BadgeRule> rules, RecordStore recordStore, BadgeEvaluator badgeEvaluator) {
        this.rules = rules;
        this.recordStore = recordStore;
        this.badgeEvaluator = badgeEvaluator;
    }

    public List<BadgeRunResultDTO> awardAll() {
        log.info("Badge awarding started for {} badges.", rules.size());
        List<BadgeRunResultDTO> results = new ArrayList<>();
        int totalAwarded = 0;

        for (BadgeRule rule : rules) {
            BadgeRunResultDTO result = award(rule);
            totalAwarded += result.getAwarded();
            results.add(result);
        }

        log.info("Badge awarding finished. Awarded {} new badges.", totalAwarded);
        return results;
    }

    public BadgeRunResultDTO award(BadgeRule rule) {
        long startTime = System.currentTimeMillis();
        String badge = rule.getBadgeSlug();

        List<ActivityTallyDTO> tallies = recordStore.tallyActivities(rule.getActivityType());
        List<ContributorBadge> candidates = badgeEvaluator.evaluate(rule, tallies);

        if (candidates.isEmpty()) {
            log.debug("Badge {} has no candidates ({} contributors with {})", badge, tallies.size(),
                    rule.getActivityType().getSlug());
            return new BadgeRunResultDTO(badge, tallies.size(), 0, 0);
        }

        int awarded = recordStore.awardContributorBadges(candidates);
        log.info("Badge {}: {} candidates, {} newly awarded, took {} ms", badge, candidates.size(), awarded,
                System.currentTimeMillis() - startTime);
        return new BadgeRunResultDTO(badge, tallies.size(), candidates.size(), awarded);
    }
}
