package com.community.leaderboard.service;

import com.community.leaderboard.dto.AggregateRunResultDTO;
import com.community.leaderboard.dto.TurnAroundSampleDTO;
import com.community.leaderboard.dto.TurnAroundSummaryDTO;
import com.community.leaderboard.entity.ContributorAggregate;
import com.community.leaderboard.entity.ContributorAggregateDefinition;
import com.community.leaderboard.entity.GlobalAggregate;
import com.community.leaderboard.model.AggregateValue;
import com.community.leaderboard.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Recomputes derived statistics from the activity log and stores them.
 * Values are replaced wholesale; nothing is written when there is no input.
 */
@Service
public class AggregateCalculationService {

    private static final Logger log = LoggerFactory.getLogger(AggregateCalculationService.class);

    public static final String PR_AVG_TAT = "pr_avg_tat";
    public static final String PR_AVG_TAT_NAME = "PR Avg. Turn-Around Time";
    public static final String PR_AVG_TAT_DESCRIPTION = "Average time taken to get a PR merged since it has been opened";

    private final RecordStore recordStore;
    private final AggregateAlgorithm aggregateAlgorithm;

    public AggregateCalculationService(RecordStore recordStore, AggregateAlgorithm aggregateAlgorithm) {
        this.recordStore = recordStore;
        this.aggregateAlgorithm = aggregateAlgorithm;
    }

    public static GlobalAggregate prAverageTurnAroundDefinition() {
        return new GlobalAggregate(PR_AVG_TAT, PR_AVG_TAT_NAME, PR_AVG_TAT_DESCRIPTION, null);
    }

    public static ContributorAggregateDefinition prAverageTurnAroundContributorDefinition() {
        return new ContributorAggregateDefinition(PR_AVG_TAT, PR_AVG_TAT_NAME, PR_AVG_TAT_DESCRIPTION);
    }

    public List<AggregateRunResultDTO> calculateAll() {
        List<AggregateRunResultDTO> results = new ArrayList<>();
        results.add(calculatePrAverageTurnAround());
        return results;
    }

    /**
     * Average opened-to-merged time of pull requests, globally and per contributor.
     */
    public AggregateRunResultDTO calculatePrAverageTurnAround() {
        List<TurnAroundSampleDTO> samples = recordStore.findTurnAroundSamples();
        TurnAroundSummaryDTO summary = aggregateAlgorithm.averageTurnAround(samples);

        if (summary.getSkippedSamples() > 0) {
            log.warn("Skipped {} of {} PR turn-around samples with a non-numeric value",
                    summary.getSkippedSamples(), samples.size());
        }

        List<ContributorAggregate> contributorAggregates = new ArrayList<>();
        summary.getContributorMeans().forEach((contributor, mean) ->
                contributorAggregates.add(new ContributorAggregate(PR_AVG_TAT, contributor, AggregateValue.duration(mean))));

        int contributorsUpdated = 0;
        if (!contributorAggregates.isEmpty()) {
            // contributor_aggregate references its definition, which may not be seeded yet
            recordStore.upsertContributorAggregateDefinitions(List.of(prAverageTurnAroundContributorDefinition()));
            contributorsUpdated = recordStore.upsertContributorAggregates(contributorAggregates);
            log.info("Updated PR avg TAT for {} contributors", contributorAggregates.size());
        }

        if (summary.getGlobalMean() != null) {
            recordStore.upsertGlobalAggregates(List.of(new GlobalAggregate(PR_AVG_TAT, PR_AVG_TAT_NAME,
                    PR_AVG_TAT_DESCRIPTION, AggregateValue.duration(summary.getGlobalMean()))));
            log.info("Updated global PR avg TAT: {}ms", summary.getGlobalMean());
        } else {
            log.info("No merged PR carries a turn-around time, PR avg TAT left unchanged");
        }

        return new AggregateRunResultDTO(PR_AVG_TAT, samples.size(), summary.getSkippedSamples(),
                contributorsUpdated, summary.getGlobalMean());
    }
}
