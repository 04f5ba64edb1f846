package com.community.leaderboard.controller;

import com.community.leaderboard.dto.*;
import com.community.leaderboard.service.ActivityIngestionService;
import com.community.leaderboard.service.DefinitionService;
import com.community.leaderboard.service.PipelineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private final DefinitionService definitionService;
    private final ActivityIngestionService activityIngestionService;
    private final PipelineService pipelineService;

    public PipelineController(DefinitionService definitionService,
                              ActivityIngestionService activityIngestionService,
                              PipelineService pipelineService) {
        this.definitionService = definitionService;
        this.activityIngestionService = activityIngestionService;
        this.pipelineService = pipelineService;
    }

    /**
     * POST /api/pipeline/prepare
     * Seeds activity, aggregate and badge definitions.
     */
    @PostMapping("/prepare")
    public ResponseEntity<CommonResponse<PrepareResultDTO>> prepare() {
        return ResponseEntity.ok(CommonResponse.success(definitionService.prepare()));
    }

    /**
     * POST /api/pipeline/activities
     * Ingests a list of activities; unseen contributors are created.
     */
    @PostMapping("/activities")
    public ResponseEntity<CommonResponse<IngestResultDTO>> ingest(@RequestBody List<ActivityDTO> activities) {
        IngestResultDTO result = activityIngestionService.ingest(activities.stream()
                .map(ActivityDTO::toEntity)
                .collect(Collectors.toList()));
        return ResponseEntity.ok(CommonResponse.success(result));
    }

    /**
     * POST /api/pipeline/build
     * Recomputes aggregates and awards badges. 423 while another build runs.
     */
    @PostMapping("/build")
    public ResponseEntity<CommonResponse<PipelineRunDTO>> build() {
        return ResponseEntity.ok(CommonResponse.success(pipelineService.build()));
    }
}
