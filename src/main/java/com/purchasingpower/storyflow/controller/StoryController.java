package com.purchasingpower.storyflow.controller;

import com.purchasingpower.storyflow.model.dto.StatisticsResponse;
import com.purchasingpower.storyflow.model.dto.StoryRequest;
import com.purchasingpower.storyflow.model.dto.StoryRunResponse;
import com.purchasingpower.storyflow.service.StoryGenerationService;
import com.purchasingpower.storyflow.service.WorkflowStreamService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.RejectedExecutionException;

/**
 * REST controller for story runs.
 *
 * <p>Runs execute asynchronously: {@code POST} returns 202 Accepted with a run id, progress is
 * available by polling {@code GET /{runId}} or by subscribing to {@code GET /{runId}/stream}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/stories")
@RequiredArgsConstructor
public class StoryController {

    private final StoryGenerationService storyService;
    private final WorkflowStreamService streamService;

    @PostMapping
    public ResponseEntity<StoryRunResponse> submit(@Valid @RequestBody StoryRequest request) {
        try {
            String runId = storyService.submit(request.toRequirements(), request.getStrategy());
            return ResponseEntity.accepted().body(StoryRunResponse.accepted(runId));

        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Story run rejected, executor saturated: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(StoryRunResponse.error("Too many story runs in progress, try again later"));
        } catch (Exception e) {
            log.error("Failed to submit story run", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(StoryRunResponse.error(e.getMessage()));
        }
    }

    @GetMapping("/{runId}")
    public ResponseEntity<StoryRunResponse> getRun(@PathVariable String runId) {
        try {
            return storyService.getRun(runId)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (Exception e) {
            log.error("Failed to read story run {}", runId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(StoryRunResponse.error(e.getMessage()));
        }
    }

    /**
     * Stream run progress via Server-Sent Events. Events emitted before the client connects are
     * replayed.
     */
    @GetMapping(value = "/{runId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String runId) {
        log.info("📡 Client connected to story stream: {}", runId);
        return streamService.createStream(runId);
    }

    @GetMapping("/statistics")
    public ResponseEntity<StatisticsResponse> statistics() {
        return ResponseEntity.ok(storyService.statistics());
    }
}
