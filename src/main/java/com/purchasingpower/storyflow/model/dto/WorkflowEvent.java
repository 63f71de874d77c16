package com.purchasingpower.storyflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import com.purchasingpower.storyflow.workflow.WorkflowRunSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server-Sent Event (SSE) payload for story run progress.
 *
 * Example:
 * <pre>
 * WorkflowEvent event = WorkflowEvent.builder()
 *     .runId("run-123")
 *     .status(WorkflowStatus.RUNNING)
 *     .step("content_generation")
 *     .message("▶️ content_generation")
 *     .progress(0.5)
 *     .build();
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowEvent {

    private String runId;

    private WorkflowStatus status;

    private WorkflowStage stage;

    /**
     * Step executing when the event was emitted.
     */
    private String step;

    private String message;

    /**
     * Progress fraction (0.0 to 1.0).
     */
    private Double progress;

    private String error;

    /**
     * Additional payload, e.g. final quality on completion.
     */
    private Object metadata;

    public static WorkflowEvent fromSnapshot(WorkflowRunSnapshot snapshot) {
        String message = snapshot.getCurrentStep() != null
                ? "▶️ Running " + snapshot.getCurrentStep()
                : "📍 " + snapshot.getStage();
        return WorkflowEvent.builder()
                .runId(snapshot.getRunId())
                .status(snapshot.getStatus())
                .stage(snapshot.getStage())
                .step(snapshot.getCurrentStep())
                .message(message)
                .progress(snapshot.getProgress())
                .error(snapshot.getLastError())
                .build();
    }

    public static WorkflowEvent completed(String runId, String message, Object metadata) {
        return WorkflowEvent.builder()
                .runId(runId)
                .status(WorkflowStatus.COMPLETED)
                .stage(WorkflowStage.FINALIZATION)
                .message(message)
                .progress(1.0)
                .metadata(metadata)
                .build();
    }

    public static WorkflowEvent failed(String runId, String error) {
        return WorkflowEvent.builder()
                .runId(runId)
                .status(WorkflowStatus.FAILED)
                .error(error)
                .message("❌ Story run failed: " + error)
                .build();
    }
}
