package com.purchasingpower.storyflow.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.storyflow.model.StoryResult;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import com.purchasingpower.storyflow.workflow.WorkflowRunSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for story run status.
 *
 * <p>While a run is in flight the progress fields come from the runner's snapshot; once it
 * completes {@link #result} carries the assembled story.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StoryRunResponse {
    private boolean success;
    private String runId;
    private WorkflowStatus status;
    private WorkflowStage stage;
    private String currentStep;
    private Double progress;
    private List<String> completedSteps;
    private List<String> failedSteps;
    private String message;
    private String error;
    private StoryResult result;

    public static StoryRunResponse accepted(String runId) {
        return StoryRunResponse.builder()
                .success(true)
                .runId(runId)
                .status(WorkflowStatus.PENDING)
                .progress(0.0)
                .message("🚀 Story run accepted")
                .build();
    }

    public static StoryRunResponse fromSnapshot(WorkflowRunSnapshot snapshot) {
        return StoryRunResponse.builder()
                .success(true)
                .runId(snapshot.getRunId())
                .status(snapshot.getStatus())
                .stage(snapshot.getStage())
                .currentStep(snapshot.getCurrentStep())
                .progress(snapshot.getProgress())
                .completedSteps(snapshot.getCompletedSteps())
                .failedSteps(snapshot.getFailedSteps())
                .error(snapshot.getLastError())
                .build();
    }

    public static StoryRunResponse completed(StoryResult result) {
        return StoryRunResponse.builder()
                .success(true)
                .runId(result.getRunId())
                .status(WorkflowStatus.COMPLETED)
                .stage(WorkflowStage.FINALIZATION)
                .progress(1.0)
                .completedSteps(result.getCompletedSteps())
                .failedSteps(result.getFailedSteps())
                .message("✅ Story completed")
                .result(result)
                .build();
    }

    public static StoryRunResponse failed(String runId, String error) {
        return StoryRunResponse.builder()
                .success(false)
                .runId(runId)
                .status(WorkflowStatus.FAILED)
                .error(error)
                .build();
    }

    public static StoryRunResponse error(String error) {
        return StoryRunResponse.builder()
                .success(false)
                .error(error)
                .build();
    }
}
