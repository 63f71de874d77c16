package com.purchasingpower.storyflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.storyflow.model.WorkflowStage;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import com.purchasingpower.storyflow.model.dto.WorkflowEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Workflow Stream Service Tests")
class WorkflowStreamServiceTest {

    private final WorkflowStreamService service = new WorkflowStreamService(new ObjectMapper());

    @Test
    @DisplayName("Should buffer events until a client connects")
    void testSendUpdate_ShouldBufferWithoutSubscriber() {
        // Given
        service.sendUpdate("run-1", progress("run-1", "requirements_analysis", 0.0));
        service.sendUpdate("run-1", progress("run-1", "strategy_selection", 1.0 / 6));

        // When
        List<WorkflowEvent> buffered = service.bufferedEvents("run-1");

        // Then
        assertEquals(2, buffered.size());
        assertEquals("strategy_selection", buffered.get(1).getStep());
        assertFalse(service.hasActiveStream("run-1"));
    }

    @Test
    @DisplayName("Buffer should stop growing at its limit")
    void testSendUpdate_ShouldCapBuffer() {
        for (int i = 0; i < WorkflowStreamService.MAX_BUFFERED_EVENTS + 20; i++) {
            service.sendUpdate("run-2", progress("run-2", "step-" + i, 0.0));
        }

        List<WorkflowEvent> buffered = service.bufferedEvents("run-2");

        assertEquals(WorkflowStreamService.MAX_BUFFERED_EVENTS, buffered.size());
        assertEquals("step-0", buffered.get(0).getStep());
    }

    @Test
    @DisplayName("Connecting should drain the buffer and keep a running stream open")
    void testCreateStream_ShouldReplayBufferedEvents() {
        service.sendUpdate("run-3", progress("run-3", "content_generation", 0.5));

        SseEmitter emitter = service.createStream("run-3");

        assertNotNull(emitter);
        assertTrue(service.hasActiveStream("run-3"));
        assertEquals(1, service.getActiveStreamCount());
        assertTrue(service.bufferedEvents("run-3").isEmpty());
    }

    @Test
    @DisplayName("Connecting after the run finished should close the stream at once")
    void testCreateStream_ShouldCloseAfterTerminalEvent() {
        service.sendUpdate("run-4", progress("run-4", "enhancement", 5.0 / 6));
        service.complete("run-4", "done", null);

        List<WorkflowEvent> buffered = service.bufferedEvents("run-4");
        assertEquals(WorkflowStatus.COMPLETED, buffered.get(buffered.size() - 1).getStatus());
        assertEquals(1.0, buffered.get(buffered.size() - 1).getProgress());

        service.createStream("run-4");

        assertFalse(service.hasActiveStream("run-4"));
        assertTrue(service.bufferedEvents("run-4").isEmpty());
    }

    @Test
    @DisplayName("Failure without a subscriber should be buffered as a failed event")
    void testFail_ShouldBufferFailedEvent() {
        service.fail("run-5", "Required step 'content_generation' failed");

        List<WorkflowEvent> buffered = service.bufferedEvents("run-5");

        assertEquals(1, buffered.size());
        assertEquals(WorkflowStatus.FAILED, buffered.get(0).getStatus());
        assertTrue(buffered.get(0).getMessage().contains("content_generation"));
    }

    @Test
    @DisplayName("Discard should drop buffered events")
    void testDiscard_ShouldClearBuffer() {
        service.sendUpdate("run-6", progress("run-6", "requirements_analysis", 0.0));

        service.discard("run-6");

        assertTrue(service.bufferedEvents("run-6").isEmpty());
    }

    private static WorkflowEvent progress(String runId, String step, double progress) {
        return WorkflowEvent.builder()
                .runId(runId)
                .status(WorkflowStatus.RUNNING)
                .stage(WorkflowStage.CONTENT_GENERATION)
                .step(step)
                .progress(progress)
                .build();
    }
}
