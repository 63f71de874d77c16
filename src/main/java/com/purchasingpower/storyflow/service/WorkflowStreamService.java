package com.purchasingpower.storyflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.storyflow.model.WorkflowStatus;
import com.purchasingpower.storyflow.model.dto.WorkflowEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-Sent Event streams of story run progress, keyed by run id.
 *
 * <p>A run usually starts before the client subscribes, so events published with no emitter
 * attached are buffered and replayed on connect. A terminal event that arrives before the
 * client connects is replayed and the stream is closed immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowStreamService {

    static final String EVENT_NAME = "story-update";

    /**
     * SSE connection timeout (5 minutes).
     */
    private static final long SSE_TIMEOUT_MS = 5 * 60 * 1000;

    /**
     * Max buffered events per run.
     */
    static final int MAX_BUFFERED_EVENTS = 100;

    private final ObjectMapper objectMapper;

    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();

    private final Map<String, List<WorkflowEvent>> eventBuffer = new ConcurrentHashMap<>();

    public SseEmitter createStream(String runId) {
        log.info("📡 Creating SSE stream for run: {}", runId);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);

        emitter.onCompletion(() -> {
            log.debug("SSE stream completed for run: {}", runId);
            removeEmitter(runId);
        });
        emitter.onTimeout(() -> {
            log.warn("⏱️ SSE stream timed out for run: {}", runId);
            removeEmitter(runId);
        });
        emitter.onError(error -> {
            log.warn("⚠️ SSE stream error for run {}: {}", runId, error.getMessage());
            removeEmitter(runId);
        });

        List<WorkflowEvent> buffered;
        synchronized (this) {
            emitters.put(runId, emitter);
            buffered = eventBuffer.remove(runId);
        }

        try {
            send(emitter, WorkflowEvent.builder()
                    .runId(runId)
                    .status(WorkflowStatus.RUNNING)
                    .message("🔗 Connected to story stream")
                    .build());

            if (buffered != null && !buffered.isEmpty()) {
                log.info("🔄 Replaying {} buffered events for run: {}", buffered.size(), runId);
                for (WorkflowEvent event : buffered) {
                    send(emitter, event);
                }
                WorkflowEvent last = buffered.get(buffered.size() - 1);
                if (last.getStatus() != null && last.getStatus().isTerminal()) {
                    emitter.complete();
                    removeEmitter(runId);
                }
            }
        } catch (IOException e) {
            log.warn("⚠️ Failed to send SSE events for run {} during stream creation: {}", runId, e.getMessage());
            removeEmitter(runId);
        }

        return emitter;
    }

    /**
     * Push an event to the run's stream, or buffer it until a client connects.
     */
    public void sendUpdate(String runId, WorkflowEvent event) {
        SseEmitter emitter;
        synchronized (this) {
            emitter = emitters.get(runId);
            if (emitter == null) {
                List<WorkflowEvent> buffer = eventBuffer.computeIfAbsent(runId, k -> new ArrayList<>());
                if (buffer.size() < MAX_BUFFERED_EVENTS) {
                    buffer.add(event);
                    log.debug("📦 Buffered SSE event (total: {}): runId={}, step={}",
                            buffer.size(), runId, event.getStep());
                } else {
                    log.warn("⚠️ Event buffer full for run: {} (dropping event)", runId);
                }
                return;
            }
        }

        try {
            send(emitter, event);
            log.debug("📤 Sent SSE update: runId={}, status={}, step={}",
                    runId, event.getStatus(), event.getStep());
        } catch (IOException e) {
            log.warn("⚠️ Failed to send SSE update for run {}: {}", runId, e.getMessage());
            removeEmitter(runId);
        }
    }

    public void complete(String runId, String message, Object metadata) {
        sendUpdate(runId, WorkflowEvent.completed(runId, message, metadata));
        SseEmitter emitter = emitters.remove(runId);
        if (emitter != null) {
            emitter.complete();
        }
        log.info("✅ Story stream completed: {}", runId);
    }

    public void fail(String runId, String error) {
        sendUpdate(runId, WorkflowEvent.failed(runId, error));
        SseEmitter emitter = emitters.remove(runId);
        if (emitter != null) {
            emitter.complete();
        }
        log.info("❌ Story stream closed after failure: {}", runId);
    }

    /**
     * Events waiting for a client; empty when none are buffered.
     */
    public List<WorkflowEvent> bufferedEvents(String runId) {
        List<WorkflowEvent> buffer = eventBuffer.get(runId);
        return buffer == null ? List.of() : List.copyOf(buffer);
    }

    /**
     * Drop buffered events of a run nobody subscribed to.
     */
    public void discard(String runId) {
        eventBuffer.remove(runId);
    }

    public boolean hasActiveStream(String runId) {
        return emitters.containsKey(runId);
    }

    public int getActiveStreamCount() {
        return emitters.size();
    }

    private void send(SseEmitter emitter, WorkflowEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(EVENT_NAME)
                .data(objectMapper.writeValueAsString(event)));
    }

    private void removeEmitter(String runId) {
        emitters.remove(runId);
        eventBuffer.remove(runId);
    }
}
