package com.argus.app.web;

import com.argus.activity.stream.ActivityStreamController;
import com.argus.activity.stream.StreamSnapshot;
import com.argus.app.stream.ActivityStreamRegistry;
import jakarta.annotation.PreDestroy;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Viewer API: live activity of one session, as snapshots or as an SSE stream.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}/activity")
public class ActivityStreamEndpoint {

    private static final long SSE_TIMEOUT_MS = 300_000L;

    private static final AtomicInteger SENDER_SEQ = new AtomicInteger();

    private final ActivityStreamRegistry viewers;
    private final ExecutorService sendExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "argus-sse-" + SENDER_SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public ActivityStreamEndpoint(ActivityStreamRegistry viewers) {
        this.viewers = viewers;
    }

    @GetMapping
    public StreamSnapshot snapshot(@PathVariable String sessionId) {
        return viewers.open(sessionId).getSnapshot();
    }

    @PostMapping("/reconnect")
    public ResponseEntity<StreamSnapshot> reconnect(@PathVariable String sessionId) {
        return viewers.reconnect(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        return viewers.close(sessionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Push every snapshot change as an SSE {@code snapshot} event, starting with the current one.
     * Writes happen on the send executor, never on the thread that changed the snapshot.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String sessionId) {
        ActivityStreamController controller = viewers.open(sessionId);
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        SnapshotRelay relay = new SnapshotRelay(snapshot -> emitter.send(SseEmitter.event()
                .name("snapshot")
                .data(snapshot, MediaType.APPLICATION_JSON)), sendExecutor);

        emitter.onCompletion(relay::close);
        emitter.onTimeout(relay::close);
        emitter.onError(e -> relay.close());
        relay.attach(controller);
        return emitter;
    }

    @PreDestroy
    public void shutdown() {
        sendExecutor.shutdownNow();
    }
}
