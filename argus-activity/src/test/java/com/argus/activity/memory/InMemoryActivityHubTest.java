package com.argus.activity.memory;

import com.argus.activity.model.ActivityEventType;
import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.model.LiveSession;
import com.argus.activity.model.SessionStatus;
import com.argus.activity.model.SessionType;
import com.argus.activity.model.SessionUpdate;
import com.argus.activity.provider.ActivityWriteException;
import com.argus.activity.provider.SubscriptionHandle;
import com.argus.activity.provider.SubscriptionStatus;
import com.argus.activity.stream.ActivityStreamController;
import com.argus.activity.stream.ConnectionStatus;
import com.argus.activity.stream.ReconnectPolicy;
import com.argus.activity.support.ManualTimers;
import com.argus.activity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryActivityHubTest {

    private MutableClock clock;
    private InMemoryActivityHub hub;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        hub = new InMemoryActivityHub(clock);
    }

    private LiveSession newSession(String projectId) {
        return hub.createSession(LiveSession.builder()
                .projectId(projectId)
                .sessionType(SessionType.DISCOVERY)
                .build());
    }

    private ActivityLogEntry append(LiveSession session, String title) {
        return hub.appendActivity(ActivityLogEntry.builder()
                .projectId(session.getProjectId())
                .sessionId(session.getId())
                .activityType(session.getSessionType())
                .eventType(ActivityEventType.STEP)
                .title(title)
                .build());
    }

    // ── Writes ────────────────────────────────────────────────────

    @Nested
    class Writes {

        @Test
        void createSession_assignsIdStatusAndStart() {
            LiveSession session = newSession("p1");

            assertNotNull(session.getId());
            assertEquals(SessionStatus.ACTIVE, session.getStatus());
            assertEquals(clock.instant(), session.getStartedAt());
            assertNotNull(session.getMetadata());
        }

        @Test
        void createSession_withoutProject_fails() {
            ActivityWriteException error = assertThrows(ActivityWriteException.class,
                    () -> hub.createSession(LiveSession.builder().sessionType(SessionType.TEST_RUN).build()));
            assertEquals("createSession", error.getOperation());
        }

        @Test
        void updateSession_unknownId_fails() {
            assertThrows(ActivityWriteException.class,
                    () -> hub.updateSession("missing", SessionUpdate.builder().currentStep("x").build()));
        }

        @Test
        void updateSession_appliesOnlyGivenFields() {
            LiveSession session = newSession("p1");
            hub.updateSession(session.getId(), SessionUpdate.builder().currentStep("A").completedSteps(1).build());

            LiveSession updated = hub.updateSession(session.getId(),
                    SessionUpdate.builder().lastScreenshotUrl("u").build());

            assertEquals("A", updated.getCurrentStep());
            assertEquals(1, updated.getCompletedSteps());
            assertEquals("u", updated.getLastScreenshotUrl());
        }

        @Test
        void appendActivity_withoutTitle_fails() {
            LiveSession session = newSession("p1");

            assertThrows(ActivityWriteException.class, () -> append(session, " "));
        }

        @Test
        void backlog_isOrderedByCreation() {
            LiveSession session = newSession("p1");
            append(session, "one");
            clock.advanceMillis(10);
            append(session, "two");

            List<ActivityLogEntry> backlog = hub.fetchBacklog(session.getId());

            assertEquals(List.of("one", "two"), backlog.stream().map(ActivityLogEntry::getTitle).toList());
            assertNotEquals(backlog.get(0).getId(), backlog.get(1).getId());
            assertTrue(hub.fetchBacklog("unknown").isEmpty());
        }
    }

    // ── Push ──────────────────────────────────────────────────────

    @Nested
    class Push {

        @Test
        void subscribe_acksAndReceivesNewEntries() {
            LiveSession session = newSession("p1");
            List<SubscriptionStatus> statuses = new ArrayList<>();
            List<ActivityLogEntry> received = new ArrayList<>();

            hub.subscribe("activity-" + session.getId(), received::add, statuses::add);
            ActivityLogEntry stored = append(session, "one");

            assertEquals(List.of(SubscriptionStatus.SUBSCRIBED), statuses);
            assertEquals(List.of(stored), received);
        }

        @Test
        void unsubscribe_stopsDeliveryWithoutClosedSignal() {
            LiveSession session = newSession("p1");
            List<SubscriptionStatus> statuses = new ArrayList<>();
            List<ActivityLogEntry> received = new ArrayList<>();
            SubscriptionHandle handle = hub.subscribe("activity-" + session.getId(), received::add, statuses::add);

            hub.unsubscribe(handle);
            append(session, "one");

            assertTrue(received.isEmpty());
            assertEquals(List.of(SubscriptionStatus.SUBSCRIBED), statuses);
            assertEquals(0, hub.subscriberCount(handle.topic()));
        }

        @Test
        void entriesOfOtherSessions_areNotDelivered() {
            LiveSession mine = newSession("p1");
            LiveSession other = newSession("p1");
            List<ActivityLogEntry> received = new ArrayList<>();
            hub.subscribe("activity-" + mine.getId(), received::add, s -> { });

            append(other, "elsewhere");

            assertTrue(received.isEmpty());
        }

        @Test
        void closeAndFailTopic_signalSubscribers() {
            List<SubscriptionStatus> statuses = new ArrayList<>();
            hub.subscribe("activity-a", e -> { }, statuses::add);
            hub.subscribe("activity-b", e -> { }, statuses::add);

            assertEquals(1, hub.closeTopic("activity-a"));
            assertEquals(1, hub.failTopic("activity-b", SubscriptionStatus.TIMED_OUT));
            assertEquals(0, hub.closeTopic("activity-a"));

            assertEquals(List.of(SubscriptionStatus.SUBSCRIBED, SubscriptionStatus.SUBSCRIBED,
                    SubscriptionStatus.CLOSED, SubscriptionStatus.TIMED_OUT), statuses);
            assertThrows(IllegalArgumentException.class,
                    () -> hub.failTopic("activity-a", SubscriptionStatus.CLOSED));
        }

        @Test
        void subscribe_rejectsForeignTopic() {
            assertThrows(IllegalArgumentException.class, () -> hub.subscribe("chat-1", e -> { }, s -> { }));
        }

        @Test
        void controllerOverHub_seesBacklogAndLiveEntriesAndRecoversFromFailure() {
            ManualTimers timers = new ManualTimers(clock);
            LiveSession session = newSession("p1");
            append(session, "before");
            ActivityStreamController viewer = new ActivityStreamController(hub, hub, timers, clock,
                    ReconnectPolicy.DEFAULT, () -> 0.5);

            viewer.open(session.getId());
            assertTrue(viewer.getSnapshot().isConnected());

            append(session, "live");
            hub.failTopic("activity-" + session.getId(), SubscriptionStatus.CHANNEL_ERROR);
            assertEquals(ConnectionStatus.RECONNECTING, viewer.getSnapshot().connectionStatus());

            timers.advance(1_000);

            assertTrue(viewer.getSnapshot().isConnected());
            assertEquals(List.of("before", "live"),
                    viewer.entries().stream().map(ActivityLogEntry::getTitle).toList());
            viewer.close();
            assertEquals(0, hub.subscriberCount("activity-" + session.getId()));
        }
    }

    // ── Queries and maintenance ───────────────────────────────────

    @Nested
    class Maintenance {

        @Test
        void listActiveSessions_newestFirstAndScopedToProject() {
            LiveSession older = newSession("p1");
            clock.advanceMillis(1_000);
            LiveSession newer = newSession("p1");
            newSession("p2");
            LiveSession done = newSession("p1");
            hub.updateSession(done.getId(), SessionUpdate.builder().status(SessionStatus.COMPLETED).build());

            List<String> ids = hub.listActiveSessions("p1").stream().map(LiveSession::getId).toList();

            assertEquals(List.of(newer.getId(), older.getId()), ids);
        }

        @Test
        void failStaleSessions_failsOnlyOldActiveSessions() {
            LiveSession stale = newSession("p1");
            clock.advanceMillis(Duration.ofMinutes(9).toMillis());
            LiveSession fresh = newSession("p1");
            clock.advanceMillis(Duration.ofMinutes(2).toMillis());

            int failed = hub.failStaleSessions(InMemoryActivityHub.DEFAULT_STALE_SESSION_AGE);

            assertEquals(1, failed);
            LiveSession after = hub.getSession(stale.getId()).orElseThrow();
            assertEquals(SessionStatus.FAILED, after.getStatus());
            assertEquals(clock.instant(), after.getCompletedAt());
            assertEquals(SessionStatus.ACTIVE, hub.getSession(fresh.getId()).orElseThrow().getStatus());
        }

        @Test
        void failStaleSessions_skipsStaleSessionsAlreadyFinished() {
            LiveSession stale = newSession("p1");
            LiveSession finished = newSession("p1");
            hub.updateSession(finished.getId(), SessionUpdate.builder().status(SessionStatus.COMPLETED).build());
            clock.advanceMillis(Duration.ofMinutes(11).toMillis());

            assertEquals(1, hub.failStaleSessions(InMemoryActivityHub.DEFAULT_STALE_SESSION_AGE));
            assertEquals(0, hub.failStaleSessions(InMemoryActivityHub.DEFAULT_STALE_SESSION_AGE));
            assertEquals(SessionStatus.COMPLETED, hub.getSession(finished.getId()).orElseThrow().getStatus());
            assertEquals(SessionStatus.FAILED, hub.getSession(stale.getId()).orElseThrow().getStatus());
        }

        @Test
        void failStaleSessions_countMatchesSessionsActuallyFailedUnderConcurrentCompletion() throws Exception {
            List<LiveSession> stale = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                stale.add(newSession("p1"));
            }
            clock.advanceMillis(Duration.ofMinutes(11).toMillis());
            SessionUpdate complete = SessionUpdate.builder().status(SessionStatus.COMPLETED).build();

            Thread completer = new Thread(() -> {
                for (LiveSession s : stale) {
                    hub.updateSession(s.getId(), complete);
                }
            });
            completer.start();
            int failed = hub.failStaleSessions(InMemoryActivityHub.DEFAULT_STALE_SESSION_AGE);
            completer.join();

            // only the sweep sets completedAt
            long stamped = stale.stream()
                    .map(s -> hub.getSession(s.getId()).orElseThrow())
                    .filter(s -> s.getCompletedAt() != null)
                    .count();
            assertEquals(stamped, failed);
        }

        @Test
        void pruneActivity_removesOnlyOldEntries() {
            LiveSession session = newSession("p1");
            append(session, "old");
            clock.advanceMillis(Duration.ofDays(8).toMillis());
            append(session, "recent");

            int removed = hub.pruneActivityOlderThan(InMemoryActivityHub.DEFAULT_ACTIVITY_RETENTION);

            assertEquals(1, removed);
            assertEquals(List.of("recent"),
                    hub.fetchBacklog(session.getId()).stream().map(ActivityLogEntry::getTitle).toList());
        }
    }
}
