package com.argus.activity.stream;

import com.argus.activity.model.ActivityLogEntry;
import com.argus.activity.provider.ActivityProviderException;
import com.argus.activity.provider.SubscriptionStatus;
import com.argus.activity.support.FakePushProvider;
import com.argus.activity.support.ManualTimers;
import com.argus.activity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.argus.activity.support.Entries.entry;
import static org.junit.jupiter.api.Assertions.*;

class ActivityStreamControllerTest {

    private MutableClock clock;
    private ManualTimers timers;
    private FakePushProvider push;
    private Map<String, List<ActivityLogEntry>> backlogs;
    private int backlogCalls;
    private ActivityStreamController controller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        timers = new ManualTimers(clock);
        push = new FakePushProvider();
        backlogs = new HashMap<>();
        backlogCalls = 0;
        controller = create(ReconnectPolicy.DEFAULT);
    }

    private ActivityStreamController create(ReconnectPolicy policy) {
        return new ActivityStreamController(push, sessionId -> {
            backlogCalls++;
            List<ActivityLogEntry> rows = backlogs.get(sessionId);
            if (rows == null) {
                throw new ActivityProviderException("backlog unavailable");
            }
            return List.copyOf(rows);
        }, timers, clock, policy, () -> 0.5);
    }

    private List<String> ids() {
        return controller.entries().stream().map(ActivityLogEntry::getId).toList();
    }

    // ── Open and close ────────────────────────────────────────────

    @Nested
    class OpenAndClose {

        @Test
        void openNull_isIdle() {
            controller.open(null);

            StreamSnapshot snapshot = controller.getSnapshot();
            assertNull(snapshot.sessionId());
            assertTrue(snapshot.entries().isEmpty());
            assertEquals(ConnectionStatus.DISCONNECTED, snapshot.connectionStatus());
            assertFalse(snapshot.isConnected());
            assertEquals(0, push.subscribeCount());
            assertEquals(0, backlogCalls);
        }

        @Test
        void open_seedsBacklogThenSubscribes() {
            backlogs.put("s1", List.of(entry("a", 1), entry("b", 2)));

            controller.open("s1");

            assertEquals(List.of("a", "b"), ids());
            assertEquals("activity-s1", push.latest().topic());
            assertEquals(ConnectionStatus.CONNECTING, controller.getSnapshot().connectionStatus());
        }

        @Test
        void backlogFailure_startsEmptyAndStillConnects() {
            controller.open("s1");

            assertTrue(controller.entries().isEmpty());
            assertEquals(1, push.subscribeCount());

            push.signal(SubscriptionStatus.SUBSCRIBED);
            assertTrue(controller.getSnapshot().isConnected());
        }

        @Test
        void openingAnotherSession_replacesEverything() {
            backlogs.put("s1", List.of(entry("a", 1)));
            backlogs.put("s2", List.of(entry("x", 1)));
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);

            controller.open("s2");

            assertEquals(List.of("x"), ids());
            assertTrue(push.handle(0).isReleased());
            assertEquals("s2", controller.getSnapshot().sessionId());
        }

        @Test
        void close_clearsBufferAndReleasesSubscription() {
            backlogs.put("s1", List.of(entry("a", 1)));
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);

            controller.close();

            StreamSnapshot snapshot = controller.getSnapshot();
            assertTrue(snapshot.entries().isEmpty());
            assertNull(snapshot.sessionId());
            assertEquals(ConnectionStatus.DISCONNECTED, snapshot.connectionStatus());
            assertEquals(0, push.activeCount());
        }
    }

    // ── Live entries ──────────────────────────────────────────────

    @Nested
    class LiveEntries {

        @Test
        void pushedEntries_appendAfterBacklog() {
            backlogs.put("s1", List.of(entry("a", 1), entry("b", 2)));
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);

            push.push(entry("c", 3));

            assertEquals(List.of("a", "b", "c"), ids());
        }

        @Test
        void pushedDuplicate_isIgnored() {
            backlogs.put("s1", List.of(entry("a", 1), entry("b", 2)));
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);

            push.push(entry("b", 2));
            push.push(entry("c", 3));
            push.push(entry("c", 3));

            assertEquals(List.of("a", "b", "c"), ids());
        }

        @Test
        void pushedEntryWithoutId_isDropped() {
            backlogs.put("s1", List.of());
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);

            push.push(entry(null, 1));

            assertTrue(controller.entries().isEmpty());
            assertTrue(controller.getSnapshot().isConnected());
        }
    }

    // ── Connection view ───────────────────────────────────────────

    @Nested
    class ConnectionView {

        @Test
        void snapshot_reflectsReconnecting() {
            backlogs.put("s1", List.of());
            controller.open("s1");
            push.signal(SubscriptionStatus.CHANNEL_ERROR);

            StreamSnapshot snapshot = controller.getSnapshot();
            assertTrue(snapshot.isReconnecting());
            assertFalse(snapshot.isConnected());
            assertEquals(1, snapshot.reconnectAttempt());
        }

        @Test
        void manualReconnect_resetsAttempt() {
            backlogs.put("s1", List.of());
            controller.open("s1");
            push.signal(SubscriptionStatus.CHANNEL_ERROR);

            controller.reconnect();
            push.signal(SubscriptionStatus.SUBSCRIBED);

            StreamSnapshot snapshot = controller.getSnapshot();
            assertTrue(snapshot.isConnected());
            assertEquals(0, snapshot.reconnectAttempt());
            assertEquals(clock.instant(), snapshot.lastHeartbeatAt());
        }

        @Test
        void listeners_seeEveryChangeUntilRemoved() {
            backlogs.put("s1", List.of());
            List<StreamSnapshot> seen = new ArrayList<>();
            Runnable remove = controller.addSnapshotListener(seen::add);

            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);
            push.push(entry("a", 1));

            assertEquals(ConnectionStatus.CONNECTED, seen.get(seen.size() - 1).connectionStatus());
            assertEquals(1, seen.get(seen.size() - 1).entries().size());

            int before = seen.size();
            remove.run();
            push.push(entry("b", 2));
            assertEquals(before, seen.size());
        }

        @Test
        void failingListener_doesNotStopUpdates() {
            backlogs.put("s1", List.of());
            controller.addSnapshotListener(s -> {
                throw new IllegalStateException("view gone");
            });

            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);
            push.push(entry("a", 1));

            assertEquals(List.of("a"), ids());
        }
    }

    // ── Backfill ──────────────────────────────────────────────────

    @Nested
    class Backfill {

        private void resumeAfterOutage() {
            backlogs.put("s1", new ArrayList<>(List.of(entry("a", 1))));
            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);
            push.signal(SubscriptionStatus.CHANNEL_ERROR);

            backlogs.get("s1").add(entry("missed", 2));

            timers.advance(1_000);
            push.signal(SubscriptionStatus.SUBSCRIBED);
        }

        private void missEntryDuringOutage() {
            resumeAfterOutage();
            timers.runDue();
        }

        @Test
        void disabled_leavesGap() {
            missEntryDuringOutage();

            assertEquals(List.of("a"), ids());
            assertEquals(1, backlogCalls);
        }

        @Test
        void enabled_mergesMissedEntriesAfterReconnect() {
            controller = create(ReconnectPolicy.DEFAULT.withBackfillOnReconnect(true));

            missEntryDuringOutage();

            assertEquals(List.of("a", "missed"), ids());
            assertEquals(2, backlogCalls);
        }

        @Test
        void enabled_firstConnectDoesNotBackfill() {
            controller = create(ReconnectPolicy.DEFAULT.withBackfillOnReconnect(true));
            backlogs.put("s1", List.of(entry("a", 1)));

            controller.open("s1");
            push.signal(SubscriptionStatus.SUBSCRIBED);
            timers.runDue();

            assertEquals(1, backlogCalls);
        }

        @Test
        void close_cancelsPendingBackfill() {
            controller = create(ReconnectPolicy.DEFAULT.withBackfillOnReconnect(true));
            resumeAfterOutage();
            assertEquals(1, timers.pendingCount("activity-backfill"));

            controller.close();

            assertTrue(timers.pendingNames().isEmpty());
            timers.runDue();
            assertEquals(1, backlogCalls);
        }

        @Test
        void reopen_cancelsPendingBackfillOfPreviousSession() {
            controller = create(ReconnectPolicy.DEFAULT.withBackfillOnReconnect(true));
            resumeAfterOutage();
            backlogs.put("s2", List.of(entry("x", 1)));

            controller.open("s2");
            timers.runDue();

            assertEquals(0, timers.pendingCount("activity-backfill"));
            assertEquals(2, backlogCalls);
            assertEquals(List.of("x"), ids());
        }
    }
}
