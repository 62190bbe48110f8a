package com.shipyard.core.events;

import com.shipyard.core.metrics.ShipyardMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventHub}.
 */
class EventHubTest {

    private EventHub hub;

    @BeforeEach
    void setUp() {
        hub = new EventHub();
    }

    @AfterEach
    void tearDown() {
        hub.closeAll();
    }

    /** A bean with no properties; Jackson refuses to serialize it. */
    static class Opaque {
    }

    private static ShipyardEvent log(String projectId, int n) {
        return ShipyardEvent.of(EventType.LOG, projectId, Map.of("content", "line " + n));
    }

    // -- subscribe ---------------------------------------------------------------

    @Nested
    @DisplayName("subscribe")
    class SubscribeTests {

        @Test
        @DisplayName("sends connected acknowledgement carrying project and connection id")
        void sendsAcknowledgement() {
            var conn = new RecordingConnection("c1");

            assertTrue(hub.subscribe("P1", conn));

            ShipyardEvent ack = conn.received().get(0);
            assertEquals(EventType.CONNECTED, ack.type());
            assertEquals("P1", ack.data().get("projectId"));
            assertEquals("c1", ack.data().get("connectionId"));
            assertEquals("sse", ack.data().get("transport"));
            assertNotNull(ack.data().get("timestamp"));
            assertEquals(1, hub.connectionCount("P1"));
        }

        @Test
        @DisplayName("sends snapshots in contributor order right after the acknowledgement")
        void sendsSnapshotsInOrder() {
            SnapshotContributor preview = projectId ->
                    ShipyardEvent.of(EventType.PREVIEW_STATUS, projectId, Map.of("status", "stopped"));
            SnapshotContributor requests = projectId ->
                    ShipyardEvent.of(EventType.REQUEST_STATUS, projectId,
                            Map.of("hasActiveRequests", false, "activeCount", 0));
            var snapshotHub = new EventHub(List.of(preview, requests), Duration.ofSeconds(30));
            var conn = new RecordingConnection("c1");

            snapshotHub.subscribe("P1", conn);
            snapshotHub.publish(log("P1", 1));

            assertEquals(List.of(EventType.CONNECTED, EventType.PREVIEW_STATUS,
                    EventType.REQUEST_STATUS, EventType.LOG), conn.receivedTypes());
            snapshotHub.closeAll();
        }

        @Test
        @DisplayName("skips a contributor that throws or returns null")
        void skipsFailingContributor() {
            SnapshotContributor broken = projectId -> {
                throw new IllegalStateException("boom");
            };
            SnapshotContributor silent = projectId -> null;
            SnapshotContributor requests = projectId ->
                    ShipyardEvent.of(EventType.REQUEST_STATUS, projectId, Map.of("activeCount", 0));
            var snapshotHub = new EventHub(List.of(broken, silent, requests), Duration.ofSeconds(30));
            var conn = new RecordingConnection("c1");

            assertTrue(snapshotHub.subscribe("P1", conn));

            assertEquals(List.of(EventType.CONNECTED, EventType.REQUEST_STATUS), conn.receivedTypes());
            snapshotHub.closeAll();
        }

        @Test
        @DisplayName("does not register a connection whose acknowledgement write fails")
        void rejectsConnectionFailingHandshake() {
            var conn = new RecordingConnection("c1", 0);

            assertFalse(hub.subscribe("P1", conn));

            assertEquals(0, hub.connectionCount("P1"));
            assertTrue(conn.isClosed());
        }
    }

    // -- publish -----------------------------------------------------------------

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("delivers to every connection of the project in publish order")
        void deliversInOrder() {
            var a = new RecordingConnection("a");
            var b = new RecordingConnection("b");
            hub.subscribe("P1", a);
            hub.subscribe("P1", b);

            for (int i = 0; i < 5; i++) {
                assertEquals(2, hub.publish(log("P1", i)));
            }

            for (var conn : List.of(a, b)) {
                var contents = conn.receivedOfType(EventType.LOG).stream()
                        .map(e -> e.data().get("content"))
                        .toList();
                assertEquals(List.of("line 0", "line 1", "line 2", "line 3", "line 4"), contents);
            }
        }

        @Test
        @DisplayName("never delivers to connections of another project")
        void isolatesProjects() {
            var p1 = new RecordingConnection("c1");
            var p2 = new RecordingConnection("c2");
            hub.subscribe("P1", p1);
            hub.subscribe("P2", p2);

            hub.publish(ShipyardEvent.status("P1", "processing", null));

            assertEquals(1, p1.receivedOfType(EventType.STATUS).size());
            assertTrue(p2.receivedOfType(EventType.STATUS).isEmpty());
        }

        @Test
        @DisplayName("publishing to a project without connections is a no-op")
        void noConnections() {
            assertEquals(0, hub.publish(log("nobody", 1)));
        }

        @Test
        @DisplayName("removes a connection whose write fails and keeps delivering to the rest")
        void dropsFailedConnection() {
            var healthy = new RecordingConnection("healthy");
            var broken = new RecordingConnection("broken");
            hub.subscribe("P1", healthy);
            hub.subscribe("P1", broken);
            broken.failNextWrites();

            assertEquals(1, hub.publish(log("P1", 1)));

            assertEquals(1, hub.connectionCount("P1"));
            assertTrue(broken.isClosed());
            assertEquals(1, hub.publish(log("P1", 2)));
            assertEquals(2, healthy.receivedOfType(EventType.LOG).size());
        }

        @Test
        @DisplayName("a connection that throws is treated like a failed write")
        void dropsThrowingConnection() {
            var throwing = new RecordingConnection("t") {
                @Override
                public boolean send(ShipyardEvent event, String frame) {
                    if (event.type() == EventType.LOG) {
                        throw new IllegalStateException("closed");
                    }
                    return super.send(event, frame);
                }
            };
            hub.subscribe("P1", throwing);

            assertEquals(0, hub.publish(log("P1", 1)));
            assertEquals(0, hub.connectionCount("P1"));
        }

        @Test
        @DisplayName("an event that cannot be encoded reaches nobody and keeps every connection")
        void unencodableEventKeepsConnections() {
            var a = new RecordingConnection("a");
            var b = new RecordingConnection("b");
            hub.subscribe("P1", a);
            hub.subscribe("P1", b);

            int delivered = hub.publish(ShipyardEvent.of(EventType.LOG, "P1", Map.of("payload", new Opaque())));

            assertEquals(0, delivered);
            assertEquals(2, hub.connectionCount("P1"));
            assertFalse(a.isClosed());
            assertFalse(b.isClosed());
            assertEquals(2, hub.publish(log("P1", 1)));
        }

        @Test
        @DisplayName("every connection receives the same encoded frame")
        void sharesEncodedFrame() {
            var a = new RecordingConnection("a");
            var b = new RecordingConnection("b");
            hub.subscribe("P1", a);
            hub.subscribe("P1", b);

            hub.publish(log("P1", 7));

            String expected = "data: {\"type\":\"log\",\"data\":{\"content\":\"line 7\"}}\n\n";
            assertEquals(expected, a.frames().get(a.frames().size() - 1));
            assertSame(a.frames().get(a.frames().size() - 1), b.frames().get(b.frames().size() - 1));
        }

        @Test
        @DisplayName("records published and delivered counters")
        void recordsMetrics() {
            var registry = new SimpleMeterRegistry();
            var metered = new EventHub(List::of, Duration.ofSeconds(30), new ShipyardMetrics(registry));
            metered.subscribe("P1", new RecordingConnection("c1"));

            metered.publish(log("P1", 1));

            assertEquals(1.0, registry.find("shipyard.stream.events.delivered").tag("type", "log").counter().count());
            assertEquals(1.0, registry.find("shipyard.stream.connections").gauge().value());
            metered.closeAll();
        }
    }

    // -- unsubscribe -------------------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("removes the connection and stops delivery")
        void removesConnection() {
            var conn = new RecordingConnection("c1");
            hub.subscribe("P1", conn);

            assertTrue(hub.unsubscribe("P1", "c1"));
            hub.publish(log("P1", 1));

            assertTrue(conn.receivedOfType(EventType.LOG).isEmpty());
            assertEquals(0, hub.connectionCount("P1"));
        }

        @Test
        @DisplayName("is idempotent and tolerates unknown ids")
        void idempotent() {
            hub.subscribe("P1", new RecordingConnection("c1"));

            assertTrue(hub.unsubscribe("P1", "c1"));
            assertFalse(hub.unsubscribe("P1", "c1"));
            assertFalse(hub.unsubscribe("P9", "c1"));
        }

        @Test
        @DisplayName("is safe while another thread publishes")
        void concurrentWithPublish() throws Exception {
            List<RecordingConnection> conns = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                var conn = new RecordingConnection("c" + i);
                conns.add(conn);
                hub.subscribe("P1", conn);
            }
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            var publisher = pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    hub.publish(log("P1", i));
                }
                return null;
            });
            var remover = pool.submit(() -> {
                start.await();
                for (var conn : conns) {
                    hub.unsubscribe("P1", conn.id());
                }
                return null;
            });

            start.countDown();
            publisher.get(10, TimeUnit.SECONDS);
            remover.get(10, TimeUnit.SECONDS);
            pool.shutdown();

            assertEquals(0, hub.connectionCount("P1"));
            assertEquals(0, hub.publish(log("P1", 999)));
        }
    }

    // -- heartbeat ---------------------------------------------------------------

    @Nested
    @DisplayName("heartbeat")
    class HeartbeatTests {

        @Test
        @DisplayName("sends heartbeats with connection id at the configured interval")
        void sendsHeartbeats() throws Exception {
            var fastHub = new EventHub(List.of(), Duration.ofMillis(50));
            var conn = new RecordingConnection("c1");
            fastHub.subscribe("P1", conn);

            long deadline = System.currentTimeMillis() + 2_000;
            while (conn.receivedOfType(EventType.HEARTBEAT).size() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            var heartbeats = conn.receivedOfType(EventType.HEARTBEAT);
            assertTrue(heartbeats.size() >= 2);
            assertEquals("c1", heartbeats.get(0).data().get("connectionId"));
            assertTrue(fastHub.lastSeen("P1").containsKey("c1"));
            fastHub.closeAll();
        }

        @Test
        @DisplayName("a failed heartbeat removes the connection")
        void failedHeartbeatRemovesConnection() throws Exception {
            var fastHub = new EventHub(List.of(), Duration.ofMillis(50));
            var conn = new RecordingConnection("c1");
            fastHub.subscribe("P1", conn);
            conn.failNextWrites();

            long deadline = System.currentTimeMillis() + 2_000;
            while (fastHub.connectionCount("P1") > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }

            assertEquals(0, fastHub.connectionCount("P1"));
            assertTrue(conn.isClosed());
            fastHub.closeAll();
        }

        @Test
        @DisplayName("a stalled heartbeat write on one project does not delay heartbeats to another")
        void stalledProjectDoesNotDelayOthers() throws Exception {
            var fastHub = new EventHub(List.of(), Duration.ofMillis(100));
            var release = new CountDownLatch(1);
            var stalled = new RecordingConnection("slow") {
                @Override
                public boolean send(ShipyardEvent event, String frame) {
                    if (event.type() == EventType.HEARTBEAT) {
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return super.send(event, frame);
                }
            };
            var healthy = new RecordingConnection("fast");
            try {
                fastHub.subscribe("A", stalled);
                fastHub.subscribe("B", healthy);

                Thread.sleep(1_000);

                assertTrue(healthy.receivedOfType(EventType.HEARTBEAT).size() >= 3,
                        "project B should keep receiving heartbeats while A is stalled");
            } finally {
                release.countDown();
                fastHub.closeAll();
            }
        }

        @Test
        @DisplayName("no heartbeat reaches a connection after it unsubscribed")
        void noHeartbeatAfterUnsubscribe() throws Exception {
            var fastHub = new EventHub(List.of(), Duration.ofMillis(30));
            var conn = new RecordingConnection("c1");
            fastHub.subscribe("P1", conn);
            fastHub.unsubscribe("P1", "c1");
            int seen = conn.received().size();

            Thread.sleep(150);

            assertEquals(seen, conn.received().size());
            fastHub.closeAll();
        }
    }

    @Test
    @DisplayName("closeAll closes every connection")
    void closeAllClosesConnections() {
        var a = new RecordingConnection("a");
        var b = new RecordingConnection("b");
        hub.subscribe("P1", a);
        hub.subscribe("P2", b);

        hub.closeAll();

        assertTrue(a.isClosed());
        assertTrue(b.isClosed());
        assertEquals(0, hub.totalConnections());
    }
}
