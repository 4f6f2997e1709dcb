package com.tethersystems.live.bridge;

import com.tethersystems.live.DefaultLiveSocket;
import com.tethersystems.live.LiveSocket;
import com.tethersystems.live.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RequestResponseBridgeTest {

    private RecordingTransport transport;
    private LiveSocket socket;
    private RequestResponseBridge bridge;
    private ExecutorService page;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        socket = new DefaultLiveSocket("s1", "page:1", transport);
        bridge = new RequestResponseBridge(new TokenSigner("test-secret", null), Duration.ofSeconds(5));
        page = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        page.shutdownNow();
    }

    private void replyFromPage(PeerReply.Status status, Object value, long delayMillis) {
        transport.respondWith(frame -> page.submit(() -> {
            Thread.sleep(delayMillis);
            return bridge.deliverReply((String) frame.payload().get(RequestResponseBridge.SENDER_KEY), status, value);
        }));
    }

    @Test
    @Timeout(5)
    void testReplyIsReturnedWithItsStatus() {
        replyFromPage(PeerReply.Status.OK, 42, 20);

        PeerReply reply = bridge.pushAndWait(socket, "execjs", Map.of("js", "6*7"), Duration.ofSeconds(2));

        assertEquals(PeerReply.ok(42), reply);
        RecordingTransport.Frame frame = transport.frames().get(0);
        assertEquals("execjs", frame.event());
        assertEquals("6*7", frame.payload().get("js"));
        assertNotNull(frame.payload().get(RequestResponseBridge.SENDER_KEY));
        assertEquals(0, bridge.pendingCount());
    }

    @Test
    @Timeout(5)
    void testErrorReplyKeepsErrorStatus() {
        replyFromPage(PeerReply.Status.ERROR, "ReferenceError: x is not defined", 0);

        PeerReply reply = bridge.pushAndWait(socket, "execjs", Map.of("js", "x"), Duration.ofSeconds(2));

        assertEquals(PeerReply.Status.ERROR, reply.status());
        assertEquals("ReferenceError: x is not defined", reply.value());
    }

    @Test
    @Timeout(5)
    void testTimeoutWhenNoReply() {
        PeerReply reply = bridge.pushAndWait(socket, "execjs", Map.of("js", "1"), Duration.ofMillis(100));

        assertEquals(PeerReply.Status.TIMEOUT, reply.status());
        assertEquals("timed out after 100 ms.", reply.value());
        assertEquals(0, bridge.pendingCount());
    }

    @Test
    @Timeout(5)
    void testZeroTimeoutStillReturnsAnImmediateReply() {
        transport.respondWith(frame ->
                bridge.deliverReply((String) frame.payload().get(RequestResponseBridge.SENDER_KEY), PeerReply.Status.OK, "now"));

        assertEquals(PeerReply.ok("now"), bridge.pushAndWait(socket, "execjs", Map.of(), Duration.ZERO));
    }

    @Test
    @Timeout(5)
    void testZeroTimeoutWithoutReplyTimesOut() {
        PeerReply reply = bridge.pushAndWait(socket, "execjs", Map.of(), Duration.ZERO);

        assertEquals(PeerReply.timeout(0), reply);
    }

    @Test
    void testNegativeTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> bridge.pushAndWait(socket, "execjs", Map.of(), Duration.ofMillis(-1)));
    }

    @Test
    @Timeout(5)
    void testLateReplyIsDiscardedAndNeverReachesTheNextCall() throws Exception {
        PeerReply first = bridge.pushAndWait(socket, "execjs", Map.of("js", "first"), Duration.ofMillis(50));
        assertEquals(PeerReply.Status.TIMEOUT, first.status());
        String lateToken = (String) transport.frames().get(0).payload().get(RequestResponseBridge.SENDER_KEY);

        CompletableFuture<PeerReply> second = CompletableFuture.supplyAsync(
                () -> bridge.pushAndWait(socket, "execjs", Map.of("js", "second"), Duration.ofSeconds(2)), page);
        while (transport.frames().size() < 2) {
            Thread.sleep(5);
        }

        assertFalse(bridge.deliverReply(lateToken, PeerReply.Status.OK, "late"));
        String secondToken = (String) transport.frames().get(1).payload().get(RequestResponseBridge.SENDER_KEY);
        assertTrue(bridge.deliverReply(secondToken, PeerReply.Status.OK, "fresh"));

        assertEquals(PeerReply.ok("fresh"), second.get(2, TimeUnit.SECONDS));
    }

    @Test
    @Timeout(5)
    void testReplyIsDeliveredOnlyOnce() {
        replyFromPage(PeerReply.Status.OK, "once", 0);
        bridge.pushAndWait(socket, "execjs", Map.of(), Duration.ofSeconds(2));
        String token = (String) transport.frames().get(0).payload().get(RequestResponseBridge.SENDER_KEY);

        assertFalse(bridge.deliverReply(token, PeerReply.Status.OK, "again"));
    }

    @Test
    void testForgedTokenPropagates() {
        assertThrows(TokenVerificationException.class,
                () -> bridge.deliverReply("forged.1.token", PeerReply.Status.OK, "x"));
    }

    @Test
    void testPushAndBroadcastAttachSenderToken() {
        bridge.push(socket, "update", Map.of("html", "<b>hi</b>"));
        bridge.broadcast(socket, "update", Map.of("html", "<b>all</b>"));

        List<RecordingTransport.Frame> frames = transport.frames("update");
        assertEquals(2, frames.size());
        assertFalse(frames.get(0).broadcast());
        assertEquals("s1", frames.get(0).target());
        assertTrue(frames.get(1).broadcast());
        assertEquals("page:1", frames.get(1).target());
        frames.forEach(f -> assertTrue(f.payload().get(RequestResponseBridge.SENDER_KEY) instanceof String));
    }

    @Test
    @Timeout(5)
    void testWaitForeverReturnsWhenPageReplies() {
        replyFromPage(PeerReply.Status.OK, Map.of("button", "ok"), 150);

        PeerReply reply = bridge.pushAndWaitForever(socket, "modal", Map.of("title", "Hi"));

        assertEquals(PeerReply.ok(Map.of("button", "ok")), reply);
    }

    @Test
    @Timeout(5)
    void testExpiredReplyReleasesTheWaitingCall() throws Exception {
        MovableClock clock = new MovableClock(Instant.parse("2024-01-01T00:00:00Z"));
        RequestResponseBridge expiring = new RequestResponseBridge(
                new TokenSigner("test-secret", Duration.ofMinutes(1), clock), Duration.ofSeconds(5));
        CompletableFuture<Throwable> rejected = new CompletableFuture<>();
        transport.respondWith(frame -> page.submit(() -> {
            clock.advance(Duration.ofMinutes(2));
            try {
                expiring.deliverReply((String) frame.payload().get(RequestResponseBridge.SENDER_KEY),
                        PeerReply.Status.OK, Map.of("button", "ok"));
                rejected.complete(null);
            } catch (TokenVerificationException e) {
                rejected.complete(e);
            }
        }));

        PeerReply reply = expiring.pushAndWaitForever(socket, "modal", Map.of("title", "Hi"));

        assertEquals(PeerReply.Status.ERROR, reply.status());
        Throwable thrown = rejected.get(2, TimeUnit.SECONDS);
        assertInstanceOf(TokenVerificationException.class, thrown);
        assertEquals(TokenVerificationException.Reason.EXPIRED, ((TokenVerificationException) thrown).getReason());
        assertEquals(0, expiring.pendingCount());
    }

    private static final class MovableClock extends Clock {
        private volatile Instant now;

        MovableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
