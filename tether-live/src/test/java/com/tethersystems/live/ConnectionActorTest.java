package com.tethersystems.live;

import com.tethersystems.ActorSystem;
import com.tethersystems.live.bridge.PeerReply;
import com.tethersystems.live.bridge.RequestResponseBridge;
import com.tethersystems.live.capability.CapabilityModule;
import com.tethersystems.live.capability.CapabilityRegistry;
import com.tethersystems.live.capability.CoreCapability;
import com.tethersystems.live.commander.CommanderBinding;
import com.tethersystems.live.commander.HookFilter;
import com.tethersystems.live.config.TetherConfig;
import com.tethersystems.task.TaskHandle;
import com.tethersystems.test.AsyncAssertion;
import com.tethersystems.test.TestProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionActorTest {

    private static final Duration WAIT = Duration.ofSeconds(3);

    private ActorSystem system;
    private RecordingTransport transport;
    private ConnectionEndpoint endpoint;

    @BeforeEach
    void setUp() {
        system = new ActorSystem();
        transport = new RecordingTransport();
    }

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.close();
        }
        system.shutdown();
    }

    private ConnectionRef connect(CommanderBinding binding, Map<String, Object> payload) {
        return connect(binding, new TetherConfig().setTokenSecret("test"), payload);
    }

    private ConnectionRef connect(CommanderBinding binding, TetherConfig config, Map<String, Object> payload) {
        endpoint = new ConnectionEndpoint(system, binding, config);
        return endpoint.join(new DefaultLiveSocket("s1", "page:1", transport), payload);
    }

    private static Map<String, Object> event(String handler, String replyTo) {
        Map<String, Object> frame = new HashMap<>();
        frame.put("event", "click");
        frame.put(ConnectionActor.EVENT_HANDLER_KEY, handler);
        frame.put("reply_to", replyTo);
        return frame;
    }

    private void awaitAck(String replyTo) {
        AsyncAssertion.eventually(() -> transport.acknowledgments().contains(replyTo), WAIT);
    }

    @Test
    void testSetStoreIsVisibleToGetStore() {
        ConnectionRef ref = connect(CommanderBinding.builder().handler("noop", (s, p) -> null).build(), Map.of());

        ref.setStore(Map.of("count", 1));

        assertEquals(Map.of("count", 1), ref.getStore());
        ref.setPrivate(Map.of("secret", true));
        assertEquals(Map.of("secret", true), ref.getPrivate());
    }

    @Test
    void testStoreSurvivesReconnectWhileSessionAndSocketAreReplaced() {
        CommanderBinding binding = CommanderBinding.builder().handler("noop", (s, p) -> null).build();
        ConnectionRef ref = connect(binding, Map.of("session", Map.of("user", "ann")));
        ref.setStore(Map.of("count", 3));
        assertEquals(Map.of("user", "ann"), ref.getSession());

        LiveSocket reconnected = new DefaultLiveSocket("s1", "page:1", transport).assign("generation", 2);
        ConnectionRef again = endpoint.join(reconnected, Map.of("session", Map.of("user", "bob")));

        assertEquals(ref.pid(), again.pid());
        assertEquals(Map.of("count", 3), again.getStore());
        assertEquals(Map.of("user", "bob"), again.getSession());
        assertEquals(2, again.getSocket().assign("generation"));

        endpoint.join(new DefaultLiveSocket("s1", "page:1", transport), Map.of());
        assertEquals(Map.of(), again.getSession(), "session is replaced wholesale, even by an empty one");
        assertEquals(Map.of("count", 3), again.getStore());

        endpoint.join(new DefaultLiveSocket("s1", "page:1", transport), Map.of("store", Map.of("count", 9)));
        assertEquals(Map.of("count", 9), again.getStore(), "a store carried by the socket replaces the old one");
    }

    @Test
    void testFalseBeforeHookSkipsHandlerAndAfterHooksButStillAcknowledges() {
        AtomicInteger handled = new AtomicInteger();
        AtomicInteger afterRuns = new AtomicInteger();
        List<String> beforeRuns = new CopyOnWriteArrayList<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("save", (s, p) -> handled.incrementAndGet())
                .beforeHook("deny", (s, p) -> {
                    beforeRuns.add("deny");
                    return false;
                })
                .beforeHook("audit", (s, p) -> {
                    beforeRuns.add("audit");
                    return true;
                })
                .afterHook("after", (s, p, r) -> afterRuns.incrementAndGet())
                .build();
        connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("save", "r-1"));

        awaitAck("r-1");
        assertEquals(List.of("deny", "audit"), beforeRuns);
        assertEquals(0, handled.get());
        assertEquals(0, afterRuns.get());
        assertEquals(1, transport.acknowledgmentCount("r-1"));
    }

    @Test
    void testHandlerRunsBetweenHooksWithTransformedPayload() {
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        AtomicReference<Object> afterResult = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("uppercase", (s, p) -> {
                    order.add("handler");
                    seen.set(p);
                    return ((String) p.get("value")).toUpperCase();
                })
                .handler("other", (s, p) -> null)
                .beforeHook("before", (s, p) -> order.add("before"))
                .beforeHook("onlyOther", (s, p) -> order.add("onlyOther"), HookFilter.only("other"))
                .afterHook("after", (s, p, r) -> {
                    order.add("after");
                    afterResult.set(r);
                })
                .build();
        connect(binding, Map.of());

        Map<String, Object> frame = event("uppercase", "r-2");
        frame.put("val", "hello");
        endpoint.handleIn("s1", "event", frame);

        awaitAck("r-2");
        assertEquals(List.of("before", "handler", "after"), order);
        assertEquals("HELLO", afterResult.get());
        assertFalse(seen.get().containsKey(ConnectionActor.EVENT_HANDLER_KEY));
        assertEquals("hello", seen.get().get("value"));
    }

    @Test
    void testUnknownHandlerIsReportedAndAcknowledgedOnce() throws Exception {
        AtomicInteger hookRuns = new AtomicInteger();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("known", (s, p) -> null)
                .beforeHook("count", (s, p) -> hookRuns.incrementAndGet() > 0)
                .build();
        connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("nope", "r-3"));

        awaitAck("r-3");
        AsyncAssertion.eventually(() -> transport.frames("execjs").size() == 1, WAIT);
        String js = (String) transport.frames("execjs").get(0).payload().get("js");
        assertTrue(js.contains("HandlerNotFoundException"));
        assertTrue(js.contains("nope"));
        assertEquals(0, hookRuns.get());

        Thread.sleep(100);
        assertEquals(1, transport.acknowledgmentCount("r-3"));
    }

    @Test
    void testHandlerExceptionIsReportedAndConnectionKeepsServing() {
        AtomicInteger calls = new AtomicInteger();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("explode", (s, p) -> {
                    throw new IllegalArgumentException("bad input");
                })
                .handler("count", (s, p) -> calls.incrementAndGet())
                .build();
        connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("explode", "r-4"));
        awaitAck("r-4");
        AsyncAssertion.eventually(() -> transport.frames("execjs").size() == 1, WAIT);

        endpoint.handleIn("s1", "event", event("count", "r-5"));
        awaitAck("r-5");
        assertEquals(1, calls.get());
        assertTrue(((String) transport.frames("execjs").get(0).payload().get("js")).contains("bad input"));
    }

    @Test
    void testPipelineOrderReachesHandler() {
        CapabilityRegistry registry = CapabilityRegistry.withDefaults()
                .register(trail("A"))
                .register(trail("B"));
        AtomicReference<Object> seen = new AtomicReference<>();
        AtomicReference<LiveSocket> seenSocket = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("h", (s, p) -> {
                    seen.set(p.get("trail"));
                    seenSocket.set(s);
                    return null;
                })
                .registry(registry)
                .capabilities("A", "B")
                .build();
        connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("h", "r-6"));

        awaitAck("r-6");
        assertEquals(List.of("A", "B"), seen.get());
        assertTrue(seenSocket.get().hasCapability("A"));
        assertTrue(seenSocket.get().hasCapability("B"));
        assertTrue(seenSocket.get().hasCapability("core"));
    }

    private static CapabilityModule trail(String name) {
        return new CapabilityModule() {
            @Override
            public String name() {
                return name;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Map<String, Object> transformPayload(Map<String, Object> payload, ConnectionState state) {
                Map<String, Object> result = new HashMap<>(payload);
                List<String> trail = new ArrayList<>((List<String>) payload.getOrDefault("trail", List.of()));
                trail.add(name);
                result.put("trail", trail);
                return result;
            }
        };
    }

    @Test
    @Timeout(10)
    void testKilledTaskIsReportedNormalTaskIsNot() throws Exception {
        CountDownLatch blocked = new CountDownLatch(1);
        CommanderBinding binding = CommanderBinding.builder()
                .handler("quick", (s, p) -> "done")
                .handler("block", (s, p) -> {
                    blocked.countDown();
                    new CountDownLatch(1).await();
                    return null;
                })
                .build();
        ConnectionRef ref = connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("quick", "r-7"));
        awaitAck("r-7");
        Thread.sleep(100);
        assertTrue(transport.frames("execjs").isEmpty(), "a normal exit is not reported");

        endpoint.handleIn("s1", "event", event("block", "r-8"));
        assertTrue(blocked.await(3, TimeUnit.SECONDS));
        List<TaskHandle<?>> running = ref.activeTasks();
        assertEquals(1, running.size());
        assertTrue(running.get(0).name().contains("block"));

        assertTrue(running.get(0).kill());

        AsyncAssertion.eventually(() -> transport.frames("execjs").size() == 1, WAIT);
        assertTrue(((String) transport.frames("execjs").get(0).payload().get("js")).contains("has been killed."));

        endpoint.handleIn("s1", "event", event("quick", "r-9"));
        awaitAck("r-9");
        assertTrue(ref.activeTasks().isEmpty());
    }

    @Test
    @Timeout(10)
    void testDispatchesAreNotSerialized() {
        CountDownLatch secondRan = new CountDownLatch(1);
        AtomicReference<Object> released = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("waiter", (s, p) -> secondRan.await(3, TimeUnit.SECONDS))
                .handler("releaser", (s, p) -> {
                    secondRan.countDown();
                    return null;
                })
                .afterHook("capture", (s, p, r) -> released.set(r), HookFilter.only("waiter"))
                .build();
        connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("waiter", "r-10"));
        endpoint.handleIn("s1", "event", event("releaser", "r-11"));

        awaitAck("r-10");
        awaitAck("r-11");
        assertEquals(Boolean.TRUE, released.get(), "waiter was released by a concurrent dispatch");
    }

    @Test
    @Timeout(10)
    void testHandlerCanWaitForTheBrowser() {
        AtomicReference<Object> result = new AtomicReference<>();
        AtomicReference<ConnectionEndpoint> endpointRef = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("ask", (s, p) -> endpointRef.get().commands().execJs(s, "1+1"))
                .afterHook("capture", (s, p, r) -> result.set(r))
                .build();
        transport.respondWith(frame -> {
            if (frame.event().equals("execjs")) {
                Map<String, Object> reply = new HashMap<>();
                reply.put(RequestResponseBridge.SENDER_KEY, frame.payload().get(RequestResponseBridge.SENDER_KEY));
                reply.put("ok", 2);
                endpointRef.get().handleIn("s1", "execjs", reply);
            }
        });
        connect(binding, Map.of());
        endpointRef.set(endpoint);

        endpoint.handleIn("s1", "event", event("ask", "r-12"));

        awaitAck("r-12");
        assertEquals(PeerReply.ok(2), result.get());
    }

    @Test
    void testHelperWithoutCapabilityIsAConfigurationFault() {
        AtomicReference<ConnectionEndpoint> endpointRef = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("dialog", (s, p) -> endpointRef.get().dialogs().alert(s, "Title", "Body"))
                .capabilities("query")
                .build();
        connect(binding, Map.of());
        endpointRef.set(endpoint);

        endpoint.handleIn("s1", "event", event("dialog", "r-13"));

        awaitAck("r-13");
        AsyncAssertion.eventually(() -> transport.frames("execjs").size() == 1, WAIT);
        String js = (String) transport.frames("execjs").get(0).payload().get("js");
        assertTrue(js.contains("ConfigurationException"));
        assertTrue(transport.frames("modal").isEmpty());
    }

    @Test
    void testHandlerReachesStateThroughTheSocket() {
        CommanderBinding binding = CommanderBinding.builder()
                .handler("increment", (s, p) -> {
                    ConnectionRef connection = s.connection().orElseThrow();
                    int count = (Integer) connection.getStore().getOrDefault("count", 0);
                    connection.setStore(Map.of("count", count + 1));
                    return count + 1;
                })
                .build();
        ConnectionRef ref = connect(binding, Map.of());

        endpoint.handleIn("s1", "event", event("increment", "r-14"));
        awaitAck("r-14");

        assertEquals(Map.of("count", 1), ref.getStore());
    }

    @Test
    void testLifecycleCallbacksSeeTransformedSocket() {
        AtomicReference<LiveSocket> connected = new AtomicReference<>();
        AtomicReference<LiveSocket> loaded = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onConnect(connected::set)
                .onLoad(loaded::set)
                .build();
        connect(binding, Map.of("session", Map.of("user", "ann")));

        AsyncAssertion.eventually(() -> connected.get() != null, WAIT);
        assertTrue(connected.get().hasCapability("core"));
        assertTrue(connected.get().hasCapability("modal"));
        assertEquals(Map.of("user", "ann"),
                connected.get().assign(CoreCapability.SESSION_ASSIGN));

        endpoint.handleIn("s1", "onload", Map.of());
        AsyncAssertion.eventually(() -> loaded.get() != null, WAIT);
        assertEquals("s1", loaded.get().id());
        assertTrue(loaded.get().hasCapability("core"));
        assertTrue(loaded.get().hasCapability("modal"));
        assertTrue(loaded.get().connection().isPresent());
    }

    @Test
    @Timeout(10)
    void testOnLoadCanRunPageCommands() {
        AtomicReference<ConnectionEndpoint> endpointRef = new AtomicReference<>();
        AtomicReference<PeerReply> result = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onLoad(s -> result.set(endpointRef.get().commands().execJs(s, "document.title")))
                .build();
        transport.respondWith(frame -> {
            if (frame.event().equals("execjs") && "document.title".equals(frame.payload().get("js"))) {
                Map<String, Object> reply = new HashMap<>();
                reply.put(RequestResponseBridge.SENDER_KEY, frame.payload().get(RequestResponseBridge.SENDER_KEY));
                reply.put("ok", "Home");
                endpointRef.get().handleIn("s1", "execjs", reply);
            }
        });
        connect(binding, Map.of());
        endpointRef.set(endpoint);

        endpoint.handleIn("s1", "onload", Map.of());

        AsyncAssertion.eventually(() -> result.get() != null, WAIT);
        assertEquals(PeerReply.ok("Home"), result.get());
        assertEquals(1, transport.frames("execjs").size(), "no failure report was pushed");
    }

    @Test
    void testFailingOnConnectIsReported() {
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onConnect(s -> {
                    throw new IllegalStateException("no database");
                })
                .build();
        connect(binding, Map.of());

        AsyncAssertion.eventually(() -> transport.frames("execjs").size() == 1, WAIT);
        assertTrue(((String) transport.frames("execjs").get(0).payload().get("js")).contains("no database"));
    }

    @Test
    void testOnDisconnectReceivesStoreAndSession() throws Exception {
        CountDownLatch called = new CountDownLatch(1);
        AtomicReference<Map<String, Object>> store = new AtomicReference<>();
        AtomicReference<Map<String, Object>> session = new AtomicReference<>();
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onDisconnect((st, se) -> {
                    store.set(st);
                    session.set(se);
                    called.countDown();
                })
                .build();
        ConnectionRef ref = connect(binding, Map.of("session", Map.of("user", "ann")));
        ref.setStore(Map.of("cart", 2));
        assertEquals(Map.of("cart", 2), ref.getStore());

        endpoint.leave("s1");

        assertTrue(called.await(0, TimeUnit.SECONDS), "leave returns after on-disconnect ran");
        assertEquals(Map.of("cart", 2), store.get());
        assertEquals(Map.of("user", "ann"), session.get());
        assertTrue(system.getActor(ref.pid()).isEmpty());
    }

    @Test
    @Timeout(10)
    void testSlowOnDisconnectIsBoundedByTimeout() {
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onDisconnect((st, se) -> Thread.sleep(10_000))
                .build();
        TetherConfig config = new TetherConfig()
                .setTokenSecret("test")
                .setDisconnectTimeout(Duration.ofMillis(200));
        connect(binding, config, Map.of());

        long start = System.currentTimeMillis();
        endpoint.leave("s1");

        assertTrue(System.currentTimeMillis() - start < 3000);
        assertEquals(0, endpoint.connectionCount());
    }

    @Test
    @Timeout(10)
    void testRejoinWhileDisconnectIsStillRunning() throws Exception {
        CountDownLatch disconnecting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CommanderBinding binding = CommanderBinding.builder()
                .handler("noop", (s, p) -> null)
                .onDisconnect((st, se) -> {
                    disconnecting.countDown();
                    release.await();
                })
                .build();
        ConnectionRef old = connect(binding, Map.of());
        old.setStore(Map.of("count", 1));
        assertEquals(Map.of("count", 1), old.getStore());

        Thread leaving = new Thread(() -> endpoint.leave("s1"));
        leaving.start();
        assertTrue(disconnecting.await(3, TimeUnit.SECONDS));

        ConnectionRef fresh = endpoint.join(new DefaultLiveSocket("s1", "page:1", transport), Map.of());

        assertNotEquals(old.pid(), fresh.pid());
        assertEquals(Map.of(), fresh.getStore());
        fresh.setStore(Map.of("count", 5));
        assertEquals(Map.of("count", 5), fresh.getStore());

        release.countDown();
        leaving.join(3000);
        assertFalse(leaving.isAlive());
        assertTrue(system.getActor(fresh.pid()).isPresent(), "the old actor's stop leaves the new one registered");
        assertTrue(system.getActor(old.pid()).isEmpty());
        assertEquals(Map.of("count", 5), fresh.getStore());
    }

    @Test
    void testFramesCanBeObservedWithAProbe() {
        TestProbe<RecordingTransport.Frame> probe = TestProbe.create(system);
        transport.forwardTo(probe.ref());
        connect(CommanderBinding.builder().handler("noop", (s, p) -> null).build(), Map.of());

        endpoint.handleIn("s1", "event", event("noop", "r-15"));

        RecordingTransport.Frame ack = probe.expectMessage(f -> f.event().equals("event"), WAIT);
        assertEquals("r-15", ack.payload().get(ConnectionActor.ACK_KEY));
        probe.expectNoMessage(Duration.ofMillis(100));
    }
}
