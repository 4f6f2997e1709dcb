package com.tethersystems.live.capability;

import com.tethersystems.live.ConfigurationException;
import com.tethersystems.live.ConnectionState;
import com.tethersystems.live.DefaultLiveSocket;
import com.tethersystems.live.LiveSocket;
import com.tethersystems.live.RecordingTransport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityPipelineTest {

    private final LiveSocket socket = new DefaultLiveSocket("s1", "page:1", new RecordingTransport());

    /** Appends its name to the payload's "trail" list and to the socket's "trail" assign. */
    static class TrailModule implements CapabilityModule {
        private final String name;
        private final List<String> prerequisites;

        TrailModule(String name, String... prerequisites) {
            this.name = name;
            this.prerequisites = List.of(prerequisites);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<String> prerequisites() {
            return prerequisites;
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

        @Override
        public LiveSocket transformConnection(LiveSocket socket, Map<String, Object> payload, ConnectionState state) {
            Object trail = socket.assign("trail");
            return socket.assign("trail", (trail == null ? "" : trail + ">") + name);
        }
    }

    @Test
    void testModulesFoldLeftToRight() {
        CapabilityPipeline pipeline = new CapabilityPipeline(List.of(new TrailModule("A"), new TrailModule("B")));

        Map<String, Object> payload = pipeline.transformPayload(Map.of(), ConnectionState.empty());
        LiveSocket transformed = pipeline.transformConnection(socket, payload, ConnectionState.empty());

        assertEquals(List.of("A", "B"), payload.get("trail"));
        assertEquals("A>B", transformed.assign("trail"));
        assertTrue(transformed.hasCapability("A"));
        assertTrue(transformed.hasCapability("B"));
        assertFalse(socket.hasCapability("A"), "the original socket must not change");
    }

    @Test
    void testPrerequisitesComeFirstWithoutDuplicates() {
        CapabilityRegistry registry = CapabilityRegistry.withDefaults()
                .register(new TrailModule("charts", "query"))
                .register(new TrailModule("dashboard", "charts", "modal"));

        CapabilityPipeline pipeline = registry.resolve(List.of("dashboard", "query", "charts"));

        assertEquals(List.of("core", "query", "charts", "modal", "dashboard"), pipeline.names());
    }

    @Test
    void testPrerequisiteCycleIsRejected() {
        CapabilityRegistry registry = new CapabilityRegistry()
                .register(new CoreCapability())
                .register(new TrailModule("x", "y"))
                .register(new TrailModule("y", "x"));

        assertThrows(ConfigurationException.class, () -> registry.resolve(List.of("x")));
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        CapabilityRegistry registry = CapabilityRegistry.withDefaults();

        assertThrows(ConfigurationException.class, () -> registry.register(new QueryCapability()));
    }

    @Test
    void testCoreCarriesSessionAndStoreIntoAssigns() {
        Map<String, Object> payload = Map.of(
                "session", Map.of("user", "ann"),
                "store", Map.of("count", 1));

        LiveSocket transformed = new CoreCapability().transformConnection(socket, payload, ConnectionState.empty());

        assertEquals(Map.of("user", "ann"), transformed.assign(CoreCapability.SESSION_ASSIGN));
        assertEquals(Map.of("count", 1), transformed.assign(CoreCapability.STORE_ASSIGN));
    }

    @Test
    void testCoreLeavesSocketAloneWithoutSessionOrStore() {
        LiveSocket transformed = new CoreCapability().transformConnection(socket, Map.of(), ConnectionState.empty());

        assertNull(transformed.assign(CoreCapability.STORE_ASSIGN));
        assertNull(transformed.assign(CoreCapability.SESSION_ASSIGN));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueryAliasesValAndDecodesData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", "42");
        data.put("enabled", "true");
        data.put("config", "{\"a\":1}");
        data.put("label", "hello world");
        data.put("code", "007");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("val", "typed");
        raw.put("data", data);

        Map<String, Object> payload = new QueryCapability().transformPayload(raw, ConnectionState.empty());

        assertEquals("typed", payload.get("value"));
        assertEquals("typed", payload.get("val"));
        Map<String, Object> decoded = (Map<String, Object>) payload.get("data");
        assertEquals(42, decoded.get("count"));
        assertEquals(true, decoded.get("enabled"));
        assertEquals(Map.of("a", 1), decoded.get("config"));
        assertEquals("hello world", decoded.get("label"));
        assertEquals("007", decoded.get("code"));
        assertEquals("42", data.get("count"), "the raw payload must not change");
    }

    @Test
    void testQueryDoesNotOverwriteExistingValue() {
        Map<String, Object> payload = new QueryCapability().transformPayload(
                Map.of("val", "a", "value", "b"), ConnectionState.empty());

        assertEquals("b", payload.get("value"));
    }
}
