package com.tethersystems.live.capability;

import com.tethersystems.live.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Known capability modules, looked up by name when a commander binding is built.
 */
public class CapabilityRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityRegistry.class);

    /** Requested when a binding names no capabilities. */
    public static final List<String> DEFAULT_CAPABILITIES = List.of(QueryCapability.NAME, ModalCapability.NAME);

    private final Map<String, CapabilityModule> modules = new LinkedHashMap<>();

    /**
     * A registry holding the built-in modules: core, query and modal.
     *
     * @return a new registry
     */
    public static CapabilityRegistry withDefaults() {
        return new CapabilityRegistry()
                .register(new CoreCapability())
                .register(new QueryCapability())
                .register(new ModalCapability());
    }

    public CapabilityRegistry register(CapabilityModule module) {
        if (modules.putIfAbsent(module.name(), module) != null) {
            throw new ConfigurationException("Capability already registered: " + module.name());
        }
        return this;
    }

    public boolean contains(String name) {
        return modules.containsKey(name);
    }

    /**
     * Resolves requested names into a pipeline: core first, every prerequisite before the
     * modules that need it, no duplicates.
     *
     * @param requested Requested module names, in order
     * @return the resolved pipeline
     * @throws ConfigurationException for unknown names or prerequisite cycles
     */
    public CapabilityPipeline resolve(Collection<String> requested) {
        Set<String> ordered = new LinkedHashSet<>();
        visit(CoreCapability.NAME, ordered, new HashSet<>());
        for (String name : requested) {
            visit(name, ordered, new HashSet<>());
        }
        List<CapabilityModule> resolved = new ArrayList<>(ordered.size());
        for (String name : ordered) {
            resolved.add(modules.get(name));
        }
        logger.debug("Resolved capabilities {} to {}", requested, ordered);
        return new CapabilityPipeline(resolved);
    }

    private void visit(String name, Set<String> ordered, Set<String> visiting) {
        if (ordered.contains(name)) {
            return;
        }
        CapabilityModule module = modules.get(name);
        if (module == null) {
            throw new ConfigurationException("Unknown capability: " + name);
        }
        if (!visiting.add(name)) {
            throw new ConfigurationException("Capability prerequisites form a cycle at: " + name);
        }
        for (String prerequisite : module.prerequisites()) {
            visit(prerequisite, ordered, visiting);
        }
        visiting.remove(name);
        ordered.add(name);
    }
}
