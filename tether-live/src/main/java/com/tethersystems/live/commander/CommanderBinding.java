package com.tethersystems.live.commander;

import com.tethersystems.live.ConfigurationException;
import com.tethersystems.live.capability.CapabilityPipeline;
import com.tethersystems.live.capability.CapabilityRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a connection needs to serve one page: event handlers, hooks, lifecycle callbacks
 * and the capability pipeline. Immutable once built; every name is checked at build time.
 *
 * <pre>{@code
 * CommanderBinding binding = CommanderBinding.builder()
 *         .handler("uppercase", (socket, payload) -> ...)
 *         .beforeHook("checkLogin", (socket, payload) -> loggedIn(socket))
 *         .afterHook("audit", (socket, payload, result) -> ..., HookFilter.only("uppercase"))
 *         .onConnect(socket -> ...)
 *         .capabilities("query", "modal")
 *         .build();
 * }</pre>
 */
public final class CommanderBinding {

    private final Map<String, EventHandler> handlers;
    private final List<HookSpec<BeforeHook>> beforeHooks;
    private final List<HookSpec<AfterHook>> afterHooks;
    private final LifecycleCallback onConnect;
    private final LifecycleCallback onLoad;
    private final DisconnectCallback onDisconnect;
    private final CapabilityPipeline pipeline;

    private CommanderBinding(Builder builder, CapabilityPipeline pipeline) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
        this.beforeHooks = List.copyOf(builder.beforeHooks);
        this.afterHooks = List.copyOf(builder.afterHooks);
        this.onConnect = builder.onConnect;
        this.onLoad = builder.onLoad;
        this.onDisconnect = builder.onDisconnect;
        this.pipeline = pipeline;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<EventHandler> handler(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public Set<String> handlerNames() {
        return handlers.keySet();
    }

    public List<HookSpec<BeforeHook>> beforeHooks() {
        return beforeHooks;
    }

    public List<HookSpec<AfterHook>> afterHooks() {
        return afterHooks;
    }

    public List<HookSpec<BeforeHook>> beforeHooksFor(String handlerName) {
        return HookResolver.applicable(handlerName, beforeHooks);
    }

    public List<HookSpec<AfterHook>> afterHooksFor(String handlerName) {
        return HookResolver.applicable(handlerName, afterHooks);
    }

    public Optional<LifecycleCallback> onConnect() {
        return Optional.ofNullable(onConnect);
    }

    public Optional<LifecycleCallback> onLoad() {
        return Optional.ofNullable(onLoad);
    }

    public Optional<DisconnectCallback> onDisconnect() {
        return Optional.ofNullable(onDisconnect);
    }

    public CapabilityPipeline pipeline() {
        return pipeline;
    }

    public static final class Builder {
        private final Map<String, EventHandler> handlers = new LinkedHashMap<>();
        private final List<HookSpec<BeforeHook>> beforeHooks = new ArrayList<>();
        private final List<HookSpec<AfterHook>> afterHooks = new ArrayList<>();
        private final List<String> capabilities = new ArrayList<>();
        private LifecycleCallback onConnect;
        private LifecycleCallback onLoad;
        private DisconnectCallback onDisconnect;
        private CapabilityRegistry registry;

        private Builder() {
        }

        public Builder handler(String name, EventHandler handler) {
            requireName(name, "Handler");
            if (handler == null) {
                throw new ConfigurationException("Handler '" + name + "' is null");
            }
            if (handlers.putIfAbsent(name, handler) != null) {
                throw new ConfigurationException("Duplicate handler: " + name);
            }
            return this;
        }

        public Builder beforeHook(String name, BeforeHook hook) {
            return beforeHook(name, hook, HookFilter.none());
        }

        public Builder beforeHook(String name, BeforeHook hook, HookFilter filter) {
            requireName(name, "Hook");
            beforeHooks.add(new HookSpec<>(name, hook, filter));
            return this;
        }

        public Builder afterHook(String name, AfterHook hook) {
            return afterHook(name, hook, HookFilter.none());
        }

        public Builder afterHook(String name, AfterHook hook, HookFilter filter) {
            requireName(name, "Hook");
            afterHooks.add(new HookSpec<>(name, hook, filter));
            return this;
        }

        public Builder onConnect(LifecycleCallback callback) {
            this.onConnect = callback;
            return this;
        }

        public Builder onLoad(LifecycleCallback callback) {
            this.onLoad = callback;
            return this;
        }

        public Builder onDisconnect(DisconnectCallback callback) {
            this.onDisconnect = callback;
            return this;
        }

        /**
         * Requests capability modules by name. Without this call the defaults from
         * {@link CapabilityRegistry#DEFAULT_CAPABILITIES} are used.
         */
        public Builder capabilities(String... names) {
            Collections.addAll(capabilities, names);
            return this;
        }

        public Builder registry(CapabilityRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Validates and builds the binding.
         *
         * @return the binding
         * @throws ConfigurationException for duplicate hook names, filters naming unknown handlers
         *                                or unknown capabilities
         */
        public CommanderBinding build() {
            validateHooks(beforeHooks, "before");
            validateHooks(afterHooks, "after");
            CapabilityRegistry effectiveRegistry = registry != null ? registry : CapabilityRegistry.withDefaults();
            List<String> requested = capabilities.isEmpty() ? CapabilityRegistry.DEFAULT_CAPABILITIES : capabilities;
            return new CommanderBinding(this, effectiveRegistry.resolve(requested));
        }

        private void validateHooks(List<? extends HookSpec<?>> hooks, String kind) {
            Set<String> names = new HashSet<>();
            for (HookSpec<?> spec : hooks) {
                if (!names.add(spec.name())) {
                    throw new ConfigurationException("Duplicate " + kind + " hook: " + spec.name());
                }
                for (String handlerName : spec.filter().handlers()) {
                    if (!handlers.containsKey(handlerName)) {
                        throw new ConfigurationException(
                                "The " + kind + " hook '" + spec.name() + "' refers to unknown handler '" + handlerName + "'");
                    }
                }
            }
        }

        private static void requireName(String name, String what) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(what + " name must not be blank");
            }
        }
    }
}
