package com.tethersystems.live.commander;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the hooks that apply to a handler, keeping their configured order.
 */
public final class HookResolver {

    private HookResolver() {
    }

    /**
     * Names of the hooks that apply to the handler.
     *
     * @param handlerName The handler about to run
     * @param hooks       Configured hooks, in order
     * @return applicable hook names in configuration order; empty for an empty configuration
     */
    public static List<String> resolve(String handlerName, List<? extends HookSpec<?>> hooks) {
        return hooks.stream()
                .filter(spec -> spec.filter().appliesTo(handlerName))
                .map(HookSpec::name)
                .collect(Collectors.toList());
    }

    public static <H> List<HookSpec<H>> applicable(String handlerName, List<HookSpec<H>> hooks) {
        return hooks.stream()
                .filter(spec -> spec.filter().appliesTo(handlerName))
                .collect(Collectors.toList());
    }
}
