package com.tethersystems.live.commander;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Restricts which handlers a hook applies to.
 *
 * @param kind     Filter kind
 * @param handlers Handler names the filter refers to; empty for {@link Kind#NONE}
 */
public record HookFilter(Kind kind, Set<String> handlers) {

    public enum Kind {
        /** Applies to every handler. */
        NONE,
        /** Applies only to the listed handlers. */
        ONLY,
        /** Applies to every handler except the listed ones. */
        EXCEPT
    }

    private static final HookFilter NONE = new HookFilter(Kind.NONE, Set.of());

    public HookFilter {
        handlers = handlers == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(handlers));
    }

    public static HookFilter none() {
        return NONE;
    }

    public static HookFilter only(String... handlers) {
        return new HookFilter(Kind.ONLY, new LinkedHashSet<>(Arrays.asList(handlers)));
    }

    public static HookFilter except(String... handlers) {
        return new HookFilter(Kind.EXCEPT, new LinkedHashSet<>(Arrays.asList(handlers)));
    }

    public boolean appliesTo(String handlerName) {
        switch (kind) {
            case NONE:
                return true;
            case ONLY:
                return handlers.contains(handlerName);
            case EXCEPT:
                return !handlers.contains(handlerName);
            default:
                throw new IllegalStateException("Unknown filter kind: " + kind);
        }
    }
}
