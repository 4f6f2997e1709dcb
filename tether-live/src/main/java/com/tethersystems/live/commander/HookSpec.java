package com.tethersystems.live.commander;

import com.tethersystems.live.ConfigurationException;

/**
 * A named hook with its filter.
 *
 * @param name   Hook name, unique within its list
 * @param hook   The callback
 * @param filter Which handlers the hook applies to
 * @param <H>    {@link BeforeHook} or {@link AfterHook}
 */
public record HookSpec<H>(String name, H hook, HookFilter filter) {

    public HookSpec {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Hook name must not be blank");
        }
        if (hook == null) {
            throw new ConfigurationException("Hook '" + name + "' is null");
        }
        filter = filter == null ? HookFilter.none() : filter;
    }
}
