package com.tethersystems.live.capability;

import java.util.List;

/**
 * Modal dialogs. Needs the query module on the page.
 */
public class ModalCapability implements CapabilityModule {

    public static final String NAME = "modal";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> prerequisites() {
        return List.of(QueryCapability.NAME);
    }
}
