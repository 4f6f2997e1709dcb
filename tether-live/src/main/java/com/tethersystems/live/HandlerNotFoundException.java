package com.tethersystems.live;

/**
 * An event named a handler that the commander binding does not register.
 */
public class HandlerNotFoundException extends ConfigurationException {

    private final String handlerName;

    public HandlerNotFoundException(String handlerName) {
        super("Can't find the handler: \"" + handlerName + "\"");
        this.handlerName = handlerName;
    }

    public String getHandlerName() {
        return handlerName;
    }
}
