package com.tethersystems.live.capability;

import com.tethersystems.live.LiveSocket;
import com.tethersystems.live.bridge.PeerReply;
import com.tethersystems.live.bridge.RequestResponseBridge;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Modal dialogs on the page. Calls block until the user closes the dialog.
 */
public class ModalDialogs {

    public static final String MODAL = "modal";

    private final RequestResponseBridge bridge;

    public ModalDialogs(RequestResponseBridge bridge) {
        this.bridge = bridge;
    }

    public PeerReply alert(LiveSocket socket, String title, String body) {
        return alert(socket, title, body, Map.of("ok", "OK"));
    }

    /**
     * Shows a dialog and waits for the user.
     *
     * @param socket  The page
     * @param title   Dialog title
     * @param body    Dialog body, HTML allowed
     * @param buttons Button name to label, e.g. {@code ok -> "Yes"}
     * @return the clicked button and any form values from the dialog
     */
    public PeerReply alert(LiveSocket socket, String title, String body, Map<String, String> buttons) {
        CoreCommands.requireCapability(socket, ModalCapability.NAME);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", title);
        payload.put("body", body);
        payload.put("buttons", buttons);
        return bridge.pushAndWaitForever(socket, MODAL, payload);
    }
}
