package com.example.offlinecache.control;

/**
 * Answer to a {@link ControlMessage}. {@code payload} is the status snapshot for STATUS,
 * a count or list for the other commands.
 */
public final class ControlReply {

    private final String type;
    private final boolean ok;
    private final Object payload;
    private final String error;

    private ControlReply(String type, boolean ok, Object payload, String error) {
        this.type = type;
        this.ok = ok;
        this.payload = payload;
        this.error = error;
    }

    public static ControlReply ok(String type, Object payload) {
        return new ControlReply(type, true, payload, null);
    }

    public static ControlReply failed(String type, String error) {
        return new ControlReply(type, false, null, error);
    }

    public String getType() {
        return type;
    }

    public boolean isOk() {
        return ok;
    }

    public Object getPayload() {
        return payload;
    }

    public String getError() {
        return error;
    }
}
