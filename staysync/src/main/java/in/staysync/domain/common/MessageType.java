package in.staysync.domain.common;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Server to client message kinds.
 */
public enum MessageType {
    EVENT,
    BATCH,
    PING,
    ACK,
    INVALIDATE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
