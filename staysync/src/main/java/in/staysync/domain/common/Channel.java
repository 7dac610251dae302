package in.staysync.domain.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Named logical event streams. Wire names are lowercase.
 */
public enum Channel {
    FINANCE,
    GUEST,
    STAFF,
    TASKS,
    PROPERTIES,
    USERS,
    DASHBOARD,
    BRANDING,
    ANALYTICS,
    REPORTS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a wire name, or empty if it names no known channel.
     */
    public static Optional<Channel> lookup(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        for (Channel c : values()) {
            if (c.wireName().equals(wireName.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Channel fromWire(String wireName) {
        return lookup(wireName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown channel: " + wireName));
    }

    @Override
    public String toString() {
        return wireName();
    }
}
