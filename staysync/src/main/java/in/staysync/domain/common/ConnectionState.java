package in.staysync.domain.common;

/**
 * Connection lifecycle: CONNECTING -> ACTIVE -> CLOSING -> CLOSED.
 */
public enum ConnectionState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
