package in.staysync.domain.common;

/**
 * Codes carried by {@code error} stream messages.
 */
public enum ErrorCode {
    INVALID_ARGUMENT,
    UNAUTHENTICATED,
    INTERNAL
}
