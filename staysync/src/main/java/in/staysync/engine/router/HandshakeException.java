package in.staysync.engine.router;

import in.staysync.domain.common.ErrorCode;

/**
 * Rejected stream handshake. The connection is never registered.
 */
public class HandshakeException extends RuntimeException {
    private final ErrorCode code;

    public HandshakeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
