package in.staysync.engine.router;

import in.staysync.domain.common.Channel;

/**
 * Exception thrown to a producer when an event could not be published.
 * The delivery engine itself is unaffected.
 */
public class PublishException extends RuntimeException {
    private final Channel channel;
    private final long tenantId;

    public PublishException(Channel channel, long tenantId, String message) {
        super(String.format("[%s:%d] %s", channel, tenantId, message));
        this.channel = channel;
        this.tenantId = tenantId;
    }

    public PublishException(Channel channel, long tenantId, String message, Throwable cause) {
        super(String.format("[%s:%d] %s", channel, tenantId, message), cause);
        this.channel = channel;
        this.tenantId = tenantId;
    }

    public Channel getChannel() {
        return channel;
    }

    public long getTenantId() {
        return tenantId;
    }
}
