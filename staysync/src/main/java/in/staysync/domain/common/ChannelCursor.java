package in.staysync.domain.common;

/**
 * One logical event stream: (tenant, channel).
 */
public record ChannelCursor(long tenantId, Channel channel) {

    public ChannelCursor {
        if (channel == null) {
            throw new IllegalArgumentException("Channel is required");
        }
    }

    public static ChannelCursor of(long tenantId, Channel channel) {
        return new ChannelCursor(tenantId, channel);
    }

    @Override
    public String toString() {
        return tenantId + "/" + channel.wireName();
    }
}
