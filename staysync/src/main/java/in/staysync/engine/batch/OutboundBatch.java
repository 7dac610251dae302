package in.staysync.engine.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.staysync.domain.common.Channel;
import in.staysync.domain.event.EventEnvelope;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.engine.registry.Outbound;
import in.staysync.engine.registry.OutboundView;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A flushed batch, rendered lazily once per distinct property filter.
 *
 * Each view keeps only the events visible to its filter; a filter that matches nothing gets no
 * message. Views larger than the compression threshold are sent gzip + base64 encoded.
 */
public final class OutboundBatch implements Outbound {

    private final Channel channel;
    private final long seq;
    private final List<EventEnvelope> envelopes;
    private final ObjectMapper mapper;
    private final PayloadCompressor compressor;    // null when compression is off
    private final int compressionThreshold;
    private final long firstSeq;

    private final ConcurrentHashMap<Optional<Long>, Optional<OutboundView>> views = new ConcurrentHashMap<>();
    private volatile boolean compressedAny;

    public OutboundBatch(Channel channel, long seq, List<EventEnvelope> envelopes, ObjectMapper mapper,
                         PayloadCompressor compressor, int compressionThreshold) {
        this.channel = channel;
        this.seq = seq;
        this.envelopes = envelopes;
        this.mapper = mapper;
        this.compressor = compressor;
        this.compressionThreshold = compressionThreshold;
        long min = Long.MAX_VALUE;
        for (EventEnvelope env : envelopes) {
            min = Math.min(min, env.seq());
        }
        this.firstSeq = min;
    }

    @Override
    public OutboundView viewFor(Long propertyFilter) {
        return views.computeIfAbsent(Optional.ofNullable(propertyFilter),
            k -> Optional.ofNullable(render(propertyFilter))).orElse(null);
    }

    /**
     * The events sequenced after {@code mark}, keeping this batch's sequence number. Returns this
     * batch when every event is newer.
     */
    @Override
    public Outbound after(long mark) {
        if (mark < firstSeq) {
            return this;
        }
        List<EventEnvelope> newer = new ArrayList<>(envelopes.size());
        for (EventEnvelope env : envelopes) {
            if (env.seq() > mark) {
                newer.add(env);
            }
        }
        if (newer.isEmpty()) {
            return filter -> null;
        }
        return new OutboundBatch(channel, seq, newer, mapper, compressor, compressionThreshold);
    }

    public long seq() {
        return seq;
    }

    public int size() {
        return envelopes.size();
    }

    public boolean wasCompressed() {
        return compressedAny;
    }

    private OutboundView render(Long propertyFilter) {
        List<EventEnvelope> visible = new ArrayList<>(envelopes.size());
        for (EventEnvelope env : envelopes) {
            if (env.visibleTo(propertyFilter)) {
                visible.add(env);
            }
        }
        if (visible.isEmpty()) {
            return null;
        }

        StreamMessage message = StreamMessage.batch(channel, seq, visible);
        if (compressor != null) {
            String json = toJson(message);
            if (json.getBytes(StandardCharsets.UTF_8).length > compressionThreshold) {
                compressedAny = true;
                message = StreamMessage.compressed(channel, seq, compressor.compress(json));
            }
        }
        return new OutboundView(message, visible.size());
    }

    private String toJson(StreamMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize batch " + channel + "#" + seq, e);
        }
    }
}
