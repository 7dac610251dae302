package in.staysync.engine.batch;

import in.staysync.domain.event.EventEnvelope;

import java.util.List;

public record ConflationResult(
    List<EventEnvelope> envelopes,
    int inputCount,
    int outputCount,
    long inputBytes,
    long outputBytes
) {

    public long bytesSaved() {
        return Math.max(0, inputBytes - outputBytes);
    }
}
