package in.staysync.domain.stream;

import java.util.List;

/**
 * First client frame on a stream connection. Channel names stay raw strings
 * so unknown names surface as handshake errors rather than parse failures.
 */
public record Handshake(
    List<String> channels,
    Integer protocolVersion,
    Long propertyFilter,     // optional single-property scope
    Long lastSeq,            // last sequence seen before reconnect
    String authToken
) {

    public long lastSeqOrZero() {
        return lastSeq == null ? 0L : lastSeq;
    }

    public Handshake withAuthToken(String token) {
        return new Handshake(channels, protocolVersion, propertyFilter, lastSeq, token);
    }
}
