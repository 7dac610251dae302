package in.staysync.engine.registry;

/**
 * Outcome of one broadcast: matching connections, sends started, messages dropped.
 * Messages held for replaying connections count as sent.
 */
public record BroadcastResult(int recipients, int sent, int dropped) {

    public static final BroadcastResult EMPTY = new BroadcastResult(0, 0, 0);
}
