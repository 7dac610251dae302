package in.staysync.engine.registry;

/**
 * Receives connection-fatal delivery outcomes. Implementations tear the connection down.
 */
public interface DeliveryListener {

    void onSendFailure(Connection connection, Throwable cause);

    void onQuarantine(Connection connection);
}
