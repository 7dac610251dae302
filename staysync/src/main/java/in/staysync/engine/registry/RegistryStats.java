package in.staysync.engine.registry;

import java.util.Map;

public record RegistryStats(
    int totalConnections,
    int tenants,
    int activeSubscriptions,
    Map<Long, Integer> connectionsPerTenant,
    long droppedTotal,
    long quarantinedTotal
) {}
