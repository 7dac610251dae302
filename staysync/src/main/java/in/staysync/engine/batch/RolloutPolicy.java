package in.staysync.engine.batch;

/**
 * Decides per tenant whether conflation applies. Must be a pure function of the tenant id,
 * so a tenant is consistently in or out.
 */
@FunctionalInterface
public interface RolloutPolicy {

    boolean includes(long tenantId);

    /**
     * Percentage rollout over a mixed hash of the tenant id. 0 disables, 100 enables everyone.
     */
    static RolloutPolicy percentage(int percent) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("Rollout percent must be within 0..100, got " + percent);
        }
        return tenantId -> bucket(tenantId) < percent;
    }

    static int bucket(long tenantId) {
        return Math.floorMod(Long.hashCode(tenantId * 0x9E3779B97F4A7C15L), 100);
    }
}
