package in.staysync.domain.common;

/**
 * Verified caller identity resolved from a bearer token.
 */
public record Identity(long tenantId, long actorId, String label) {}
