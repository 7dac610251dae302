package in.staysync.domain.event;

import java.util.Locale;
import java.util.Map;

/**
 * Finance event vocabulary, including the mapping for legacy transaction names.
 */
public enum FinanceEventType {
    EXPENSE_ADDED,
    EXPENSE_UPDATED,
    EXPENSE_DELETED,
    EXPENSE_APPROVED,
    EXPENSE_REJECTED,
    REVENUE_ADDED,
    REVENUE_UPDATED,
    REVENUE_DELETED,
    REVENUE_APPROVED,
    REVENUE_REJECTED,
    DAILY_APPROVAL_GRANTED,
    CASH_BALANCE_UPDATED;

    private static final Map<String, FinanceEventType> LEGACY = Map.of(
        "transaction_created", REVENUE_ADDED,
        "transaction_updated", REVENUE_UPDATED,
        "transaction_deleted", REVENUE_DELETED,
        "balance_updated", CASH_BALANCE_UPDATED
    );

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a current or legacy type name. {@code transaction_approved} depends on the entity type.
     *
     * @throws IllegalArgumentException for names outside the vocabulary
     */
    public static FinanceEventType resolve(String typeName, String entityType) {
        if (typeName == null) {
            throw new IllegalArgumentException("Finance event type is required");
        }
        String normalized = typeName.trim().toLowerCase(Locale.ROOT);
        for (FinanceEventType t : values()) {
            if (t.wireName().equals(normalized)) {
                return t;
            }
        }
        if ("transaction_approved".equals(normalized)) {
            return "expense".equalsIgnoreCase(entityType) ? EXPENSE_APPROVED : REVENUE_APPROVED;
        }
        FinanceEventType legacy = LEGACY.get(normalized);
        if (legacy == null) {
            throw new IllegalArgumentException("Unknown finance event type: " + typeName);
        }
        return legacy;
    }
}
