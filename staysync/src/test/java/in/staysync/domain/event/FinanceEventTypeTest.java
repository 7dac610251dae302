package in.staysync.domain.event;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the finance event vocabulary.
 *
 * Tests:
 * - Current names resolve case-insensitively
 * - Legacy transaction names map to the current vocabulary
 * - transaction_approved depends on the entity type
 * - Unknown names are rejected
 * - FinanceEvent normalizes its type on construction
 */
class FinanceEventTypeTest {

    @Test
    void testCurrentNamesResolve() {
        assertEquals(FinanceEventType.EXPENSE_ADDED, FinanceEventType.resolve("expense_added", null));
        assertEquals(FinanceEventType.CASH_BALANCE_UPDATED, FinanceEventType.resolve(" Cash_Balance_Updated ", null));
        assertEquals("daily_approval_granted", FinanceEventType.DAILY_APPROVAL_GRANTED.wireName());
    }

    @Test
    void testLegacyNamesMap() {
        assertEquals(FinanceEventType.REVENUE_ADDED, FinanceEventType.resolve("transaction_created", null));
        assertEquals(FinanceEventType.REVENUE_UPDATED, FinanceEventType.resolve("transaction_updated", null));
        assertEquals(FinanceEventType.REVENUE_DELETED, FinanceEventType.resolve("transaction_deleted", null));
        assertEquals(FinanceEventType.CASH_BALANCE_UPDATED, FinanceEventType.resolve("balance_updated", null));
    }

    @Test
    void testTransactionApprovedDependsOnEntityType() {
        assertEquals(FinanceEventType.EXPENSE_APPROVED, FinanceEventType.resolve("transaction_approved", "expense"));
        assertEquals(FinanceEventType.EXPENSE_APPROVED, FinanceEventType.resolve("transaction_approved", "EXPENSE"));
        assertEquals(FinanceEventType.REVENUE_APPROVED, FinanceEventType.resolve("transaction_approved", "revenue"));
        assertEquals(FinanceEventType.REVENUE_APPROVED, FinanceEventType.resolve("transaction_approved", null));
    }

    @Test
    void testUnknownNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> FinanceEventType.resolve("guest_checked_in", null));
        assertThrows(IllegalArgumentException.class, () -> FinanceEventType.resolve(null, null));
    }

    @Test
    void testFinanceEventNormalizesType() {
        FinanceEvent event = EventFixtures.expense(1L, 10L, "exp-1", "transaction_approved");

        assertEquals("expense_approved", event.eventType());
        assertEquals(FinanceEventType.EXPENSE_APPROVED, event.type());
        assertThrows(IllegalArgumentException.class, () -> EventFixtures.expense(1L, 10L, "exp-1", "bogus"));
    }
}
