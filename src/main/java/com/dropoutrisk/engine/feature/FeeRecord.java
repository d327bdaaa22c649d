package com.dropoutrisk.engine.feature;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A fee charged to a student. The import layer sets {@code overdue} once the due date has passed unpaid.
 */
public record FeeRecord(
    String feeType,
    BigDecimal amountDue,
    BigDecimal amountPaid,
    LocalDate dueDate,
    boolean overdue
) {
    public FeeRecord {
        if (amountDue == null || amountDue.signum() < 0) {
            throw new IllegalArgumentException("Amount due must be zero or positive");
        }
        if (amountPaid == null) {
            amountPaid = BigDecimal.ZERO;
        }
    }

    /**
     * Unpaid balance when the fee is overdue, zero otherwise.
     */
    public BigDecimal overdueAmount() {
        if (!overdue) {
            return BigDecimal.ZERO;
        }
        BigDecimal balance = amountDue.subtract(amountPaid);
        return balance.signum() > 0 ? balance : BigDecimal.ZERO;
    }
}
