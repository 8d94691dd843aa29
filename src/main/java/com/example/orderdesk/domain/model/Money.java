package com.example.orderdesk.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Non-negative price amount kept at two decimals. Quotes and payments share one
 * currency, so none is carried.
 */
public final class Money {

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * @throws IllegalArgumentException if the amount is null or negative
     */
    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount.toPlainString());
        }
        return new Money(amount);
    }

    /**
     * Optional price components (urgency charge, discount, tax) count as zero when absent.
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? ZERO : of(amount);
    }

    public Money add(Money other) {
        return new Money(amount.add(other.amount));
    }

    /**
     * @throws IllegalArgumentException if {@code other} is larger, e.g. a discount above the subtotal
     */
    public Money subtract(Money other) {
        BigDecimal result = amount.subtract(other.amount);
        if (result.signum() < 0) {
            throw new IllegalArgumentException(
                    "Cannot take " + other + " off " + this);
        }
        return new Money(result);
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Money)) return false;
        return amount.compareTo(((Money) o).amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
