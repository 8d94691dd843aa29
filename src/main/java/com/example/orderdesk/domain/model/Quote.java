package com.example.orderdesk.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Value Object holding the price breakdown of a quotation.
 * The final price defaults to {@code base + urgency + tax - discount}.
 */
public final class Quote {

    private final Money basePrice;
    private final Money urgencyCharge;
    private final Money discount;
    private final Money tax;
    private final Money finalPrice;

    private Quote(Money basePrice, Money urgencyCharge, Money discount, Money tax, Money finalPrice) {
        this.basePrice = basePrice;
        this.urgencyCharge = urgencyCharge;
        this.discount = discount;
        this.tax = tax;
        this.finalPrice = finalPrice;
    }

    /**
     * Builds a quote, deriving the final price when it is not supplied.
     *
     * @throws IllegalArgumentException if any amount is negative, the discount exceeds
     *                                  the gross price, or the final price is not positive
     */
    public static Quote of(BigDecimal basePrice, BigDecimal urgencyCharge, BigDecimal discount,
                           BigDecimal tax, BigDecimal explicitFinalPrice) {
        Objects.requireNonNull(basePrice, "Base price cannot be null");
        Money base = Money.of(basePrice);
        Money urgency = Money.ofNullable(urgencyCharge);
        Money off = Money.ofNullable(discount);
        Money taxes = Money.ofNullable(tax);

        Money gross = base.add(urgency).add(taxes);
        if (off.getAmount().compareTo(gross.getAmount()) > 0) {
            throw new IllegalArgumentException("Discount " + off + " exceeds quoted price " + gross);
        }
        Money finalPrice = explicitFinalPrice != null ? Money.of(explicitFinalPrice) : gross.subtract(off);
        if (!finalPrice.isPositive()) {
            throw new IllegalArgumentException("Final price must be positive");
        }
        return new Quote(base, urgency, off, taxes, finalPrice);
    }

    /**
     * Price before discount as mirrored on the order, base plus urgency.
     */
    public Money basicPrice() {
        return basePrice.add(urgencyCharge);
    }

    public Money getBasePrice() {
        return basePrice;
    }

    public Money getUrgencyCharge() {
        return urgencyCharge;
    }

    public Money getDiscount() {
        return discount;
    }

    public Money getTax() {
        return tax;
    }

    public Money getFinalPrice() {
        return finalPrice;
    }
}
