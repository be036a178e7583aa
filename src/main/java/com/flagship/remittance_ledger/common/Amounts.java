package com.flagship.remittance_ledger.common;

import com.flagship.remittance_ledger.exception.RemittanceValidationException;

import java.math.BigDecimal;

/**
 * Guards for monetary inputs. Face amounts are stored with two decimals,
 * so anything finer would be silently rounded by the database.
 */
public final class Amounts {

    public static final int AMOUNT_SCALE = 2;
    public static final int RATE_SCALE = 6;

    private Amounts() {
    }

    public static BigDecimal requirePositive(BigDecimal value, String field) {
        if (value == null) {
            throw new RemittanceValidationException(field + " is required");
        }
        if (value.signum() <= 0) {
            throw new RemittanceValidationException(field + " must be greater than 0, got " + value.toPlainString());
        }
        return value;
    }

    public static BigDecimal requireAmount(BigDecimal value, String field) {
        requirePositive(value, field);
        if (value.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new RemittanceValidationException(
                    field + " supports at most " + AMOUNT_SCALE + " decimal places, got " + value.toPlainString());
        }
        return value.setScale(AMOUNT_SCALE);
    }

    public static BigDecimal requireRate(BigDecimal value, String field) {
        requirePositive(value, field);
        if (value.stripTrailingZeros().scale() > RATE_SCALE) {
            throw new RemittanceValidationException(
                    field + " supports at most " + RATE_SCALE + " decimal places, got " + value.toPlainString());
        }
        return value.setScale(RATE_SCALE);
    }

    public static BigDecimal nonNegativeOrZero(BigDecimal value, String field) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(AMOUNT_SCALE);
        }
        if (value.signum() < 0) {
            throw new RemittanceValidationException(field + " cannot be negative");
        }
        if (value.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new RemittanceValidationException(
                    field + " supports at most " + AMOUNT_SCALE + " decimal places, got " + value.toPlainString());
        }
        return value.setScale(AMOUNT_SCALE);
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }
}
