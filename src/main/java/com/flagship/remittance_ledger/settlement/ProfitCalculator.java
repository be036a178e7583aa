package com.flagship.remittance_ledger.settlement;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Spread arithmetic in the funding (home) currency.
 *
 * Rates are debt-currency units per home unit. Settling {@code amount} debt units
 * earns what the outgoing customer paid for them at the acquisition rate minus
 * what the incoming recipient is owed for them at the payout rate.
 */
public final class ProfitCalculator {

    public static final int PROFIT_SCALE = 6;

    private ProfitCalculator() {
    }

    /**
     * {@code amount / acquisitionRate - amount / payoutRate}, rounded HALF_EVEN to 6 places.
     */
    public static BigDecimal profit(BigDecimal amount, BigDecimal acquisitionRate, BigDecimal payoutRate) {
        BigDecimal cost = amount.divide(acquisitionRate, MathContext.DECIMAL128);
        BigDecimal owed = amount.divide(payoutRate, MathContext.DECIMAL128);
        return cost.subtract(owed).setScale(PROFIT_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Profit per debt unit, {@code 1/acquisitionRate - 1/payoutRate}. Unrounded; used only for ranking.
     */
    public static BigDecimal marginPerUnit(BigDecimal acquisitionRate, BigDecimal payoutRate) {
        return BigDecimal.ONE.divide(acquisitionRate, MathContext.DECIMAL128)
            .subtract(BigDecimal.ONE.divide(payoutRate, MathContext.DECIMAL128));
    }
}
