package com.flagship.remittance_ledger.settlement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ProfitCalculatorTest {

    @Test
    @DisplayName("Profit is cost at the acquisition rate minus payout at the payout rate")
    void testProfit_PositiveSpread() {
        BigDecimal profit = ProfitCalculator.profit(new BigDecimal("700000.00"),
            new BigDecimal("85000.000000"), new BigDecimal("86000.000000"));

        assertEquals(new BigDecimal("0.095759"), profit);
        assertEquals(6, profit.scale());
    }

    @Test
    @DisplayName("Paying out above the acquisition cost yields a loss")
    void testProfit_NegativeSpread() {
        BigDecimal profit = ProfitCalculator.profit(new BigDecimal("300000"),
            new BigDecimal("85000"), new BigDecimal("84000"));

        assertEquals(new BigDecimal("-0.042017"), profit);
    }

    @Test
    @DisplayName("Equal rates give zero profit")
    void testProfit_EqualRates() {
        BigDecimal profit = ProfitCalculator.profit(new BigDecimal("12345.67"),
            new BigDecimal("1.35"), new BigDecimal("1.35"));

        assertEquals(0, profit.signum());
    }

    @Test
    @DisplayName("Margin per unit ranks higher payout rates first for the same acquisition rate")
    void testMarginPerUnit_Ordering() {
        BigDecimal acq = new BigDecimal("85000");
        BigDecimal high = ProfitCalculator.marginPerUnit(acq, new BigDecimal("90000"));
        BigDecimal low = ProfitCalculator.marginPerUnit(acq, new BigDecimal("84000"));

        assertTrue(high.compareTo(low) > 0);
        assertTrue(high.signum() > 0);
        assertTrue(low.signum() < 0);
    }
}
