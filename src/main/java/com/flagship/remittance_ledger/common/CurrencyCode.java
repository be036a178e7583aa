package com.flagship.remittance_ledger.common;

/**
 * ISO-4217 currency codes handled by the exchange.
 *
 * Debt currencies (the destination side of a remittance) and funding currencies
 * (what the customer pays in locally) share this list.
 */
public enum CurrencyCode {
    IRR, // Iranian Rial
    CAD, // Canadian Dollar
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    AED, // UAE Dirham
    TRY, // Turkish Lira
    AFN; // Afghan Afghani

    /**
     * Parses a currency code, case-insensitive.
     *
     * @throws IllegalArgumentException if the code is not supported
     */
    public static CurrencyCode of(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + code);
        }
    }
}
