package com.flagship.remittance_ledger.ledger;

/**
 * Why a cash ledger entry was written. The sign of the entry's amount carries
 * the direction; the type only says which operation caused it.
 */
public enum CashEntryType {
    /** Customer handed over funding currency for an outgoing transfer. */
    CASH_RECEIVED,
    /** Outgoing transfer opened a debt in the destination currency. */
    DEBT_OPENED,
    /** Incoming transfer made destination-currency funds available. */
    FUNDS_RECEIVED,
    /** Settlement reduced an outgoing debt. */
    SETTLEMENT_DEBT_RELIEF,
    /** Settlement consumed incoming funds. */
    SETTLEMENT_FUNDS_CONSUMED,
    /** Incoming recipient was paid in funding currency. */
    CASH_PAID_OUT,
    /** Cancelled outgoing transfer refunded to the sender. */
    CASH_REFUNDED,
    /** Cancelled outgoing transfer closed its debt. */
    DEBT_CANCELLED,
    /** Cancelled incoming transfer withdrew its funds. */
    FUNDS_RETURNED,
    MANUAL_ADJUSTMENT
}
