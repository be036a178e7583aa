package com.flagship.remittance_ledger.remittance;

public enum RemittanceDirection {
    OUTGOING,
    INCOMING
}
