package com.flagship.remittance_ledger.common;

/**
 * Request headers resolved upstream by the gateway.
 * Tenant and actor identity arrive here already authenticated.
 */
public final class ApiHeaders {

    public static final String TENANT_ID = "X-Tenant-ID";
    public static final String ACTOR_ID = "X-Actor-ID";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private ApiHeaders() {
    }
}
