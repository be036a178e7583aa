package com.flagship.remittance_ledger.remittance;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Human-facing references printed on receipts, e.g. {@code OUT-000042}.
 * Numbers come from one database sequence per direction, so codes never repeat.
 */
@Component
@RequiredArgsConstructor
public class RemittanceCodes {

    static final String OUTGOING_PREFIX = "OUT-";
    static final String INCOMING_PREFIX = "IN-";

    private final JdbcTemplate jdbcTemplate;

    public String nextOutgoing() {
        return format(OUTGOING_PREFIX, nextval("outgoing_remittance_code_seq"));
    }

    public String nextIncoming() {
        return format(INCOMING_PREFIX, nextval("incoming_remittance_code_seq"));
    }

    static String format(String prefix, long number) {
        return prefix + String.format(Locale.ROOT, "%06d", number);
    }

    private long nextval(String sequence) {
        Long value = jdbcTemplate.queryForObject("SELECT nextval('" + sequence + "')", Long.class);
        if (value == null) {
            throw new IllegalStateException("Sequence " + sequence + " returned no value");
        }
        return value;
    }
}
