package com.flagship.remittance_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RemittanceLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemittanceLedgerApplication.class, args);
    }
}
