package com.flagship.cash_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class CashLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashLedgerApplication.class, args);
    }
}
