package com.flagship.ebank_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EbankLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EbankLedgerApplication.class, args);
    }
}
