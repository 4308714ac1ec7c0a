package com.flagship.btc_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BtcLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BtcLedgerApplication.class, args);
    }
}
