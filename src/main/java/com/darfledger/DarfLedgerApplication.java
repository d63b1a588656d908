package com.darfledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DarfLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DarfLedgerApplication.class, args);
    }
}
