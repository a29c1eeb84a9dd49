package com.flagship.transaction_etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TransactionEtlApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionEtlApplication.class, args);
    }
}
