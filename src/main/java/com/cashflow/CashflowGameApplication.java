package com.cashflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the multiplayer cash-flow board game server.
 */
@SpringBootApplication
public class CashflowGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashflowGameApplication.class, args);
    }
}
