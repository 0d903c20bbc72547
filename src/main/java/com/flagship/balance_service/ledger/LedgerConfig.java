package com.flagship.balance_service.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the single process-wide ledger from configuration.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public Ledger ledger(@Value("${ledger.initial-balance:1000}") long initialBalance,
                         @Value("${ledger.initial-bank:0}") long initialBank) {
        log.info("Ledger initialized: balance={}, bank={}", initialBalance, initialBank);
        return new Ledger(initialBalance, initialBank);
    }
}
