package com.flagship.transaction_etl.config;

import com.flagship.transaction_etl.enrich.AmountBands;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline-wide beans.
 */
@Configuration
public class PipelineConfig {

    /**
     * Must stay in step with the amount_categories seed migration: the loader
     * resolves band names produced here against that table.
     */
    @Bean
    public AmountBands amountBands() {
        return AmountBands.standard();
    }
}
