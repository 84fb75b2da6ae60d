package com.phillippitts.selfconsistency.config.pricing;

import com.phillippitts.selfconsistency.config.properties.PricingProperties;
import com.phillippitts.selfconsistency.service.accounting.PriceTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PricingConfig {

    @Bean
    public PriceTable priceTable(PricingProperties properties) {
        return PriceTable.from(properties);
    }
}
