package com.phillippitts.selfconsistency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.selfconsistency.config.properties.ThreadPoolProperties.class,
        com.phillippitts.selfconsistency.config.properties.ReasoningProperties.class,
        com.phillippitts.selfconsistency.config.properties.VotingProperties.class,
        com.phillippitts.selfconsistency.config.properties.ConfidenceProperties.class,
        com.phillippitts.selfconsistency.config.properties.PricingProperties.class,
        com.phillippitts.selfconsistency.config.properties.ProviderProperties.class
})
public class SelfConsistencyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelfConsistencyApplication.class, args);
    }

}
