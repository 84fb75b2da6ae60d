package com.phillippitts.selfconsistency.config.voting;

import com.phillippitts.selfconsistency.config.properties.VotingProperties;
import com.phillippitts.selfconsistency.service.voting.AnswerClusterer;
import com.phillippitts.selfconsistency.service.voting.NormalizedMatchClusterer;
import com.phillippitts.selfconsistency.service.voting.TokenOverlapClusterer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VotingConfig {

    @Bean
    public AnswerClusterer answerClusterer(VotingProperties props) {
        return switch (props.getStrategy()) {
            case NORMALIZED -> new NormalizedMatchClusterer();
            case OVERLAP -> new TokenOverlapClusterer(props.getOverlapThreshold());
        };
    }
}
