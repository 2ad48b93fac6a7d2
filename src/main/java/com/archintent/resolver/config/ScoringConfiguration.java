package com.archintent.resolver.config;

import com.archintent.resolver.model.ScoringPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScoringConfiguration {

    @Value("${app.scoring.ownership-bonus:5}")
    private int ownershipBonus;

    @Value("${app.scoring.high-threshold:5}") // score at which a vocabulary-only domain becomes HIGH
    private int highThreshold;

    @Value("${app.scoring.default-trigger-weight:3}")
    private int defaultTriggerWeight;

    @Bean
    public ScoringPolicy scoringPolicy() {
        return new ScoringPolicy(
                Math.max(1, ownershipBonus),
                Math.max(1, highThreshold),
                Math.max(1, defaultTriggerWeight));
    }
}
