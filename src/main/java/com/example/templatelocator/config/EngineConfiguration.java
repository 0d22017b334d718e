package com.example.templatelocator.config;

import com.example.templatelocator.service.matching.BestMatchFinder;
import com.example.templatelocator.service.matching.GreedyNonMaximumSuppression;
import com.example.templatelocator.service.matching.TemplateMatchEngine;
import com.example.templatelocator.service.matching.TopKExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stateless matching components. The suppression divisor and the
 * candidate pool multiplier come from {@link MatchingProperties} so they can
 * be tuned without code changes.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public BestMatchFinder bestMatchFinder() {
        return new BestMatchFinder();
    }

    @Bean
    public TopKExtractor topKExtractor(MatchingProperties properties) {
        return new TopKExtractor(properties.getSuppressionDivisor());
    }

    @Bean
    public GreedyNonMaximumSuppression greedyNonMaximumSuppression() {
        return new GreedyNonMaximumSuppression();
    }

    @Bean
    public TemplateMatchEngine templateMatchEngine(BestMatchFinder bestMatchFinder,
                                                   TopKExtractor topKExtractor,
                                                   GreedyNonMaximumSuppression suppression,
                                                   MatchingProperties properties) {
        log.info("Template match engine: suppression radius = template / {}, candidate pool = results x {}",
                properties.getSuppressionDivisor(), properties.getCandidateMultiplier());
        return new TemplateMatchEngine(bestMatchFinder, topKExtractor, suppression, properties.getCandidateMultiplier());
    }
}
