package com.marketpool.config;

import com.marketpool.domain.MarketFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MarketPoolConfig {

    /**
     * Thresholds for scheduled runs. Each adapter still applies its own floor on top.
     */
    @Bean
    public MarketFilter marketFilter(
            @Value("${marketpool.filter.min-forecasters:0}") int minForecasters,
            @Value("${marketpool.filter.min-comments:0}") int minComments,
            @Value("${marketpool.filter.min-volume:0}") double minVolume,
            @Value("${marketpool.filter.only-open:true}") boolean onlyOpen) {
        return MarketFilter.builder()
                .minForecasters(minForecasters)
                .minComments(minComments)
                .minVolume(minVolume)
                .onlyOpen(onlyOpen)
                .build();
    }
}
