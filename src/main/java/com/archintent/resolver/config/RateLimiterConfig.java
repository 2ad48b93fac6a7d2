package com.archintent.resolver.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.analysisQps:0}") // 0 = unlimited
    private double analysisRateLimit;

    @Bean("analysisRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter analysisRateLimiter() {
        double effectiveQps = analysisRateLimit > 0 ? analysisRateLimit : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
