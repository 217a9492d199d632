package com.nevis.ingest.config;

import com.nevis.ingest.infra.BucketRateLimiter;
import com.nevis.ingest.infra.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("chatLimiter")
    public RateLimiter chatLimiter(@Value("${app.gemini.chat-rpm:12}") int rpm) {
        return new BucketRateLimiter(rpm);
    }

    @Bean("fileSearchLimiter")
    public RateLimiter fileSearchLimiter(@Value("${app.gemini.file-search-rpm:60}") int rpm) {
        return new BucketRateLimiter(rpm);
    }
}
