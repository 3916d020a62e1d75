package com.govsandbox.approval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine cache of pending and recently resolved approval requests. Entries outlive the approval timeout.
 */
@Configuration
public class ApprovalCacheConfig {

    public static final String APPROVAL_REQUESTS = "approvalRequestCache";

    @Bean(name = APPROVAL_REQUESTS)
    public Cache<String, ApprovalRequest> approvalRequestCache(ApprovalProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getRetention())
                .maximumSize(50_000)
                .build();
    }
}
