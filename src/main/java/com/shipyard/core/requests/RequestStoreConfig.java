package com.shipyard.core.requests;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RequestStoreConfig {

    @Bean
    @ConditionalOnMissingBean(RequestStore.class)
    public InMemoryRequestStore inMemoryRequestStore() {
        return new InMemoryRequestStore();
    }
}
