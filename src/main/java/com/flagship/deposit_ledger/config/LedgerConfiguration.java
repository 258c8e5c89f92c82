package com.flagship.deposit_ledger.config;

import com.flagship.deposit_ledger.auth.AuthorizationPolicy;
import com.flagship.deposit_ledger.auth.OwnerAuthorizationPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the time source and the authorization collaborator.
 */
@Configuration
@Slf4j
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuthorizationPolicy authorizationPolicy(
            @Value("${ledger.authorization.owner-id}") String ownerId,
            @Value("${ledger.coordinator-id}") String coordinatorId) {
        log.info("Ledger authorization configured: owner={}, coordinator={}", ownerId, coordinatorId);
        return new OwnerAuthorizationPolicy(ownerId, coordinatorId);
    }
}
