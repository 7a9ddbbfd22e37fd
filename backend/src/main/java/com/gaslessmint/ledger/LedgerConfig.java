package com.gaslessmint.ledger;

import com.gaslessmint.domain.UserRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Selects the ledger backing from gaslessmint.ledger.store (memory | mongo). Memory is the default.
 */
@Configuration
public class LedgerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "gaslessmint.ledger", name = "store", havingValue = "memory", matchIfMissing = true)
    public UserStore inMemoryUserStore() {
        return new InMemoryUserStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "gaslessmint.ledger", name = "store", havingValue = "mongo")
    public UserStore mongoUserStore(UserRepository userRepository, MongoTemplate mongoTemplate) {
        return new MongoUserStore(userRepository, mongoTemplate);
    }

    @Bean
    public UserWalletLocks userWalletLocks() {
        return new UserWalletLocks();
    }
}
