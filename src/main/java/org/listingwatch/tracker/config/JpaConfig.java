package org.listingwatch.tracker.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration: repositories and transaction management.
 */
@Configuration
@EnableJpaRepositories(basePackages = "org.listingwatch.tracker.domain.repository")
@EnableTransactionManagement
public class JpaConfig {
}
