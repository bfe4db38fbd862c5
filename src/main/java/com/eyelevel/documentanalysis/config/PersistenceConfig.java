package com.eyelevel.documentanalysis.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Enables the JPA repositories. Kept off the application class, web slice tests load without a data source.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.eyelevel.documentanalysis.repository")
public class PersistenceConfig {
}
