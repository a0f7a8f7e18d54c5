package com.menuzy.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

// Fills @CreatedDate columns on users, restaurants, menu categories and menu items.
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
