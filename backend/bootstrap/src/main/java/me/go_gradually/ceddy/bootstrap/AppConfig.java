package me.go_gradually.ceddy.bootstrap;

import me.go_gradually.ceddy.infrastructure.shared.config.AppProperties;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
@EnableJpaRepositories(basePackages = "me.go_gradually.ceddy.infrastructure")
@EntityScan(basePackages = "me.go_gradually.ceddy.infrastructure")
public class AppConfig {
}
