package com.github.salilvnair.convflow.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.convflow")
@ComponentScan(basePackages = "com.github.salilvnair.convflow")
@EntityScan(basePackages = "com.github.salilvnair.convflow.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.convflow.repo")
public class ConvFlowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock convFlowClock() {
        return Clock.systemUTC();
    }
}
