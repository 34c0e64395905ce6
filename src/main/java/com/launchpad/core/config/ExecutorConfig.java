package com.launchpad.core.config;

import com.launchpad.core.exec.CommandExecutor;
import com.launchpad.core.exec.ProcessCommandExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ExecutorConfig {

    @Bean
    @ConditionalOnMissingBean(CommandExecutor.class)
    public CommandExecutor commandExecutor(LaunchpadProperties properties) {
        int seconds = Math.max(0, properties.getTimeoutSeconds());
        return new ProcessCommandExecutor(Duration.ofSeconds(seconds));
    }

    /**
     * Plain spring-boot-starter has no actuator, so the CLI keeps its own registry.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
