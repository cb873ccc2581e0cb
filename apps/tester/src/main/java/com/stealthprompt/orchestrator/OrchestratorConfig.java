package com.stealthprompt.orchestrator;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OrchestratorConfig {

    @Bean
    public Pacer pacer() {
        return Pacer.sleeping();
    }
}
