package com.stealthprompt;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class StealthPromptApplication {

    public static void main(String[] args) {
        log.info("Starting StealthPrompt tester");
        int code = SpringApplication.exit(SpringApplication.run(StealthPromptApplication.class, args));
        log.info("StealthPrompt tester finished with exit code {}", code);
        System.exit(code);
    }
}
