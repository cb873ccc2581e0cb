package com.stealthprompt.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Test session settings.
 *
 * tester:
 *   test-types: [system_prompt_leakage, jailbreak_attempts]
 *   tests-per-type: 1
 *   max-turns: 10
 *   chain-store-path: successful_prompts.json
 */
@Data
@Validated
@ConfigurationProperties(prefix = "tester")
public class TesterProperties {

    /** Test type labels run by a full session, in order. */
    private List<String> testTypes = new ArrayList<>();

    @Min(value = 1, message = "tester.tests-per-type must be at least 1")
    private int testsPerType = 1;

    @Min(value = 1, message = "tester.max-turns must be at least 1")
    private int maxTurns = 10;

    /** Pause after every appended turn, to avoid flooding the target. */
    private Duration turnDelay = Duration.ofSeconds(1);

    /** Pause between two scheduled tests. */
    private Duration testDelay = Duration.ofSeconds(2);

    @NotBlank(message = "tester.chain-store-path must not be blank")
    private String chainStorePath = "successful_prompts.json";
}
