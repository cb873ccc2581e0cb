package com.stealthprompt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Text-generation settings shared by payload generation and the semantic classifier.
 *
 * <p>{@code ai.mode} picks the Spring AI {@code ChatModel} (OpenAI-compatible or Ollama); endpoint,
 * key and model id stay under {@code spring.ai.openai.*} / {@code spring.ai.ollama.*} so the
 * Spring AI starters keep honouring them.</p>
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiProperties {

    public enum Mode {
        OPENAI, OLLAMA
    }

    private Mode mode = Mode.OPENAI;

    private Client client = new Client();
    private Cache cache = new Cache();

    @Data
    public static class Client {
        /** Upper bound for one generation call. */
        private Duration timeout = Duration.ofSeconds(120);
        /** Longest system or user instruction accepted. */
        private int maxPromptChars = 50_000;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private long maximumSize = 1_000;
        private Duration ttl = Duration.ofHours(6);
    }
}
