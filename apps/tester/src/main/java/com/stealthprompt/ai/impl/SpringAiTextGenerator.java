package com.stealthprompt.ai.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stealthprompt.ai.GenerationException;
import com.stealthprompt.ai.GenerationOptions;
import com.stealthprompt.ai.TextGenerator;
import com.stealthprompt.config.AiProperties;
import com.stealthprompt.util.Fingerprint;
import com.stealthprompt.util.JsonCanonicalizer;
import com.stealthprompt.util.TextPreview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link TextGenerator} over the Spring AI {@link ChatModel}, with a Caffeine cache keyed by
 * the SHA-256 of the canonical request.
 */
@Slf4j
@Component
public class SpringAiTextGenerator implements TextGenerator {

    private final ChatModel chatModel;
    private final AiProperties props;
    private final ObjectMapper mapper;
    private final Cache<String, String> cache;

    public SpringAiTextGenerator(ChatModel chatModel, AiProperties props, ObjectMapper mapper) {
        this.chatModel = chatModel;
        this.props = props;
        this.mapper = mapper;
        AiProperties.Cache c = props.getCache();
        this.cache = c.isEnabled()
                ? Caffeine.newBuilder()
                    .maximumSize(c.getMaximumSize())
                    .expireAfterWrite(c.getTtl())
                    .recordStats()
                    .build()
                : null;
    }

    @Override
    public String generate(String systemInstruction, String userInstruction, GenerationOptions options) {
        requireUsable(systemInstruction, "System instruction");
        requireUsable(userInstruction, "User instruction");
        GenerationOptions opts = options == null ? GenerationOptions.defaults() : options;

        boolean useCache = cache != null && opts.cacheable();
        String key = useCache ? requestKey(systemInstruction, userInstruction, opts) : null;
        if (useCache) {
            String hit = cache.getIfPresent(key);
            if (hit != null) {
                log.info("[TextGen] cache hit {}", Fingerprint.shortId(key));
                return hit;
            }
        }

        log.debug("[TextGen] mode={} system: {}", props.getMode(), TextPreview.of(systemInstruction, 200));
        log.info("[TextGen] user: {}", TextPreview.of(userInstruction, 500));

        Duration timeout = props.getClient().getTimeout();
        String raw;
        try {
            raw = Mono.fromCallable(() -> callModel(systemInstruction, userInstruction, opts))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new GenerationException("Text generation timed out after " + timeout.toSeconds() + "s", cause);
            }
            throw new GenerationException("Text generation failed: " + cause.getMessage(), cause);
        }

        String text = raw == null ? "" : raw.trim();
        log.info("[TextGen] reply ({} chars): {}", text.length(), TextPreview.of(text, 500));

        if (useCache && !text.isEmpty()) {
            cache.put(key, text);
        }
        return text;
    }

    private String callModel(String system, String user, GenerationOptions opts) {
        ChatOptions chatOptions = opts.temperature() == null
                ? null
                : ChatOptions.builder().temperature(opts.temperature()).build();
        Prompt prompt = new Prompt(List.of(new SystemMessage(system), new UserMessage(user)), chatOptions);
        ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        return response.getResult().getOutput().getText();
    }

    private void requireUsable(String instruction, String what) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be empty");
        }
        int max = props.getClient().getMaxPromptChars();
        if (instruction.length() > max) {
            throw new IllegalArgumentException(what + " exceeds maximum length of " + max + " characters");
        }
    }

    private String requestKey(String system, String user, GenerationOptions opts) {
        Map<String, Object> req = new LinkedHashMap<>();
        req.put("mode", props.getMode().name());
        req.put("system", system);
        req.put("user", user);
        req.put("temperature", opts.temperature());
        return Fingerprint.sha256(JsonCanonicalizer.canonicalize(mapper, req));
    }
}
