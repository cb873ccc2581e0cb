package com.stealthprompt.agent.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthprompt.agent.AgentDriver;
import com.stealthprompt.agent.AgentDriverException;
import com.stealthprompt.agent.support.ProxySupport;
import com.stealthprompt.config.AgentProperties;
import com.stealthprompt.config.ProxyProperties;
import com.stealthprompt.util.TextPreview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Talks to an agent exposed as an HTTP chat endpoint.
 *
 * <p>{@code send} dispatches the request and returns at once; {@code receive} waits for that
 * exchange. The reply is read at {@code agent.reply-pointer}, or taken whole when the pointer
 * is blank, the body is not JSON, or the pointer does not resolve.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpAgentDriver implements AgentDriver {

    private final WebClient.Builder webClientBuilder;
    private final AgentProperties props;
    private final ProxyProperties proxy;
    private final ObjectMapper mapper;

    private WebClient webClient;
    private URI endpoint;
    private CompletableFuture<String> pending;

    @Override
    public void start() {
        this.endpoint = validate(props.getUrl());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(props.getMaxInMemoryBytes()))
                .build();

        WebClient.Builder builder = webClientBuilder
                .clone()
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeaders(h -> props.getHeaders().forEach(h::set));
        builder = ProxySupport.configureAgentProxy(builder, proxy, "agent");
        this.webClient = builder.build();
        log.info("[AgentDriver] ready: {} {} (message field '{}', reply pointer '{}')",
                props.getMethod(), endpoint, props.getMessageField(), props.getReplyPointer());
    }

    @Override
    public boolean send(String message) {
        if (webClient == null) {
            log.error("[AgentDriver] send before start");
            return false;
        }
        if (!StringUtils.hasText(message)) {
            log.warn("[AgentDriver] refusing to send an empty message");
            return false;
        }
        cancelPending();
        try {
            Mono<String> exchange = request(message)
                    .exchangeToMono(resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> resp.statusCode().isError()
                                    ? Mono.error(new IllegalStateException("HTTP " + resp.statusCode().value()
                                            + ": " + TextPreview.of(body, 200)))
                                    : Mono.just(body)))
                    .timeout(props.getRequestTimeout());
            this.pending = exchange.toFuture();
            log.info("[AgentDriver] sent: {}", TextPreview.of(message, 200));
            return true;
        } catch (RuntimeException e) {
            log.error("[AgentDriver] cannot dispatch message: {}", e.getMessage());
            this.pending = null;
            return false;
        }
    }

    @Override
    public Optional<String> receive(Duration timeout) {
        CompletableFuture<String> f = pending;
        pending = null;
        if (f == null) {
            log.warn("[AgentDriver] receive without a pending message");
            return Optional.empty();
        }
        String body;
        try {
            body = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("[AgentDriver] no reply within {}s", timeout.toSeconds());
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("[AgentDriver] exchange failed: {}", cause.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return Optional.empty();
        }

        String reply = extractReply(body);
        if (!StringUtils.hasText(reply)) {
            log.warn("[AgentDriver] empty reply");
            return Optional.empty();
        }
        log.info("[AgentDriver] reply: {}", TextPreview.of(reply, 500));
        return Optional.of(reply);
    }

    @Override
    public void close() {
        cancelPending();
        this.webClient = null;
    }

    private WebClient.RequestHeadersSpec<?> request(String message) {
        if (props.getMethod() == AgentProperties.RequestMethod.GET) {
            URI uri = UriComponentsBuilder.fromUri(endpoint)
                    .queryParam(props.getMessageField(), message)
                    .encode()
                    .build()
                    .toUri();
            return webClient.get().uri(uri).accept(MediaType.APPLICATION_JSON, MediaType.ALL);
        }
        Map<String, Object> body = new LinkedHashMap<>(props.getStaticFields());
        body.put(props.getMessageField(), message);
        return webClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON, MediaType.ALL)
                .bodyValue(body);
    }

    String extractReply(String body) {
        if (body == null) return "";
        String pointer = props.getReplyPointer();
        if (!StringUtils.hasText(pointer)) return body.strip();
        try {
            JsonNode node = mapper.readTree(body).at(pointer);
            if (node.isMissingNode() || node.isNull()) {
                log.debug("[AgentDriver] pointer {} not found, using the raw body", pointer);
                return body.strip();
            }
            return (node.isValueNode() ? node.asText() : node.toString()).strip();
        } catch (JsonProcessingException e) {
            return body.strip();
        }
    }

    private void cancelPending() {
        if (pending != null) {
            pending.cancel(true);
            pending = null;
        }
    }

    static URI validate(String url) {
        if (!StringUtils.hasText(url)) {
            throw new AgentDriverException("agent.url is not configured");
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new AgentDriverException("Invalid agent URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new AgentDriverException("Unsupported agent URL scheme '" + scheme + "'; only http and https are allowed");
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new AgentDriverException("Agent URL has no host: " + url);
        }
        return uri;
    }
}
