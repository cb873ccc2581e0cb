package com.stealthprompt.agent.support;

import com.stealthprompt.config.ProxyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Proxy wiring for outbound clients. An enabled {@code proxy.*} block wins; otherwise
 * {@code HTTPS_PROXY}/{@code HTTP_PROXY} from the environment are honoured.
 */
@Slf4j
public final class ProxySupport {

    private ProxySupport() {}

    public record ProxySpec(ProxyProvider.Proxy type, String host, int port, String username, String password) {

        public String scheme() {
            return switch (type) {
                case HTTP -> "http";
                case SOCKS4 -> "socks4";
                case SOCKS5 -> "socks5";
            };
        }
    }

    public static WebClient.Builder configureAgentProxy(WebClient.Builder builder, ProxyProperties props, String tag) {
        Optional<ProxySpec> spec = props.isEnabled()
                ? (props.appliesToAgent() ? fromProperties(props) : Optional.empty())
                : fromEnv();
        if (spec.isEmpty()) {
            log.info("[proxy:{}] disabled", tag);
            return builder;
        }
        ProxySpec s = spec.get();
        HttpClient http = HttpClient.create().proxy(p -> {
            ProxyProvider.Builder pb = p.type(s.type()).host(s.host()).port(s.port());
            if (StringUtils.hasText(s.username())) {
                pb.username(s.username());
                if (StringUtils.hasText(s.password())) {
                    pb.password(u -> s.password());
                }
            }
        });
        log.info("[proxy:{}] enabled: {}://{}:{}", tag, s.scheme(), s.host(), s.port());
        return builder.clientConnector(new ReactorClientHttpConnector(http));
    }

    /** Proxy from {@code proxy.*}; explicit username/password override credentials in the URL. */
    public static Optional<ProxySpec> fromProperties(ProxyProperties props) {
        Optional<ProxySpec> parsed = parse(props.getUrl());
        if (parsed.isEmpty()) {
            log.warn("[proxy] proxy.url '{}' is not a usable proxy URL, ignoring", props.getUrl());
            return parsed;
        }
        ProxySpec p = parsed.get();
        if (StringUtils.hasText(props.getUsername())) {
            p = new ProxySpec(p.type(), p.host(), p.port(), props.getUsername(), props.getPassword());
        }
        return Optional.of(p);
    }

    static Optional<ProxySpec> fromEnv() {
        String raw = Optional.ofNullable(System.getenv("HTTPS_PROXY")).orElse(System.getenv("HTTP_PROXY"));
        return parse(raw);
    }

    /** Default port 8080 when the URL has none. */
    public static Optional<ProxySpec> parse(String raw) {
        if (!StringUtils.hasText(raw)) return Optional.empty();
        URI u;
        try {
            u = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String scheme = Optional.ofNullable(u.getScheme()).orElse("http").toLowerCase(Locale.ROOT);
        String host = u.getHost();
        if (!StringUtils.hasText(host)) return Optional.empty();
        int port = u.getPort() > 0 ? u.getPort() : 8080;

        String username = null;
        String password = null;
        String userInfo = u.getUserInfo();
        if (StringUtils.hasText(userInfo)) {
            int idx = userInfo.indexOf(':');
            if (idx >= 0) {
                username = userInfo.substring(0, idx);
                password = userInfo.substring(idx + 1);
            } else {
                username = userInfo;
            }
        }

        ProxyProvider.Proxy type = ProxyProvider.Proxy.HTTP;
        if (scheme.startsWith("socks5")) type = ProxyProvider.Proxy.SOCKS5;
        else if (scheme.startsWith("socks4")) type = ProxyProvider.Proxy.SOCKS4;
        return Optional.of(new ProxySpec(type, host, port, username, password));
    }
}
