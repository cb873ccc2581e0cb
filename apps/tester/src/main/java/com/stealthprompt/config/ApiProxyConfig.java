package com.stealthprompt.config;

import com.stealthprompt.agent.support.ProxySupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import reactor.netty.transport.ProxyProvider;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;

/**
 * Routes the Spring AI {@code RestClient} traffic through {@code proxy.*} when its scope covers
 * the text-generation API.
 */
@Slf4j
@Configuration
public class ApiProxyConfig {

    @Bean
    public RestClientCustomizer apiProxyCustomizer(ProxyProperties proxy, AiProperties ai) {
        return builder -> {
            if (!proxy.appliesToApi()) return;
            ProxySupport.fromProperties(proxy).ifPresent(spec -> {
                if (spec.type() != ProxyProvider.Proxy.HTTP) {
                    log.warn("[proxy:api] {} proxies are not supported for API traffic, connecting directly", spec.scheme());
                    return;
                }
                HttpClient.Builder http = HttpClient.newBuilder()
                        .proxy(ProxySelector.of(new InetSocketAddress(spec.host(), spec.port())))
                        .connectTimeout(ai.getClient().getTimeout());
                if (StringUtils.hasText(spec.username())) {
                    char[] secret = spec.password() == null ? new char[0] : spec.password().toCharArray();
                    http.authenticator(new Authenticator() {
                        @Override
                        protected PasswordAuthentication getPasswordAuthentication() {
                            return getRequestorType() == RequestorType.PROXY
                                    ? new PasswordAuthentication(spec.username(), secret)
                                    : null;
                        }
                    });
                }
                JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http.build());
                factory.setReadTimeout(ai.getClient().getTimeout());
                builder.requestFactory(factory);
                log.info("[proxy:api] enabled: http://{}:{}", spec.host(), spec.port());
            });
        };
    }
}
