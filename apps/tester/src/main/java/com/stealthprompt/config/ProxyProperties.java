package com.stealthprompt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound proxy, e.g. an intercepting proxy in front of the target agent.
 */
@Data
@ConfigurationProperties(prefix = "proxy")
public class ProxyProperties {

    public enum Scope {
        /** Agent traffic and text-generation traffic. */
        ALL,
        /** Agent traffic only. */
        WEB,
        /** Text-generation traffic only. */
        API
    }

    private boolean enabled = false;

    /** http://, https://, socks4:// or socks5:// URL; credentials may be embedded. */
    private String url;

    private String username;
    private String password;

    private Scope scope = Scope.ALL;

    public boolean appliesToAgent() {
        return enabled && (scope == Scope.ALL || scope == Scope.WEB);
    }

    public boolean appliesToApi() {
        return enabled && (scope == Scope.ALL || scope == Scope.API);
    }
}
