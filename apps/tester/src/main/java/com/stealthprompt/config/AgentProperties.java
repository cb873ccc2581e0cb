package com.stealthprompt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Target agent endpoint used by the HTTP driver.
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    public enum RequestMethod {
        GET, POST
    }

    /** Chat endpoint of the agent under test (http or https). */
    private String url;

    private RequestMethod method = RequestMethod.POST;

    /** Body field (POST) or query parameter (GET) carrying the message. */
    private String messageField = "message";

    /** JSON pointer of the reply text inside the response body; blank means the whole body. */
    private String replyPointer = "/response";

    /** Extra fields merged into every POST body (session ids, flags). */
    private Map<String, Object> staticFields = new LinkedHashMap<>();

    private Map<String, String> headers = new LinkedHashMap<>();

    /** Bound on one HTTP exchange. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** How long the orchestrator waits for a reply after sending. */
    private Duration responseTimeout = Duration.ofSeconds(60);

    private String userAgent = "StealthPrompt/0.1";

    /** WebClient in-memory buffer limit for one reply. */
    private int maxInMemoryBytes = 1024 * 1024;
}
