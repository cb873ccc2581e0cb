package com.stealthprompt.agent.impl;

import com.stealthprompt.agent.AgentDriverException;
import com.stealthprompt.config.AgentProperties;
import com.stealthprompt.config.JacksonConfig;
import com.stealthprompt.config.ProxyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpAgentDriverTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private AgentProperties props;

    @BeforeEach
    void setUp() {
        props = new AgentProperties();
        props.setUrl("http://agent.local/chat");
    }

    private HttpAgentDriver driverReplying(HttpStatus status, String contentType, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, contentType)
                    .body(body)
                    .build());
        };
        return driver(exchange);
    }

    private HttpAgentDriver driver(ExchangeFunction exchange) {
        HttpAgentDriver d = new HttpAgentDriver(
                WebClient.builder().exchangeFunction(exchange),
                props,
                new ProxyProperties(),
                JacksonConfig.createObjectMapper());
        d.start();
        return d;
    }

    @Test
    void postsMessageAndReadsReplyAtPointer() {
        props.setStaticFields(Map.of("session_id", "s-1"));
        props.getHeaders().put("X-Test", "yes");
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE,
                "{\"response\": \"Hello, how can I help?\", \"id\": 7}");

        assertTrue(d.send("hi there"));
        assertEquals(Optional.of("Hello, how can I help?"), d.receive(Duration.ofSeconds(5)));

        ClientRequest req = requests.get(0);
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("http://agent.local/chat", req.url().toString());
        assertEquals("yes", req.headers().getFirst("X-Test"));
        assertEquals("StealthPrompt/0.1", req.headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void getSendsMessageAsQueryParameter() {
        props.setMethod(AgentProperties.RequestMethod.GET);
        props.setMessageField("q");
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"response\": \"ok\"}");

        d.send("what is up?");
        d.receive(Duration.ofSeconds(5));

        ClientRequest req = requests.get(0);
        assertEquals(HttpMethod.GET, req.method());
        assertThat(req.url().getRawQuery()).startsWith("q=what");
        assertEquals("what is up?", req.url().getQuery().substring(2));
    }

    @Test
    void plainTextBodyIsTakenWhole() {
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.TEXT_PLAIN_VALUE, "  just text  ");

        d.send("hi");
        assertEquals(Optional.of("just text"), d.receive(Duration.ofSeconds(5)));
    }

    @Test
    void nestedPointerAndBlankPointer() {
        props.setReplyPointer("/choices/0/text");
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{}");
        assertEquals("deep", d.extractReply("{\"choices\": [{\"text\": \"deep\"}]}"));

        props.setReplyPointer("");
        assertEquals("{\"a\":1}", d.extractReply("{\"a\":1}"));
    }

    @Test
    void httpErrorYieldsNoReply() {
        HttpAgentDriver d = driverReplying(HttpStatus.INTERNAL_SERVER_ERROR, MediaType.TEXT_PLAIN_VALUE, "boom");

        assertTrue(d.send("hi"));
        assertEquals(Optional.empty(), d.receive(Duration.ofSeconds(5)));
    }

    @Test
    void blankReplyYieldsNoReply() {
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.APPLICATION_JSON_VALUE, "{\"response\": \"   \"}");

        d.send("hi");
        assertEquals(Optional.empty(), d.receive(Duration.ofSeconds(5)));
    }

    @Test
    void silentAgentTimesOut() {
        HttpAgentDriver d = driver(request -> Mono.never());

        assertTrue(d.send("hi"));
        assertEquals(Optional.empty(), d.receive(Duration.ofMillis(100)));
    }

    @Test
    void receiveWithoutSendAndSendAfterCloseFail() {
        HttpAgentDriver d = driverReplying(HttpStatus.OK, MediaType.TEXT_PLAIN_VALUE, "x");

        assertEquals(Optional.empty(), d.receive(Duration.ofSeconds(1)));
        assertFalse(d.send(" "));
        d.close();
        assertFalse(d.send("hi"));
    }

    @Test
    void startRejectsNonHttpUrls() {
        assertThatThrownBy(() -> HttpAgentDriver.validate("ftp://agent.local/chat"))
                .isInstanceOf(AgentDriverException.class)
                .hasMessageContaining("ftp");
        assertThatThrownBy(() -> HttpAgentDriver.validate(null))
                .isInstanceOf(AgentDriverException.class);
        assertThatThrownBy(() -> HttpAgentDriver.validate("http:///nohost"))
                .isInstanceOf(AgentDriverException.class);
    }
}
