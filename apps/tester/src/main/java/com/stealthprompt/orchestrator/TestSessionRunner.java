package com.stealthprompt.orchestrator;

import com.stealthprompt.agent.AgentDriver;
import com.stealthprompt.ai.GenerationException;
import com.stealthprompt.api.dto.TestResult;
import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.config.TesterProperties;
import com.stealthprompt.strategy.PayloadStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schedules tests one after another around a single driver session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TestSessionRunner {

    private final ConversationOrchestrator orchestrator;
    private final AgentDriver driver;
    private final PayloadStrategy strategy;
    private final TesterProperties props;
    private final Pacer pacer;

    /** Every configured test type, {@code tests-per-type} times each. */
    public List<TestResult> runAll(CancellationToken token) {
        List<String> types = props.getTestTypes();
        if (types == null || types.isEmpty()) {
            throw new InvalidTestConfigurationException("No test types configured (tester.test-types)");
        }
        return run(types, props.getTestsPerType(), token);
    }

    public List<TestResult> runSingle(String testType, CancellationToken token) {
        return run(List.of(testType), 1, token);
    }

    /** Initial messages only; the agent is never contacted. */
    public Map<String, String> dryRun(List<String> testTypes) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String type : testTypes) {
            try {
                String message = strategy.nextMessage(type, Transcript.empty());
                log.info("[Session] dry run {}: {}", type, message);
                out.put(type, message);
            } catch (GenerationException e) {
                log.warn("[Session] dry run {}: generation failed: {}", type, e.getMessage());
            }
        }
        return out;
    }

    private List<TestResult> run(List<String> types, int perType, CancellationToken token) {
        for (String type : types) {
            if (!StringUtils.hasText(type)) {
                throw new InvalidTestConfigurationException("Test type must not be blank");
            }
        }

        List<TestResult> results = new ArrayList<>();
        driver.start();
        try {
            boolean first = true;
            scheduling:
            for (String type : types) {
                for (int i = 1; i <= perType; i++) {
                    if (token.isCancelled()) {
                        log.info("[Session] stop requested, skipping remaining tests");
                        break scheduling;
                    }
                    if (!first) {
                        pacer.pause(props.getTestDelay());
                    }
                    first = false;
                    log.info("[Session] test {}/{} for {}", i, perType, type);
                    results.add(orchestrator.runTest(type, token));
                }
            }
        } finally {
            driver.close();
        }
        return results;
    }
}
