package com.stealthprompt.cli;

import com.stealthprompt.agent.AgentDriverException;
import com.stealthprompt.api.dto.TestResult;
import com.stealthprompt.config.AiProperties;
import com.stealthprompt.config.TesterProperties;
import com.stealthprompt.orchestrator.CancellationToken;
import com.stealthprompt.orchestrator.InvalidTestConfigurationException;
import com.stealthprompt.orchestrator.TestSessionRunner;
import com.stealthprompt.report.ReportGenerator;
import com.stealthprompt.report.ResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.List;

/**
 * Command line entry.
 *
 * <pre>
 *   (no option)          run every configured test type
 *   --test-type=TYPE     run one test of TYPE
 *   --dry-run            only generate opening messages
 * </pre>
 *
 * Exit code 1 on a configuration error, 2 when results cannot be written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StealthPromptRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPT_TEST_TYPE = "test-type";
    static final String OPT_DRY_RUN = "dry-run";

    private final TestSessionRunner session;
    private final ResultWriter writer;
    private final ReportGenerator reports;
    private final AiProperties ai;
    private final TesterProperties tester;
    private final Environment env;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        String testType = option(args, OPT_TEST_TYPE);
        try {
            validateProvider();

            if (args.containsOption(OPT_DRY_RUN)) {
                List<String> types = testType != null ? List.of(testType) : tester.getTestTypes();
                session.dryRun(types).forEach((type, message) ->
                        log.info("[CLI] {} -> {}", type, message));
                return;
            }

            CancellationToken token = new CancellationToken();
            List<TestResult> results = testType != null
                    ? session.runSingle(testType, token)
                    : session.runAll(token);
            if (results.isEmpty()) {
                log.warn("[CLI] no tests were run");
                return;
            }
            writer.write(results);
            log.info(reports.render(results));
        } catch (InvalidTestConfigurationException | AgentDriverException e) {
            log.error("[CLI] configuration error: {}", e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("[CLI] cannot write results: {}", e.getMessage(), e);
            exitCode = 2;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** The OpenAI-compatible provider needs a real key; a default or unresolved placeholder is rejected. */
    void validateProvider() {
        if (ai.getMode() != AiProperties.Mode.OPENAI) return;
        String key;
        try {
            key = env.getProperty("spring.ai.openai.api-key");
        } catch (IllegalArgumentException e) {
            key = null;
        }
        if (!StringUtils.hasText(key) || "dummy".equalsIgnoreCase(key.trim())
                || (key.startsWith("${") && key.endsWith("}"))) {
            throw new InvalidTestConfigurationException(
                    "OpenAI API key is not set; export OPENAI_API_KEY or switch ai.mode to OLLAMA");
        }
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return null;
        String v = values.get(0);
        return StringUtils.hasText(v) ? v.trim() : null;
    }
}
