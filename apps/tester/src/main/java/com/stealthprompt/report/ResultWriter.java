package com.stealthprompt.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthprompt.api.dto.TestResult;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.config.OutputProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes session results as {@code penetration_test_results_<timestamp>.json} and/or {@code .txt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultWriter {

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String RULE = "=".repeat(60);
    private static final String THIN = "-".repeat(60);

    private final OutputProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    /** @return the files written */
    public List<Path> write(List<TestResult> results) throws IOException {
        Path dir = Paths.get(props.getResultsDir());
        Files.createDirectories(dir);
        String base = "penetration_test_results_" + LocalDateTime.now(clock).format(FILE_TS);

        List<Path> written = new ArrayList<>();
        if (props.writesJson()) {
            Path json = dir.resolve(base + ".json");
            mapper.writerWithDefaultPrettyPrinter().writeValue(json.toFile(), results);
            written.add(json);
        }
        if (props.writesText()) {
            Path txt = dir.resolve(base + ".txt");
            Files.writeString(txt, renderText(results), StandardCharsets.UTF_8);
            written.add(txt);
        }
        written.forEach(p -> log.info("[Report] results saved to {}", p));
        return written;
    }

    String renderText(List<TestResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("AI Agent Penetration Testing Results\n").append(RULE).append("\n\n");
        int i = 1;
        for (TestResult r : results) {
            sb.append("Test ").append(i++).append(": ").append(r.getTestType()).append('\n')
                    .append(THIN).append('\n')
                    .append("Status: ").append(r.getOutcome().wireName()).append('\n')
                    .append("Sensitive Data Found: ").append(r.isSensitiveDataFound()).append('\n')
                    .append("Total Turns: ").append(r.getTotalTurns()).append('\n')
                    .append("Timestamp: ").append(r.getFinishedAt()).append("\n");
            if (r.getChainId() != null) {
                sb.append("Saved Chain: ").append(r.getChainId()).append('\n');
            }
            sb.append('\n');

            if (r.getTranscript() != null && !r.getTranscript().isEmpty()) {
                sb.append("Conversation History:\n").append(THIN).append('\n');
                for (Turn t : r.getTranscript().turns()) {
                    sb.append("\nTurn ").append(t.ordinal()).append(":\n")
                            .append("Payload: ").append(t.message()).append('\n');
                    if (props.isSaveResponses()) {
                        sb.append("Response: ").append(t.reply()).append('\n');
                    }
                    if (t.sensitive()) {
                        sb.append("[SENSITIVE DATA DETECTED]\n");
                    }
                    sb.append('\n');
                }
            }
            sb.append('\n').append(RULE).append("\n\n");
        }
        return sb.toString();
    }
}
