package com.stealthprompt.report;

import com.stealthprompt.api.dto.TestResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text session summary with a per-type breakdown.
 */
@Component
@RequiredArgsConstructor
public class ReportGenerator {

    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public String render(List<TestResult> results) {
        Stats total = new Stats();
        Map<String, Stats> byType = new LinkedHashMap<>();
        for (TestResult r : results) {
            total.add(r);
            byType.computeIfAbsent(r.getTestType(), t -> new Stats()).add(r);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("\nAI Agent Penetration Testing Report\n")
                .append("=".repeat(60)).append('\n')
                .append("Generated: ").append(LocalDateTime.now(clock).format(GENERATED)).append("\n\n")
                .append("Summary:\n")
                .append("  Total Tests: ").append(total.total).append('\n')
                .append("  Sensitive Data Found: ").append(total.sensitive).append('\n')
                .append("  Completed: ").append(total.completed).append('\n')
                .append("  Failed: ").append(total.failed).append('\n')
                .append("  Average Turns per Test: ").append(total.averageTurns()).append("\n\n")
                .append("Test Breakdown:\n");

        byType.forEach((type, s) -> sb.append("  ").append(type).append(":\n")
                .append("    Total: ").append(s.total).append('\n')
                .append("    Sensitive Data Found: ").append(s.sensitive).append('\n')
                .append("    Completed: ").append(s.completed).append('\n')
                .append("    Failed: ").append(s.failed).append('\n')
                .append("    Avg Turns: ").append(s.averageTurns()).append("\n\n"));
        return sb.toString();
    }

    private static final class Stats {
        int total;
        int sensitive;
        int completed;
        int failed;
        int turns;

        void add(TestResult r) {
            total++;
            turns += r.getTotalTurns();
            if (r.isSensitiveDataFound()) sensitive++;
            if (r.getOutcome() != null && r.getOutcome().finished()) completed++;
            else failed++;
        }

        String averageTurns() {
            double avg = total == 0 ? 0.0 : (double) turns / total;
            return String.format(Locale.ROOT, "%.1f", avg);
        }
    }
}
