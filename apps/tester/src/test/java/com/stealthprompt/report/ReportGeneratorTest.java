package com.stealthprompt.report;

import com.stealthprompt.api.dto.TestOutcome;
import com.stealthprompt.api.dto.TestResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportGeneratorTest {

    private final ReportGenerator generator =
            new ReportGenerator(Clock.fixed(Instant.parse("2026-02-03T04:05:06Z"), ZoneOffset.UTC));

    private static TestResult result(String type, TestOutcome outcome, int turns, boolean sensitive) {
        return TestResult.builder().testType(type).outcome(outcome).totalTurns(turns)
                .sensitiveDataFound(sensitive).build();
    }

    @Test
    void summarisesTotalsAndPerTypeBreakdown() {
        String report = generator.render(List.of(
                result("system_prompt_leakage", TestOutcome.SUCCESS, 2, true),
                result("system_prompt_leakage", TestOutcome.INCOMPLETE, 1, false),
                result("jailbreak_attempts", TestOutcome.COMPLETED, 10, false)));

        assertThat(report)
                .contains("Generated: 2026-02-03 04:05:06")
                .contains("  Total Tests: 3\n")
                .contains("  Sensitive Data Found: 1\n")
                .contains("  Completed: 2\n")
                .contains("  Failed: 1\n")
                .contains("  Average Turns per Test: 4.3\n")
                .contains("  system_prompt_leakage:\n    Total: 2\n    Sensitive Data Found: 1\n"
                        + "    Completed: 1\n    Failed: 1\n    Avg Turns: 1.5\n")
                .contains("  jailbreak_attempts:\n    Total: 1\n");
        assertThat(report.indexOf("system_prompt_leakage:")).isLessThan(report.indexOf("jailbreak_attempts:"));
    }

    @Test
    void emptySessionAveragesToZero() {
        assertThat(generator.render(List.of()))
                .contains("Total Tests: 0")
                .contains("Average Turns per Test: 0.0");
    }
}
