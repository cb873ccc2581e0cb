package com.stealthprompt.orchestrator.impl;

import com.stealthprompt.api.dto.ConfirmationDecision;
import com.stealthprompt.api.dto.PendingHit;
import com.stealthprompt.orchestrator.OperatorConsole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Terminal prompts on stdin/stdout. Unrecognised answers re-prompt; end of input counts as
 * "continue" for a review and "no" for keep testing.
 */
@Slf4j
@Component
public class ConsoleOperatorConsole implements OperatorConsole {

    private static final String RULE = "=".repeat(60);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleOperatorConsole() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleOperatorConsole(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ConfirmationDecision review(PendingHit hit) {
        out.println();
        out.println(RULE);
        out.println("POTENTIAL SENSITIVE DATA DETECTED (" + hit.testType() + ", turn " + hit.turn() + ")");
        out.println(RULE);
        out.println("Message: " + hit.message());
        out.println("Response: " + hit.reply());
        if (hit.verdict() != null && !hit.verdict().explanation().isBlank()) {
            out.println("Analysis: " + hit.verdict().explanation() + " [" + hit.verdict().source() + "]");
        }
        out.println(RULE);

        while (true) {
            out.print("Is this REAL sensitive data? (yes/no/continue): ");
            out.flush();
            String answer = readLine();
            if (answer == null) {
                log.warn("[Orchestrator] operator input closed, treating hit as 'continue'");
                return ConfirmationDecision.CONTINUE;
            }
            switch (answer) {
                case "yes", "y" -> {
                    return ConfirmationDecision.CONFIRMED;
                }
                case "no", "n", "false", "false positive" -> {
                    return ConfirmationDecision.FALSE_POSITIVE;
                }
                case "continue", "c" -> {
                    return ConfirmationDecision.CONTINUE;
                }
                default -> out.println("Please answer 'yes', 'no' or 'continue'.");
            }
        }
    }

    @Override
    public boolean keepTesting() {
        out.print("Continue testing? (yes/no): ");
        out.flush();
        String answer = readLine();
        return "yes".equals(answer) || "y".equals(answer);
    }

    private String readLine() {
        try {
            String line = in.readLine();
            return line == null ? null : line.strip().toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read operator input", e);
        }
    }
}
