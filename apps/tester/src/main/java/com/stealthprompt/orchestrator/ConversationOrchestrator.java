package com.stealthprompt.orchestrator;

import com.stealthprompt.agent.AgentDriver;
import com.stealthprompt.ai.GenerationException;
import com.stealthprompt.api.dto.ConfirmationDecision;
import com.stealthprompt.api.dto.PendingHit;
import com.stealthprompt.api.dto.TestOutcome;
import com.stealthprompt.api.dto.TestResult;
import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.api.dto.Verdict;
import com.stealthprompt.chain.AttackChainStore;
import com.stealthprompt.chain.InsertResult;
import com.stealthprompt.chain.support.ChainStoreException;
import com.stealthprompt.config.AgentProperties;
import com.stealthprompt.config.TesterProperties;
import com.stealthprompt.judge.SensitivityJudge;
import com.stealthprompt.strategy.PayloadStrategy;
import com.stealthprompt.util.Fingerprint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Drives one test turn by turn.
 *
 * <p>Message source per turn: at turn 1 an explicit seed, else the first stored chain's opening
 * message, else the strategy; from turn 2 a matching stored chain, else the strategy. A flagged
 * reply suspends the run until the operator decides. Day-to-day failures end the test as
 * {@link TestOutcome#INCOMPLETE} with the partial transcript.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationOrchestrator {

    private final AgentDriver driver;
    private final PayloadStrategy strategy;
    private final SensitivityJudge judge;
    private final AttackChainStore store;
    private final OperatorConsole console;
    private final TesterProperties tester;
    private final AgentProperties agent;
    private final Pacer pacer;
    private final Clock clock;

    private volatile TestRun currentRun;

    public TestResult runTest(String testType, CancellationToken token) {
        return runTest(testType, null, token);
    }

    /**
     * @param seedMessage optional first message, used as-is at turn 1
     * @throws InvalidTestConfigurationException when the test type is blank
     */
    public TestResult runTest(String testType, String seedMessage, CancellationToken token) {
        if (!StringUtils.hasText(testType)) {
            throw new InvalidTestConfigurationException("Test type must not be blank");
        }
        CancellationToken cancel = token == null ? new CancellationToken() : token;

        TestRun run = new TestRun(testType);
        currentRun = run;
        run.start();

        LocalDateTime startedAt = LocalDateTime.now(clock);
        int maxTurns = tester.getMaxTurns();
        log.info("[Orchestrator] starting {} (max {} turns)", testType, maxTurns);

        Transcript transcript = Transcript.empty();
        TestOutcome outcome = null;
        int attempted = 0;
        boolean sensitiveFound = false;
        String chainId = null;

        turns:
        for (int turn = 1; turn <= maxTurns; turn++) {
            if (cancel.isCancelled()) {
                log.info("[Orchestrator] stop requested before turn {}", turn);
                outcome = TestOutcome.STOPPED;
                break;
            }
            attempted = turn;

            String message;
            try {
                message = nextMessage(testType, seedMessage, transcript, turn);
            } catch (GenerationException e) {
                log.error("[Orchestrator] turn {}: cannot generate a message: {}", turn, e.getMessage());
                outcome = TestOutcome.INCOMPLETE;
                break;
            }

            if (!driver.send(message)) {
                log.error("[Orchestrator] turn {}: delivery failed", turn);
                outcome = TestOutcome.INCOMPLETE;
                break;
            }
            Optional<String> received = driver.receive(agent.getResponseTimeout());
            if (received.isEmpty()) {
                log.error("[Orchestrator] turn {}: no reply from agent", turn);
                outcome = TestOutcome.INCOMPLETE;
                break;
            }
            String reply = received.get();

            Verdict verdict;
            try {
                verdict = judge.evaluate(reply, testType);
            } catch (GenerationException e) {
                log.error("[Orchestrator] turn {}: sensitivity check failed: {}", turn, e.getMessage());
                outcome = TestOutcome.INCOMPLETE;
                break;
            }

            if (!verdict.sensitive()) {
                transcript = transcript.append(Turn.of(turn, message, reply, verdict));
                paceAfter(turn, maxTurns);
                continue;
            }

            run.pauseForConfirmation();
            log.info("[Orchestrator] turn {}: possible leak ({}), waiting for operator", turn, verdict.source());
            ConfirmationDecision decision = console.review(new PendingHit(testType, turn, message, reply, verdict));
            run.resume();

            switch (decision) {
                case CONFIRMED -> {
                    transcript = transcript.append(Turn.of(turn, message, reply, verdict));
                    sensitiveFound = true;
                    chainId = persist(transcript, testType);
                    outcome = TestOutcome.SUCCESS;
                    if (!console.keepTesting()) {
                        log.info("[Orchestrator] operator asked to stop all remaining tests");
                        cancel.cancel();
                    }
                    break turns;
                }
                case FALSE_POSITIVE, CONTINUE -> {
                    log.info("[Orchestrator] turn {}: operator answered {}, carrying on", turn, decision);
                    transcript = transcript.append(Turn.of(turn, message, reply, verdict.cleared()));
                    paceAfter(turn, maxTurns);
                }
            }
        }

        if (outcome == null) {
            outcome = TestOutcome.COMPLETED;
        }
        run.stop();
        log.info("[Orchestrator] {} finished: {} after {} turns", testType, outcome, attempted);

        return TestResult.builder()
                .testType(testType)
                .outcome(outcome)
                .transcript(transcript)
                .totalTurns(attempted)
                .sensitiveDataFound(sensitiveFound)
                .chainId(chainId)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now(clock))
                .build();
    }

    /** State of the most recent run, IDLE before the first one. */
    public OrchestratorState currentState() {
        TestRun run = currentRun;
        return run == null ? OrchestratorState.IDLE : run.getState();
    }

    private String nextMessage(String testType, String seed, Transcript transcript, int turn) {
        if (turn == 1) {
            if (StringUtils.hasText(seed)) {
                log.info("[Orchestrator] turn 1: using the seed message");
                return seed;
            }
            Optional<String> stored = store.firstMessageFor(testType);
            if (stored.isPresent()) {
                log.info("[Orchestrator] turn 1: opening with a stored chain");
                return stored.get();
            }
        } else {
            Optional<String> next = store.tryContinue(testType, transcript);
            if (next.isPresent()) {
                log.info("[Orchestrator] turn {}: following a stored chain", turn);
                return next.get();
            }
        }
        return strategy.nextMessage(testType, transcript);
    }

    private String persist(Transcript transcript, String testType) {
        try {
            InsertResult result = store.insert(transcript, testType);
            log.info("[Orchestrator] chain {} {}", Fingerprint.shortId(result.entry().getId()),
                    result.inserted() ? "saved" : "was already known");
            return result.entry().getId();
        } catch (ChainStoreException e) {
            log.error("[Orchestrator] confirmed chain could not be saved: {}", e.getMessage(), e);
            return null;
        }
    }

    private void paceAfter(int turn, int maxTurns) {
        if (turn < maxTurns) {
            pacer.pause(tester.getTurnDelay());
        }
    }
}
