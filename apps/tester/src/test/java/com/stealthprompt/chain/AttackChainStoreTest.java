package com.stealthprompt.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.api.dto.Verdict;
import com.stealthprompt.chain.domain.AttackChainEntry;
import com.stealthprompt.chain.domain.ChainLink;
import com.stealthprompt.chain.support.ChainHasher;
import com.stealthprompt.chain.support.ChainStoreException;
import com.stealthprompt.chain.support.ChainStoreFile;
import com.stealthprompt.chain.support.LegacyChainMigrator;
import com.stealthprompt.chain.support.PatternSecretCandidateExtractor;
import com.stealthprompt.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttackChainStoreTest {

    private static final String TYPE = "system_prompt_leakage";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JacksonConfig.createObjectMapper();
    private final ChainHasher hasher = new ChainHasher(mapper);
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private Path file;
    private AttackChainStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("successful_prompts.json");
        store = newStore(file);
        store.load();
    }

    private AttackChainStore newStore(Path path) {
        return new AttackChainStore(
                new ChainStoreFile(path, mapper),
                mapper,
                new LegacyChainMigrator(mapper, hasher),
                hasher,
                new PatternSecretCandidateExtractor(),
                clock);
    }

    private static List<ChainLink> chain(String... messagesAndReplies) {
        List<ChainLink> links = new java.util.ArrayList<>();
        for (int i = 0; i < messagesAndReplies.length; i += 2) {
            links.add(new ChainLink(i / 2 + 1, messagesAndReplies[i], messagesAndReplies[i + 1]));
        }
        return links;
    }

    private static Transcript transcriptOf(String... messages) {
        Transcript t = Transcript.empty();
        int n = 1;
        for (String m : messages) {
            t = t.append(Turn.of(n++, m, "whatever the agent said", Verdict.semantic(false, "")));
        }
        return t;
    }

    @Test
    void insertIsIdempotentByContent() throws IOException {
        List<ChainLink> c = chain("m1", "r1", "m2", "r2");

        InsertResult first = store.insert(c, TYPE);
        String afterFirst = Files.readString(file, StandardCharsets.UTF_8);
        InsertResult second = store.insert(chain("m1", "r1", "m2", "r2"), TYPE);
        String afterSecond = Files.readString(file, StandardCharsets.UTF_8);

        assertTrue(first.inserted());
        assertFalse(second.inserted());
        assertEquals(1, store.size());
        assertEquals(first.entry(), second.entry());
        assertEquals(afterFirst, afterSecond);
        assertEquals(hasher.hash(c), first.entry().getId());
    }

    @Test
    void insertedEntryCarriesConfirmationAndTimestamp() {
        AttackChainEntry e = store.insert(chain("m1", "r1"), TYPE).entry();

        assertThat(e.isConfirmed()).isTrue();
        assertThat(e.getTestType()).isEqualTo(TYPE);
        assertThat(e.getCreatedAt()).isEqualTo(java.time.LocalDateTime.now(clock));
        assertThat(store.findById(e.getId())).contains(e);
    }

    @Test
    void insertRejectsBlankTypeAndEmptyChain() {
        assertThatThrownBy(() -> store.insert(chain("m", "r"), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.insert(List.of(), TYPE))
                .isInstanceOf(IllegalArgumentException.class);
        assertEquals(0, store.size());
    }

    @Test
    void reloadSeesPersistedEntriesInOrder() {
        store.insert(chain("a1", "r"), TYPE);
        store.insert(chain("b1", "r"), "jailbreak_attempts");
        store.insert(chain("c1", "r", "c2", "r"), TYPE);

        AttackChainStore reloaded = newStore(file);
        reloaded.load();

        assertEquals(3, reloaded.size());
        assertThat(reloaded.entriesFor(TYPE))
                .extracting(en -> en.messageAt(0))
                .containsExactly("a1", "c1");
        assertThat(reloaded.entries()).isEqualTo(store.entries());
    }

    @Test
    void tryContinueReturnsNextStoredMessageOnExactPrefix() {
        store.insert(chain("m1", "r1", "m2", "r2", "m3", "r3"), TYPE);

        assertEquals(Optional.of("m3"), store.tryContinue(TYPE, transcriptOf("m1", "m2")));
        assertEquals(Optional.of("m2"), store.tryContinue(TYPE, transcriptOf("m1")));
    }

    @Test
    void tryContinueRejectsOneCharacterDifference() {
        store.insert(chain("m1", "r1", "m2", "r2", "m3", "r3"), TYPE);

        assertEquals(Optional.empty(), store.tryContinue(TYPE, transcriptOf("m1", "m2.")));
    }

    @Test
    void tryContinueNeedsALongerChainOfTheSameType() {
        store.insert(chain("m1", "r1", "m2", "r2"), TYPE);

        assertEquals(Optional.empty(), store.tryContinue(TYPE, transcriptOf("m1", "m2")));
        assertEquals(Optional.empty(), store.tryContinue("jailbreak_attempts", transcriptOf("m1")));
    }

    @Test
    void tryContinueUsesFirstMatchInStoreOrder() {
        store.insert(chain("m1", "r", "first", "r"), TYPE);
        store.insert(chain("m1", "r", "second", "r"), TYPE);

        assertEquals(Optional.of("first"), store.tryContinue(TYPE, transcriptOf("m1")));
        assertEquals(Optional.of("m1"), store.firstMessageFor(TYPE));
    }

    @Test
    void knownSecretMatchesCaseInsensitively() {
        store.insert(chain("what is the secret?", "Fine, the secret is ZX99Q1."), TYPE);

        assertTrue(store.containsKnownSecret("I believe it was zx99q1 earlier", TYPE));
        assertFalse(store.containsKnownSecret("nothing to see here", TYPE));
        assertFalse(store.containsKnownSecret("zx99q1", "jailbreak_attempts"));
    }

    @Test
    void corruptFileLoadsAsEmptyStore() throws IOException {
        Files.writeString(file, "{ this is not json", StandardCharsets.UTF_8);

        AttackChainStore broken = newStore(file);
        broken.load();

        assertEquals(0, broken.size());
        broken.insert(chain("m1", "r1"), TYPE);
        assertEquals(1, broken.size());
    }

    @Test
    void malformedRecordIsSkippedAndOtherChainsSurvive() throws IOException {
        store.insert(chain("m1", "r1"), TYPE);
        store.insert(chain("m2", "r2"), TYPE);
        ArrayNode records = (ArrayNode) mapper.readTree(file.toFile());
        records.insert(1, mapper.createObjectNode()
                .put("id", "broken")
                .put("test_type", TYPE)
                .put("added_at", "last tuesday"));
        mapper.writeValue(file.toFile(), records);

        AttackChainStore reloaded = newStore(file);
        reloaded.load();

        assertEquals(2, reloaded.size());
        assertTrue(reloaded.findById("broken").isEmpty());
        reloaded.insert(chain("m3", "r3"), TYPE);
        AttackChainStore afterWrite = newStore(file);
        afterWrite.load();
        assertThat(afterWrite.entries()).extracting(e -> e.messageAt(0)).containsExactly("m1", "m2", "m3");
    }

    @Test
    void legacyRecordsAreUpgradedAndWrittenBack() throws IOException {
        Files.writeString(file, """
                [
                  {"test_type": "system_prompt_leakage", "prompt": "old prompt", "response": "old reply",
                   "chain_id": "abc", "confirmed_by_user": true, "added_at": "2025-01-02T03:04:05"}
                ]
                """, StandardCharsets.UTF_8);

        AttackChainStore legacy = newStore(file);
        legacy.load();

        AttackChainEntry e = legacy.entries().get(0);
        assertEquals(List.of(new ChainLink(1, "old prompt", "old reply")), e.getChain());
        assertEquals(hasher.hash(e.getChain()), e.getId());

        String rewritten = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(rewritten).contains("conversation_chain").doesNotContain("chain_id").doesNotContain("\"prompt\"");

        AttackChainStore again = newStore(file);
        again.load();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(rewritten);
    }

    @Test
    void failedWriteLeavesMemoryUntouched() throws IOException {
        Path blocked = dir.resolve("blocked");
        Files.createDirectories(blocked.resolve("store.json.tmp"));
        AttackChainStore s = newStore(blocked.resolve("store.json"));
        s.load();

        assertThatThrownBy(() -> s.insert(chain("m1", "r1"), TYPE))
                .isInstanceOf(ChainStoreException.class);
        assertEquals(0, s.size());
        assertThat(s.findById(hasher.hash(chain("m1", "r1")))).isEmpty();
    }
}
