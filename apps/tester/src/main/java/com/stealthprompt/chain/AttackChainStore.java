package com.stealthprompt.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.stealthprompt.api.dto.Transcript;
import com.stealthprompt.api.dto.Turn;
import com.stealthprompt.chain.domain.AttackChainEntry;
import com.stealthprompt.chain.domain.ChainLink;
import com.stealthprompt.chain.support.ChainHasher;
import com.stealthprompt.chain.support.ChainStoreException;
import com.stealthprompt.chain.support.ChainStoreFile;
import com.stealthprompt.chain.support.LegacyChainMigrator;
import com.stealthprompt.chain.support.SecretCandidateExtractor;
import com.stealthprompt.util.Fingerprint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Confirmed attack chains, content-addressed by {@link ChainHasher}.
 *
 * <p>Entries keep insertion order in {@code entries}; {@code byId} answers duplicate checks
 * without a scan. The whole file is rewritten after every insert. Single-threaded use only.</p>
 *
 * <p>Prefix replay compares sent messages only. A stored chain keeps feeding its next message
 * even when the live agent answered differently, so a replayed message may no longer fit the
 * conversation.</p>
 */
@Slf4j
public class AttackChainStore {

    private final ChainStoreFile file;
    private final ObjectMapper mapper;
    private final LegacyChainMigrator migrator;
    private final ChainHasher hasher;
    private final SecretCandidateExtractor extractor;
    private final Clock clock;

    private final List<AttackChainEntry> entries = new ArrayList<>();
    private final Map<String, AttackChainEntry> byId = new HashMap<>();
    private final Map<String, Set<String>> candidatesById = new HashMap<>();

    public AttackChainStore(ChainStoreFile file,
                            ObjectMapper mapper,
                            LegacyChainMigrator migrator,
                            ChainHasher hasher,
                            SecretCandidateExtractor extractor,
                            Clock clock) {
        this.file = file;
        this.mapper = mapper;
        this.migrator = migrator;
        this.hasher = hasher;
        this.extractor = extractor;
        this.clock = clock;
    }

    /**
     * Replaces the in-memory collection with the file content, upgrading legacy records.
     * A malformed record is skipped and dropped at the next write; an unreadable file leaves the store empty.
     */
    public void load() {
        entries.clear();
        byId.clear();
        candidatesById.clear();

        Optional<ArrayNode> raw;
        try {
            raw = file.read();
        } catch (IOException | RuntimeException e) {
            log.warn("[ChainStore] cannot read {}, starting empty: {}", file.path(), e.getMessage());
            return;
        }
        if (raw.isEmpty()) {
            log.info("[ChainStore] no store at {}, starting empty", file.path());
            return;
        }

        boolean migrated = migrator.migrate(raw.get());
        int index = 0;
        for (JsonNode record : raw.get()) {
            index++;
            AttackChainEntry entry;
            try {
                entry = mapper.convertValue(record, AttackChainEntry.class);
            } catch (IllegalArgumentException e) {
                log.warn("[ChainStore] skipping malformed record #{} in {}: {}", index, file.path(), e.getMessage());
                continue;
            }
            if (entry == null) continue;
            if (byId.containsKey(entry.getId())) {
                log.debug("[ChainStore] skipping duplicate record {}", Fingerprint.shortId(entry.getId()));
                continue;
            }
            entries.add(entry);
            byId.put(entry.getId(), entry);
        }

        if (migrated) {
            try {
                file.write(entries);
                log.info("[ChainStore] migrated legacy records in {}", file.path());
            } catch (IOException e) {
                log.warn("[ChainStore] migration write-back to {} failed: {}", file.path(), e.getMessage());
            }
        }
        log.info("[ChainStore] loaded {} chains from {}", entries.size(), file.path());
    }

    /**
     * Persists a confirmed chain unless an identical one is stored already.
     *
     * @throws IllegalArgumentException on a blank test type or an empty chain
     * @throws ChainStoreException      when the file cannot be written; memory is unchanged
     */
    public InsertResult insert(List<ChainLink> chain, String testType) {
        if (testType == null || testType.isBlank()) {
            throw new IllegalArgumentException("testType must not be blank");
        }
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("chain must not be empty");
        }

        String id = hasher.hash(chain);
        AttackChainEntry existing = byId.get(id);
        if (existing != null) {
            log.info("[ChainStore] chain {} already stored", Fingerprint.shortId(id));
            return new InsertResult(existing, false);
        }

        AttackChainEntry entry = AttackChainEntry.builder()
                .id(id)
                .testType(testType)
                .chain(List.copyOf(chain))
                .confirmed(true)
                .createdAt(LocalDateTime.now(clock))
                .build();

        entries.add(entry);
        byId.put(id, entry);
        try {
            file.write(entries);
        } catch (IOException e) {
            entries.remove(entries.size() - 1);
            byId.remove(id);
            throw new ChainStoreException("Cannot write chain store " + file.path(), e);
        }
        log.info("[ChainStore] stored chain {} ({} turns, type={})", Fingerprint.shortId(id), chain.size(), testType);
        return new InsertResult(entry, true);
    }

    public InsertResult insert(Transcript transcript, String testType) {
        return insert(toChain(transcript), testType);
    }

    public List<AttackChainEntry> entriesFor(String testType) {
        return entries.stream()
                .filter(e -> Objects.equals(e.getTestType(), testType))
                .toList();
    }

    public List<AttackChainEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public Optional<AttackChainEntry> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return entries.size();
    }

    /** Opening message of the first stored chain of this type. */
    public Optional<String> firstMessageFor(String testType) {
        return entriesFor(testType).stream()
                .filter(AttackChainEntry::hasChain)
                .findFirst()
                .map(e -> e.messageAt(0));
    }

    /**
     * Next stored message when the live sent messages are an exact prefix of a longer stored chain.
     */
    public Optional<String> tryContinue(String testType, Transcript transcript) {
        List<String> sent = transcript.sentMessages();
        for (AttackChainEntry entry : entriesFor(testType)) {
            if (!entry.hasChain() || entry.length() <= sent.size()) continue;
            if (isPrefix(sent, entry.getChain())) {
                log.debug("[ChainStore] transcript follows chain {}", Fingerprint.shortId(entry.getId()));
                return Optional.of(entry.messageAt(sent.size()));
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the reply repeats a secret value seen in a confirmed reply of the same type.
     * Case-insensitive substring match.
     */
    public boolean containsKnownSecret(String reply, String testType) {
        if (reply == null || reply.isBlank()) return false;
        String haystack = reply.toLowerCase(Locale.ROOT);
        for (AttackChainEntry entry : entriesFor(testType)) {
            for (String candidate : candidatesOf(entry)) {
                if (haystack.contains(candidate.toLowerCase(Locale.ROOT))) {
                    log.info("[ChainStore] reply repeats a known secret from chain {}", Fingerprint.shortId(entry.getId()));
                    return true;
                }
            }
        }
        return false;
    }

    private Set<String> candidatesOf(AttackChainEntry entry) {
        return candidatesById.computeIfAbsent(entry.getId(), id -> {
            Set<String> out = new LinkedHashSet<>();
            if (entry.hasChain()) {
                for (ChainLink link : entry.getChain()) {
                    out.addAll(extractor.extract(link.response()));
                }
            }
            return out;
        });
    }

    private static boolean isPrefix(List<String> sent, List<ChainLink> chain) {
        for (int i = 0; i < sent.size(); i++) {
            if (!Objects.equals(sent.get(i), chain.get(i).payload())) return false;
        }
        return true;
    }

    static List<ChainLink> toChain(Transcript transcript) {
        List<ChainLink> links = new ArrayList<>(transcript.size());
        for (Turn t : transcript.turns()) {
            links.add(new ChainLink(t.ordinal(), t.message(), t.reply()));
        }
        return links;
    }
}
