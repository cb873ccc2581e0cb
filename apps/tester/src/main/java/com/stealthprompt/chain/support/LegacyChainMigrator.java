package com.stealthprompt.chain.support;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stealthprompt.chain.domain.ChainLink;
import com.stealthprompt.util.Fingerprint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Upgrades raw store records to the chain shape, in place.
 *
 * <ul>
 *   <li>single-turn records ({@code prompt}/{@code response}, no chain) get a one-link chain</li>
 *   <li>records without an id get the chain hash (or the prompt hash when there is no chain)</li>
 *   <li>the old {@code chain_id} field and top-level {@code prompt}/{@code response} copies are dropped</li>
 * </ul>
 *
 * A second pass over its own output changes nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class LegacyChainMigrator {

    static final String CHAIN = "conversation_chain";
    private static final TypeReference<List<ChainLink>> LINKS = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ChainHasher hasher;

    /** @return true when at least one record changed */
    public boolean migrate(ArrayNode records) {
        boolean migrated = false;
        for (JsonNode node : records) {
            if (!(node instanceof ObjectNode record)) continue;
            try {
                if (migrateRecord(record)) {
                    migrated = true;
                }
            } catch (IllegalArgumentException e) {
                log.warn("[ChainStore] cannot upgrade record, leaving it as is: {}", e.getMessage());
            }
        }
        return migrated;
    }

    private boolean migrateRecord(ObjectNode record) {
        boolean changed = false;

        if (!record.has(CHAIN) && (record.has("prompt") || record.has("response"))) {
            ArrayNode chain = record.putArray(CHAIN);
            ObjectNode link = chain.addObject();
            link.put("turn", 1);
            link.put("payload", text(record, "prompt"));
            link.put("response", text(record, "response"));
            changed = true;
        }

        JsonNode id = record.get("id");
        if (id == null || id.isNull() || id.asText().isBlank()) {
            String computed = record.has(CHAIN)
                    ? hasher.hash(links(record.get(CHAIN)))
                    : Fingerprint.sha256(text(record, "prompt"));
            record.put("id", computed);
            log.debug("[ChainStore] assigned id {} to legacy record", Fingerprint.shortId(computed));
            changed = true;
        }

        if (record.has("chain_id")) {
            record.remove("chain_id");
            changed = true;
        }

        if (record.has(CHAIN)) {
            if (record.has("prompt")) {
                record.remove("prompt");
                changed = true;
            }
            if (record.has("response")) {
                record.remove("response");
                changed = true;
            }
        }
        return changed;
    }

    private List<ChainLink> links(JsonNode chain) {
        if (chain == null || !chain.isArray()) return List.of();
        return mapper.convertValue(chain, LINKS);
    }

    private static String text(ObjectNode record, String field) {
        JsonNode v = record.get(field);
        return (v == null || v.isNull()) ? "" : v.asText();
    }
}
