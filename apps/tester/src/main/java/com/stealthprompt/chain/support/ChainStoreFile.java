package com.stealthprompt.chain.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.stealthprompt.chain.domain.AttackChainEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * The JSON file behind the chain store. Read whole, rewritten whole.
 */
@Slf4j
@RequiredArgsConstructor
public class ChainStoreFile {

    private final Path path;
    private final ObjectMapper mapper;

    public Path path() {
        return path;
    }

    /** Raw records, or empty when the file does not exist yet. */
    public Optional<ArrayNode> read() throws IOException {
        if (!Files.exists(path)) return Optional.empty();
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Optional.of(mapper.createArrayNode());
        }
        if (!root.isArray()) {
            throw new IOException("Chain store " + path + " does not hold a JSON array");
        }
        return Optional.of((ArrayNode) root);
    }

    public void write(List<AttackChainEntry> entries) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("[ChainStore] atomic move unsupported for {}, replacing in place", path);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
