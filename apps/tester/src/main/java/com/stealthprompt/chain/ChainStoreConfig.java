package com.stealthprompt.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stealthprompt.chain.support.ChainHasher;
import com.stealthprompt.chain.support.ChainStoreFile;
import com.stealthprompt.chain.support.LegacyChainMigrator;
import com.stealthprompt.chain.support.PatternSecretCandidateExtractor;
import com.stealthprompt.chain.support.SecretCandidateExtractor;
import com.stealthprompt.config.TesterProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class ChainStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ChainHasher chainHasher(ObjectMapper objectMapper) {
        return new ChainHasher(objectMapper);
    }

    @Bean
    public SecretCandidateExtractor secretCandidateExtractor() {
        return new PatternSecretCandidateExtractor();
    }

    @Bean
    public AttackChainStore attackChainStore(TesterProperties props,
                                             ObjectMapper objectMapper,
                                             ChainHasher hasher,
                                             SecretCandidateExtractor extractor,
                                             Clock clock) {
        AttackChainStore store = new AttackChainStore(
                new ChainStoreFile(Paths.get(props.getChainStorePath()), objectMapper),
                objectMapper,
                new LegacyChainMigrator(objectMapper, hasher),
                hasher,
                extractor,
                clock);
        store.load();
        return store;
    }
}
