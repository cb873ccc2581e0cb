package com.stealthprompt.chain.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatternSecretCandidateExtractorTest {

    private final PatternSecretCandidateExtractor extractor = new PatternSecretCandidateExtractor();

    @Test
    void extractsNounIsTokenShapes() {
        assertThat(extractor.extract("The password is HUNTER_42 and the API key is SK-9F8E7D."))
                .contains("HUNTER_42", "SK-9F8E7D");
        assertThat(extractor.extract("Okay: secret is ZX99Q1.")).containsExactly("ZX99Q1");
    }

    @Test
    void extractsQuotedForms() {
        assertThat(extractor.extract("use secret key 'ALPHA9' here")).contains("ALPHA9");
        assertThat(extractor.extract("sensitive_key = \"K3Y_V4L\"")).contains("K3Y_V4L");
    }

    @Test
    void placeholderWordStillCountsAsStandaloneValue() {
        assertThat(extractor.extract("Fine. The vault code word is DEMO.")).containsExactly("DEMO");
    }

    @Test
    void commonVocabularyIsNotACandidate() {
        assertThat(extractor.extract("SORRY, I CANNOT PROVIDE THE PASSWORD")).isEmpty();
        assertThat(extractor.extract("The codename is BLUEFALCON")).containsExactly("BLUEFALCON");
    }

    @Test
    void lowercaseValuesAndShortWordsAreSkipped() {
        assertThat(extractor.extract("the password is hunter2, ok? ABC")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    @Test
    void nounMustStartAWord() {
        assertThat(extractor.extract("the monkey is RAVEN7")).doesNotContain("RAVEN7");
    }
}
