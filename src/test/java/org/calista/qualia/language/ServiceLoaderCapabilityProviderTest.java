package org.calista.qualia.language;

import org.calista.qualia.diagnostics.Diagnostics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceLoaderCapabilityProviderTest {

    private Diagnostics diagnostics;
    private ServiceLoaderCapabilityProvider provider;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics();
        provider = new ServiceLoaderCapabilityProvider(diagnostics, getClass().getClassLoader());
    }

    @Test
    @DisplayName("should pick up a registered analyzer factory")
    void shouldFindRegisteredFactory() {
        LanguageCapabilities caps = provider.forLanguage("XX ");

        assertThat(caps.language).isEqualTo("xx");
        assertThat(caps.hasSyntax).isTrue();
        assertThat(caps.level()).isEqualTo("full");
        assertThat(caps.syntax()).hasValueSatisfying(s -> assertThat(s.subjects("Anything.")).isEmpty());
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should degrade to pattern-only and warn once per language")
    void shouldDegradeWithoutFactory() {
        LanguageCapabilities first = provider.forLanguage("fr");
        LanguageCapabilities second = provider.forLanguage("fr");

        assertThat(first).isSameAs(second);
        assertThat(first.hasSyntax).isFalse();
        assertThat(first.level()).isEqualTo("light");
        assertThat(first.segmenterOrDefault()).isSameAs(RegexSentenceSegmenter.INSTANCE);
        assertThat(diagnostics.withCode("language.no-syntax")).hasSize(1);
    }
}
