package com.purchasingpower.archiverag.resolver;

import com.purchasingpower.archiverag.configuration.ResolverProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Pattern Normalizer Tests")
class PatternNormalizerTest {

    private final PatternNormalizer normalizer = new PatternNormalizer(new ResolverProperties().getPatternRules());

    @Test
    @DisplayName("Should strip bracketed, parenthesized and separator suffixes")
    void normalize_ShouldStripDecorations() {
        assertThat(normalizer.normalize("Stephen [QADAO]")).isEqualTo("Stephen");
        assertThat(normalizer.normalize("Alice (Archives)")).isEqualTo("Alice");
        assertThat(normalizer.normalize("Bob - SNET")).isEqualTo("Bob");
        assertThat(normalizer.normalize("Carol | Ambassadors")).isEqualTo("Carol");
    }

    @Test
    @DisplayName("Should collapse whitespace")
    void normalize_ShouldCollapseWhitespace() {
        assertThat(normalizer.normalize("  Mary   Jane  [X] ")).isEqualTo("Mary Jane");
    }

    @Test
    @DisplayName("Hyphenated names without spaces are kept")
    void normalize_ShouldKeepHyphenatedNames() {
        assertThat(normalizer.normalize("Jean-Luc")).isEqualTo("Jean-Luc");
    }

    @Test
    @DisplayName("Rules apply in order")
    void customRules_ShouldApplyInOrder() {
        PatternNormalizer custom = new PatternNormalizer(List.of("^dr\\.?\\s+", "\\s+jr$"));
        assertThat(custom.normalize("Dr. Who Jr")).isEqualTo("Who");
        assertThat(custom.ruleCount()).isEqualTo(2);
    }
}
