package com.purchasingpower.archiverag.util;

import com.purchasingpower.archiverag.exception.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Query Input Validator Tests")
class QueryInputValidatorTest {

    @Test
    @DisplayName("Blank input is rejected")
    void blank_ShouldBeRejected() {
        assertThatThrownBy(() -> QueryInputValidator.validate(null)).isInstanceOf(QueryValidationException.class);
        assertThatThrownBy(() -> QueryInputValidator.validate("   ")).isInstanceOf(QueryValidationException.class);
    }

    @Test
    @DisplayName("Input shorter than three characters is rejected")
    void tooShort_ShouldBeRejected() {
        assertThatThrownBy(() -> QueryInputValidator.validate(" hi "))
            .isInstanceOf(QueryValidationException.class)
            .hasMessageContaining("too short");
    }

    @Test
    @DisplayName("Punctuation-only input is rejected")
    void punctuationOnly_ShouldBeRejected() {
        assertThatThrownBy(() -> QueryInputValidator.validate("?!?..."))
            .isInstanceOf(QueryValidationException.class)
            .hasMessageContaining("meaningful")
            .satisfies(e -> assertThat(((QueryValidationException) e).getInput()).isEqualTo("?!?..."));
    }

    @Test
    @DisplayName("Valid input comes back trimmed")
    void valid_ShouldBeTrimmed() {
        assertThat(QueryInputValidator.validate("  What was decided?  ")).isEqualTo("What was decided?");
    }
}
