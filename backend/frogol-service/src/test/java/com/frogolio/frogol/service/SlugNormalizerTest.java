package com.frogolio.frogol.service;

import com.frogolio.frogol.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlugNormalizer")
class SlugNormalizerTest {

    @Test
    @DisplayName("Should reduce a pasted URL to its host")
    void shouldReducePastedUrlToHost() {
        assertThat(SlugNormalizer.normalize("HTTPS://WWW.Example.com/abc")).isEqualTo("example-com");
        assertThat(SlugNormalizer.normalize("http://shop.frog.io")).isEqualTo("shop-frog-io");
    }

    @Test
    @DisplayName("Should turn whitespace and underscores into single dashes")
    void shouldCollapseSeparators() {
        assertThat(SlugNormalizer.normalize("  My   Cool Page ")).isEqualTo("my-cool-page");
        assertThat(SlugNormalizer.normalize("a--b__c")).isEqualTo("a-b-c");
        assertThat(SlugNormalizer.normalize("-edge-")).isEqualTo("edge");
    }

    @Test
    @DisplayName("Should treat Unicode spaces like ordinary whitespace")
    void shouldSplitOnUnicodeWhitespace() {
        assertThat(SlugNormalizer.normalize("my\u00A0page")).isEqualTo("my-page");
        assertThat(SlugNormalizer.normalize("\u2003Frog\u3000Pond\u00A0")).isEqualTo("frog-pond");
        assertThat(SlugNormalizer.normalize("\u00A0https://www.frog.io")).isEqualTo("frog-io");
    }

    @Test
    @DisplayName("Should drop characters outside a-z, 0-9 and dash")
    void shouldDropForeignCharacters() {
        assertThat(SlugNormalizer.normalize("Héllo Wörld!")).isEqualTo("hllo-wrld");
        assertThat(SlugNormalizer.normalize("frog#42")).isEqualTo("frog42");
    }

    @ParameterizedTest
    @ValueSource(strings = {"My Page", "HTTPS://WWW.Example.com/abc", "a--b__c", "frog.io", "x_y z"})
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String raw) {
        String once = SlugNormalizer.normalize(raw);

        assertThat(SlugNormalizer.normalize(once)).isEqualTo(once);
        assertThat(once).matches("[a-z0-9]+(-[a-z0-9]+)*");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "___", "!!!", "https://", "---"})
    @DisplayName("Should reject input with nothing left")
    void shouldRejectEmptyResult(String raw) {
        assertThatThrownBy(() -> SlugNormalizer.normalize(raw))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid slug");
    }

    @Test
    @DisplayName("Should reject null")
    void shouldRejectNull() {
        assertThatThrownBy(() -> SlugNormalizer.normalize(null))
                .isInstanceOf(InvalidInputException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Login", "logout", " REGISTER ", "dashboard", "api", "static"})
    @DisplayName("Should reject reserved paths")
    void shouldRejectReserved(String raw) {
        assertThatThrownBy(() -> SlugNormalizer.normalize(raw))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Slug is reserved");
    }
}
