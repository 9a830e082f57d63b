package de.mirkosertic.mcp.codeindex.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentFingerprinter Tests")
class ContentFingerprinterTest {

    @Test
    @DisplayName("Should produce the SHA-256 hex digest of the UTF-8 bytes")
    void knownDigests() {
        assertThat(ContentFingerprinter.fingerprint("hello world"))
                .isEqualTo("b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9");
        assertThat(ContentFingerprinter.fingerprint(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    @DisplayName("Should always return 64 lowercase hex characters")
    void format() {
        assertThat(ContentFingerprinter.fingerprint("Grüße \u0000 €"))
                .hasSize(64)
                .matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("Should differ for different content")
    void differs() {
        assertThat(ContentFingerprinter.fingerprint("a")).isNotEqualTo(ContentFingerprinter.fingerprint("b"));
    }
}
