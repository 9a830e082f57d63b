package de.mirkosertic.mcp.codeindex.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CodeIndexException Tests")
class CodeIndexExceptionTest {

    @Test
    @DisplayName("Should render message, reason, fix and steps as text")
    void toText() {
        final IndexException e = new IndexException("Index is locked.", "Another writer is active.",
                "Wait for it to finish.", List.of("unlockIndex root=/repo confirm=true"), null);

        assertThat(e.toText()).isEqualTo("""
                Error: Index is locked.
                Why: Another writer is active.
                How to fix: Wait for it to finish.
                Try:
                - unlockIndex root=/repo confirm=true""");
    }

    @Test
    @DisplayName("Should render only the message when nothing else is known")
    void minimalText() {
        assertThat(new InputException("Missing root directory.", null, null).toText())
                .isEqualTo("Error: Missing root directory.");
    }

    @Test
    @DisplayName("Should prefer the fix as hint in the map form")
    void toMapPrefersFix() {
        final Map<String, Object> payload = new IndexException("Index does not exist.", "No index yet.",
                "Run indexDirectory.", List.of("indexDirectory root=/repo"), null).toMap();

        assertThat(payload).containsExactly(
                Map.entry("type", "index_error"),
                Map.entry("message", "Index does not exist."),
                Map.entry("hint", "Run indexDirectory."),
                Map.entry("try", List.of("indexDirectory root=/repo")));
    }

    @Test
    @DisplayName("Should fall back to the reason as hint and omit empty parts")
    void toMapFallsBackToWhy() {
        final Map<String, Object> payload = new InputException("Binary file detected.", "a.bin is binary.", null).toMap();

        assertThat(payload)
                .containsEntry("type", "input_error")
                .containsEntry("hint", "a.bin is binary.")
                .doesNotContainKey("try");
    }

    @Test
    @DisplayName("Should keep the cause")
    void cause() {
        final RuntimeException cause = new RuntimeException("lock");
        assertThat(new IndexException("Index is locked.", null, null, List.of(), cause)).hasCause(cause);
    }
}
