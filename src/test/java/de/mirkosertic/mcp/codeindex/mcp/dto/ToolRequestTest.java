package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tool request Tests")
class ToolRequestTest {

    @Test
    @DisplayName("Should overlay only the options given in the request")
    void overlay() {
        // Given
        final WalkOptions defaults = WalkOptions.builder()
                .extensions(List.of(".py"))
                .maxFileBytes(100L)
                .build();
        final Map<String, Object> args = new HashMap<>();
        args.put("root", "/repo");
        args.put("includeHidden", true);
        args.put("maxTotalBytes", 500);
        args.put("excludeGlobs", List.of("gen/**"));

        // When
        final IndexDirectoryRequest request = IndexDirectoryRequest.fromMap(args);
        final WalkOptions options = request.toWalkOptions(defaults);

        // Then
        assertThat(request.isForce()).isFalse();
        assertThat(options.extensions()).containsExactly(".py");
        assertThat(options.maxFileBytes()).isEqualTo(100L);
        assertThat(options.includeHidden()).isTrue();
        assertThat(options.maxTotalBytes()).isEqualTo(500L);
        assertThat(options.excludeGlobs()).containsExactly("gen/**");
        assertThat(options.respectGitignore()).isTrue();
    }

    @Test
    @DisplayName("Should drop null list items and ignore non-list values")
    void stringList() {
        assertThat(IndexDirectoryRequest.stringList(Arrays.asList(".py", null, ".md"))).containsExactly(".py", ".md");
        assertThat(IndexDirectoryRequest.stringList(".py")).isNull();
    }

    @Test
    @DisplayName("Should cap the search limit and fall back to the default")
    void searchLimit() {
        assertThat(new SearchRequest("/repo", "q", null, null).effectiveLimit(20)).isEqualTo(20);
        assertThat(new SearchRequest("/repo", "q", 0, null).effectiveLimit(20)).isEqualTo(20);
        assertThat(new SearchRequest("/repo", "q", 5, null).effectiveLimit(20)).isEqualTo(5);
        assertThat(new SearchRequest("/repo", "q", 1000, null).effectiveLimit(20)).isEqualTo(200);
        assertThat(new FindFilesRequest("/repo", "q", null).effectiveLimit()).isEqualTo(50);
    }

    @Test
    @DisplayName("Should only confirm an unlock on an explicit true")
    void unlockConfirmation() {
        assertThat(new UnlockIndexRequest("/repo", null).isConfirmed()).isFalse();
        assertThat(new UnlockIndexRequest("/repo", false).isConfirmed()).isFalse();
        assertThat(new UnlockIndexRequest("/repo", true).isConfirmed()).isTrue();
    }
}
