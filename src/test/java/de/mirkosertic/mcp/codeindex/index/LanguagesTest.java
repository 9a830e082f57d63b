package de.mirkosertic.mcp.codeindex.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Languages Tests")
class LanguagesTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "main.py, python",
            "src/App.JSX, javascript",
            "index.ts, typescript",
            "view.tsx, typescript",
            "config.yml, yaml",
            "README.md, markdown",
            "lib.rs, rust",
            "header.h, c",
            "Makefile, text",
            ".bashrc, text",
            "query.sql, sql"
    })
    void languageFromPath(final String path, final String language) {
        assertThat(Languages.fromPath(path)).isEqualTo(language);
    }
}
