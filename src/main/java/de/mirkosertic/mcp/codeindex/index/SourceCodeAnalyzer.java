package de.mirkosertic.mcp.codeindex.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.core.LowerCaseFilter;
import org.apache.lucene.analysis.icu.ICUFoldingFilter;
import org.apache.lucene.analysis.util.CharTokenizer;

/**
 * Analyzer for paths and source text.
 * <p>
 * Splits on every character that is not a letter or digit, so {@code src/main.py} yields
 * {@code src}, {@code main}, {@code py} and {@code hello_world} yields {@code hello}, {@code world}.
 * Tokens are lowercased and Unicode folded (diacritics, ligatures, full-width forms).
 * <p>
 * Token chain: {@code CharTokenizer(letterOrDigit) -> LowerCaseFilter -> ICUFoldingFilter}
 * <p>
 * Changing this chain invalidates existing indexes; bump {@link DocumentIndexer#SCHEMA_VERSION}.
 */
public class SourceCodeAnalyzer extends Analyzer {

    @Override
    protected TokenStreamComponents createComponents(final String fieldName) {
        final Tokenizer tokenizer = CharTokenizer.fromTokenCharPredicate(Character::isLetterOrDigit);
        TokenStream stream = new LowerCaseFilter(tokenizer);
        stream = new ICUFoldingFilter(stream);
        return new TokenStreamComponents(tokenizer, stream);
    }

    @Override
    protected TokenStream normalize(final String fieldName, final TokenStream in) {
        return new ICUFoldingFilter(new LowerCaseFilter(in));
    }
}
