package de.mirkosertic.mcp.codeindex.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.util.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Turns a raw query string into a boosted OR over the searchable fields.
 * <p>
 * Each field with a configured boost contributes one {@code field:query^boost} clause. Unknown
 * fields are ignored. Without any usable clause the result matches nothing.
 * Query syntax that the classic parser rejects is retried as an escaped literal, and failing that
 * as the plain analyzed terms.
 */
public class QueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    static final Set<String> SEARCHABLE_FIELDS = Set.of(
            DocumentIndexer.FIELD_PATH,
            DocumentIndexer.FIELD_PATH_STEM,
            DocumentIndexer.FIELD_CONTENT
    );

    private final Analyzer analyzer;

    public QueryPlanner(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Query plan(final String queryString, final Map<String, Double> boosts) {
        if (queryString == null || queryString.isBlank()) {
            return new MatchNoDocsQuery("blank query");
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int clauses = 0;
        for (final Map.Entry<String, Double> boost : boosts.entrySet()) {
            if (!SEARCHABLE_FIELDS.contains(boost.getKey())) {
                logger.debug("Ignoring boost for unknown field {}", boost.getKey());
                continue;
            }
            final Query fieldQuery = parseField(boost.getKey(), queryString);
            builder.add(new BoostQuery(fieldQuery, boost.getValue().floatValue()), BooleanClause.Occur.SHOULD);
            clauses++;
        }

        if (clauses == 0) {
            return new MatchNoDocsQuery("no boosted fields");
        }
        return builder.build();
    }

    private Query parseField(final String field, final String queryString) {
        final QueryParser parser = new QueryParser(field, analyzer);
        try {
            return parser.parse(queryString);
        } catch (final ParseException e) {
            logger.debug("Query '{}' is not valid syntax, searching it literally: {}", queryString, e.getMessage());
            try {
                return parser.parse(QueryParser.escape(queryString));
            } catch (final ParseException escaped) {
                // Dangling AND/OR/NOT survive escaping, fall back to the plain analyzed terms
                final Query terms = new QueryBuilder(analyzer).createBooleanQuery(field, queryString);
                return terms != null ? terms : new MatchNoDocsQuery("no terms in query");
            }
        }
    }
}
