package de.mirkosertic.mcp.codeindex.index;

import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryPlanner Tests")
class QueryPlannerTest {

    private final QueryPlanner planner = new QueryPlanner(new SourceCodeAnalyzer());

    @Test
    @DisplayName("Should build one boosted SHOULD clause per configured field")
    void boostedClauses() {
        // When
        final Query query = planner.plan("parser", IndexConfig.defaultBoosts());

        // Then
        assertThat(query).isInstanceOf(BooleanQuery.class);
        final BooleanQuery booleanQuery = (BooleanQuery) query;
        assertThat(booleanQuery.clauses()).hasSize(3);
        assertThat(booleanQuery.clauses()).allSatisfy(clause -> {
            assertThat(clause.getOccur()).isEqualTo(BooleanClause.Occur.SHOULD);
            assertThat(clause.getQuery()).isInstanceOf(BoostQuery.class);
        });
        final BoostQuery first = (BoostQuery) booleanQuery.clauses().get(0).getQuery();
        assertThat(first.getBoost()).isEqualTo(3.0f);
        assertThat(first.getQuery().toString()).isEqualTo("path_stem:parser");
    }

    @Test
    @DisplayName("Should match nothing without boosts")
    void noBoosts() {
        assertThat(planner.plan("parser", Map.of())).isInstanceOf(MatchNoDocsQuery.class);
    }

    @Test
    @DisplayName("Should ignore boosts for unknown fields")
    void unknownFields() {
        final Map<String, Double> boosts = new LinkedHashMap<>();
        boosts.put("title", 5.0);
        boosts.put(DocumentIndexer.FIELD_CONTENT, 1.0);

        final Query query = planner.plan("parser", boosts);

        assertThat(((BooleanQuery) query).clauses()).hasSize(1);
        assertThat(planner.plan("parser", Map.of("title", 5.0))).isInstanceOf(MatchNoDocsQuery.class);
    }

    @Test
    @DisplayName("Should match nothing for a blank query")
    void blankQuery() {
        assertThat(planner.plan("   ", IndexConfig.defaultBoosts())).isInstanceOf(MatchNoDocsQuery.class);
    }

    @Test
    @DisplayName("Should search invalid syntax literally instead of failing")
    void invalidSyntax() {
        final Query query = planner.plan("foo(bar", Map.of(DocumentIndexer.FIELD_CONTENT, 1.0));

        assertThat(query).isInstanceOf(BooleanQuery.class);
        assertThat(query.toString()).contains("content:foo").contains("content:bar");
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello AND", "hello OR", "hello NOT"})
    @DisplayName("Should search a query with a dangling operator by its terms")
    void danglingOperator(final String queryString) {
        final Query query = planner.plan(queryString, Map.of(DocumentIndexer.FIELD_CONTENT, 1.0));

        assertThat(query).isInstanceOf(BooleanQuery.class);
        assertThat(query.toString()).contains("content:hello");
    }

    @Test
    @DisplayName("Should search a lone operator keyword as a term")
    void loneOperator() {
        final Query query = planner.plan("NOT", Map.of(DocumentIndexer.FIELD_CONTENT, 1.0));

        assertThat(query.toString()).contains("content:not");
    }

    @Test
    @DisplayName("Should split identifiers with the source code analyzer")
    void splitsIdentifiers() {
        final Query query = planner.plan("hello_world", Map.of(DocumentIndexer.FIELD_CONTENT, 1.0));

        assertThat(query.toString()).contains("content:hello").contains("content:world");
    }
}
