package com.disease.coding.resolver;

import com.disease.coding.catalog.CatalogSeed;
import com.disease.coding.catalog.DiseaseCatalog;
import com.disease.coding.catalog.InMemoryDiseaseCatalog;
import com.disease.coding.core.model.CodeEntry;
import com.disease.coding.core.model.CodeEntryUpdate;
import com.disease.coding.core.model.MatchResult;
import com.disease.coding.core.model.MatchType;
import com.disease.coding.similarity.SimilarityScorer;
import com.disease.coding.similarity.WeightedRatioScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DiseaseResolverTest {

    private static final CodeEntry ASTHMA = new CodeEntry("CA23", "TM2-404");

    private InMemoryDiseaseCatalog catalog;
    private DiseaseResolver resolver;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryDiseaseCatalog(CatalogSeed.defaults());
        resolver = new DiseaseResolver(catalog, new WeightedRatioScorer());
    }

    @Nested
    @DisplayName("Exact path")
    class ExactPath {

        @ParameterizedTest
        @ValueSource(strings = {"Asthma", "Diabetes mellitus", "Fever"})
        @DisplayName("Canonical names resolve exactly")
        void canonicalNames(String name) {
            MatchResult result = resolver.resolve(name);

            assertEquals(MatchType.EXACT, result.type());
            assertEquals(name, result.name());
            assertEquals(catalog.get(name).orElseThrow(), result.entry());
        }

        @Test
        @DisplayName("Query is trimmed before the exact lookup")
        void trimmed() {
            MatchResult result = resolver.resolve("  Asthma\t");

            assertTrue(result.isExact());
            assertEquals("Asthma", result.name());
        }

        @Test
        @DisplayName("Exact hit never consults the scorer")
        void scorerNotConsulted() {
            SimilarityScorer scorer = mock(SimilarityScorer.class);
            DiseaseResolver withMock = new DiseaseResolver(catalog, scorer);

            assertTrue(withMock.resolve("Fever").isExact());
            verifyNoInteractions(scorer);
        }
    }

    @Nested
    @DisplayName("Fuzzy path")
    class FuzzyPath {

        @Test
        @DisplayName("Case mismatch goes through the fuzzy path and still matches")
        void caseMismatch() {
            MatchResult result = resolver.resolve("asthma");

            assertEquals(MatchType.FUZZY, result.type());
            assertEquals("Asthma", result.name());
            assertEquals(ASTHMA, result.entry());
            assertTrue(result.score() >= ResolverOptions.DEFAULT_THRESHOLD);
        }

        @ParameterizedTest
        @DisplayName("Transpositions and case variants resolve to the original name")
        @CsvSource({
                "Ashtma,Asthma",
                "Fevre,Fever",
                "FEVER,Fever",
                "Diabetes melitus,Diabetes mellitus",
                "mellitus diabetes,Diabetes mellitus"
        })
        void typos(String query, String expected) {
            MatchResult result = resolver.resolve(query);

            assertEquals(MatchType.FUZZY, result.type());
            assertEquals(expected, result.name());
            assertTrue(result.score() > ResolverOptions.DEFAULT_THRESHOLD,
                    "Expected score > 70, got " + result.score());
        }

        @Test
        @DisplayName("Unrelated query is not found")
        void unrelated() {
            MatchResult result = resolver.resolve("Xyzzy");

            assertEquals(MatchType.NOT_FOUND, result.type());
            assertFalse(result.hasMatch());
        }

        @Test
        @DisplayName("Score equal to the threshold does not match")
        void thresholdIsExclusive() {
            DiseaseResolver constant = new DiseaseResolver(catalog, (query, candidate) -> 70.0);

            assertEquals(MatchType.NOT_FOUND, constant.resolve("anything", 70.0).type());
            assertEquals(MatchType.FUZZY, constant.resolve("anything", 69.99).type());
        }

        @Test
        @DisplayName("Explicit threshold overrides the configured one")
        void explicitThreshold() {
            // "Ashtma" scores about 83.3 against "Asthma"
            assertTrue(resolver.resolve("Ashtma", 80.0).isFuzzy());
            assertFalse(resolver.resolve("Ashtma", 90.0).hasMatch());
        }

        @Test
        @DisplayName("Configured threshold is used by default")
        void configuredThreshold() {
            DiseaseResolver strict = new DiseaseResolver(catalog, new WeightedRatioScorer(),
                    ResolverOptions.builder().threshold(90.0).build());

            assertFalse(strict.resolve("Ashtma").hasMatch());
            assertTrue(strict.resolve("asthma").isFuzzy());
        }

        @Test
        @DisplayName("Threshold outside [0, 100] is rejected")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> resolver.resolve("Ashtma", 150.0));
            assertThrows(IllegalArgumentException.class, () -> resolver.resolve("Ashtma", -1.0));
            assertThrows(IllegalArgumentException.class, () -> ResolverOptions.builder().threshold(Double.NaN));
        }
    }

    @Nested
    @DisplayName("Tie-break")
    class TieBreak {

        @Test
        @DisplayName("Equal scores pick the lexicographically smaller name")
        void lexicographicTieBreak() {
            Map<String, CodeEntry> seed = new LinkedHashMap<>();
            seed.put("Flu B", new CodeEntry("1E30", "TM2-301"));
            seed.put("Flu A", new CodeEntry("1E31", "TM2-302"));
            DiseaseResolver tied = new DiseaseResolver(new InMemoryDiseaseCatalog(seed), new WeightedRatioScorer());

            for (int i = 0; i < 10; i++) {
                MatchResult result = tied.resolve("Flu C");
                assertEquals("Flu A", result.name());
                assertEquals(80.0, result.score(), 0.001);
            }
        }

        @Test
        @DisplayName("Tie-break does not depend on catalog order")
        void independentOfOrder() {
            Map<String, CodeEntry> seed = new LinkedHashMap<>();
            seed.put("Zeta fever", new CodeEntry("Z1", "TM2-1"));
            seed.put("Alpha fever", new CodeEntry("A1", "TM2-2"));
            seed.put("Mid fever", new CodeEntry("M1", "TM2-3"));
            DiseaseResolver constant = new DiseaseResolver(new InMemoryDiseaseCatalog(seed), (q, c) -> 90.0);

            MatchResult result = constant.resolve("fever");
            assertEquals("Alpha fever", result.name());
            assertEquals("A1", result.entry().primaryCode());
        }

        @Test
        @DisplayName("A strictly higher score beats a smaller name")
        void higherScoreWins() {
            Map<String, CodeEntry> seed = new LinkedHashMap<>();
            seed.put("Alpha", new CodeEntry("A1", "TM2-1"));
            seed.put("Beta", new CodeEntry("B1", "TM2-2"));
            DiseaseResolver scored = new DiseaseResolver(new InMemoryDiseaseCatalog(seed),
                    (q, c) -> c.equals("Beta") ? 91.0 : 90.0);

            assertEquals("Beta", scored.resolve("query").name());
        }
    }

    @Nested
    @DisplayName("Invalid queries and empty catalog")
    class EdgeCases {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t\n"})
        @DisplayName("Blank queries are rejected")
        void blankQueries(String query) {
            assertThrows(InvalidQueryException.class, () -> resolver.resolve(query));
        }

        @Test
        @DisplayName("Null, oversized and control-character queries are rejected")
        void unusableQueries() {
            assertThrows(InvalidQueryException.class, () -> resolver.resolve(null));
            assertThrows(InvalidQueryException.class, () -> resolver.resolve("A".repeat(1001)));
            assertThrows(InvalidQueryException.class, () -> resolver.resolve("Asth\u0000ma"));
        }

        @Test
        @DisplayName("Empty catalog resolves to not found")
        void emptyCatalog() {
            DiseaseResolver empty = new DiseaseResolver(new InMemoryDiseaseCatalog(), new WeightedRatioScorer());

            assertEquals(MatchType.NOT_FOUND, empty.resolve("Asthma").type());
            assertEquals(MatchType.NOT_FOUND, empty.resolve("anything", 0.0).type());
        }

        @Test
        @DisplayName("Candidate deleted between scoring and lookup resolves to not found")
        void candidateVanished() {
            DiseaseCatalog racing = mock(DiseaseCatalog.class);
            when(racing.get(anyString())).thenReturn(Optional.empty());
            when(racing.names()).thenReturn(List.of("Asthma"));

            DiseaseResolver raced = new DiseaseResolver(racing, new WeightedRatioScorer());

            assertEquals(MatchType.NOT_FOUND, raced.resolve("asthma").type());
            verify(racing).get("asthma");
            verify(racing).get("Asthma");
        }
    }

    @Nested
    @DisplayName("Catalog mutations")
    class Mutations {

        @Test
        @DisplayName("Updates are visible to the next resolve")
        void updateVisible() {
            catalog.update("Asthma", CodeEntryUpdate.primaryCode("X1"));

            MatchResult result = resolver.resolve("Asthma");
            assertEquals(new CodeEntry("X1", "TM2-404"), result.entry());
        }

        @Test
        @DisplayName("Deleted names are no longer matched")
        void deleteVisible() {
            catalog.delete("Asthma");

            assertFalse(resolver.resolve("Asthma").hasMatch());
            assertFalse(resolver.resolve("asthma").hasMatch());
        }

        @Test
        @DisplayName("Resolve does not change the catalog")
        void noSideEffects() {
            var before = catalog.entries();
            resolver.resolve("asthma");
            resolver.resolve("Fever");
            resolver.resolve("Xyzzy");
            assertEquals(before, catalog.entries());
        }
    }
}
