package com.simsuggest.similarity.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.persistence.JdbcSimilarityRepository.SimilarityInsert;
import com.simsuggest.similarity.retrieval.Candidates;
import com.simsuggest.similarity.retrieval.RankedResultSet;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

@ExtendWith(MockitoExtension.class)
class JdbcSimilarityRepositoryTest {
    private static final String DELETE_SQL =
        "DELETE FROM tx_semanticsuggestion_similarities WHERE page_id = ? AND sys_language_uid = ? AND source = ?";
    private static final String INSERT_SQL = "INSERT INTO tx_semanticsuggestion_similarities "
        + "(page_id, similar_page_id, similarity_score, root_page_id, sys_language_uid, source, crdate, tstamp) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Captor
    private ArgumentCaptor<Collection<SimilarityInsert>> insertsCaptor;

    private JdbcSimilarityRepository repository;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
        repository = new JdbcSimilarityRepository(jdbcTemplate, clock);
    }

    @Test
    void replacesSolrRowsWithPageSuggestionsOnly() {
        RankedResultSet results = RankedResultSet.of(List.of(
            Candidates.page(12, 0.9, "lexical"),
            Candidates.of("tx_news_domain_model_news", 3, 0.8, 0, "lexical"),
            Candidates.page(5, 0.7, "lexical"),
            Candidates.page(14, 0.4, "lexical")
        ));

        int written = repository.replace(DocumentRef.page(5), 1, 0, results);

        assertThat(written).isEqualTo(2);
        verify(jdbcTemplate).update(DELETE_SQL, 5, 0, "solr");
        verify(jdbcTemplate).batchUpdate(
            eq(INSERT_SQL),
            insertsCaptor.capture(),
            eq(2),
            any(ParameterizedPreparedStatementSetter.class)
        );
        assertThat(insertsCaptor.getValue()).containsExactly(
            new SimilarityInsert(5, 12, 0.9, 1, 0, 1_700_000_000L),
            new SimilarityInsert(5, 14, 0.4, 1, 0, 1_700_000_000L)
        );
    }

    @Test
    void emptyResultStillClearsPreviousRows() {
        int written = repository.replace(DocumentRef.page(8), 1, 2, RankedResultSet.empty());

        assertThat(written).isZero();
        verify(jdbcTemplate).update(DELETE_SQL, 8, 2, "solr");
        verify(jdbcTemplate, never()).batchUpdate(anyString(), any(Collection.class), anyInt(),
            any(ParameterizedPreparedStatementSetter.class));
    }

    @Test
    void nonPageSourcesAreNotStored() {
        int written = repository.replace(
            new DocumentRef("tx_news_domain_model_news", 3),
            1,
            0,
            RankedResultSet.of(List.of(Candidates.page(12, 0.9, "lexical")))
        );

        assertThat(written).isZero();
        verifyNoInteractions(jdbcTemplate);
    }
}
