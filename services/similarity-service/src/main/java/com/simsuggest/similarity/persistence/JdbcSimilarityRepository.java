package com.simsuggest.similarity.persistence;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.retrieval.Candidate;
import com.simsuggest.similarity.retrieval.RankedResultSet;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Page-to-page suggestion table. Only page suggestions for page sources are stored; rows written by other
 * producers (other {@code source} values) are left alone.
 */
@Repository
public class JdbcSimilarityRepository implements SimilaritySink {
    static final String SOURCE = "solr";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Autowired
    public JdbcSimilarityRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, Clock.systemUTC());
    }

    JdbcSimilarityRepository(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public int replace(DocumentRef source, int rootContainerId, int languageId, RankedResultSet results) {
        if (!source.isPage()) {
            return 0;
        }
        jdbcTemplate.update(
            "DELETE FROM tx_semanticsuggestion_similarities WHERE page_id = ? AND sys_language_uid = ? AND source = ?",
            source.id(),
            languageId,
            SOURCE
        );

        List<SimilarityInsert> inserts = new ArrayList<>();
        long now = clock.instant().getEpochSecond();
        for (Candidate candidate : results.getCandidates()) {
            if (!candidate.getDocumentRef().isPage() || candidate.getId() == source.id()) {
                continue;
            }
            inserts.add(new SimilarityInsert(source.id(), candidate.getId(), candidate.getScore(), rootContainerId, languageId, now));
        }
        if (inserts.isEmpty()) {
            return 0;
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO tx_semanticsuggestion_similarities "
                + "(page_id, similar_page_id, similarity_score, root_page_id, sys_language_uid, source, crdate, tstamp) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            inserts,
            inserts.size(),
            (ps, insert) -> {
                ps.setInt(1, insert.pageId());
                ps.setInt(2, insert.similarPageId());
                ps.setDouble(3, insert.score());
                ps.setInt(4, insert.rootPageId());
                ps.setInt(5, insert.languageId());
                ps.setString(6, SOURCE);
                ps.setLong(7, insert.timestamp());
                ps.setLong(8, insert.timestamp());
            }
        );
        return inserts.size();
    }

    public record SimilarityInsert(
        int pageId,
        int similarPageId,
        double score,
        int rootPageId,
        int languageId,
        long timestamp
    ) {
    }
}
