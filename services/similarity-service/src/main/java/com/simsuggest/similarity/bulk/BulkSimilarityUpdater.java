package com.simsuggest.similarity.bulk;

import com.simsuggest.similarity.document.DocumentRef;
import com.simsuggest.similarity.persistence.SimilaritySink;
import com.simsuggest.similarity.query.SimilaritySettings;
import com.simsuggest.similarity.retrieval.SimilarityDefaultsProperties;
import com.simsuggest.similarity.retrieval.SimilarityRequest;
import com.simsuggest.similarity.retrieval.SimilarityResult;
import com.simsuggest.similarity.retrieval.SimilarityService;
import com.simsuggest.similarity.solr.PartitionRouter;
import io.micrometer.core.instrument.Metrics;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Precomputes suggestions for every content page of a site and hands them to the sink.
 *
 * <p>Pages are processed one at a time so a site never has more than one request in flight against its core.
 * A page that fails is counted and skipped. Degraded results are not stored so an outage never replaces good
 * rows with empty ones.
 */
@Service
public class BulkSimilarityUpdater {
    private static final Logger logger = LoggerFactory.getLogger(BulkSimilarityUpdater.class);

    private final SimilarityService similarityService;
    private final SimilarityDefaultsProperties defaultsProperties;
    private final PageTreeRepository pageTreeRepository;
    private final SimilaritySink similaritySink;
    private final PartitionRouter partitionRouter;
    private final BulkUpdateProperties properties;

    public BulkSimilarityUpdater(
        SimilarityService similarityService,
        SimilarityDefaultsProperties defaultsProperties,
        PageTreeRepository pageTreeRepository,
        SimilaritySink similaritySink,
        PartitionRouter partitionRouter,
        BulkUpdateProperties properties
    ) {
        this.similarityService = similarityService;
        this.defaultsProperties = defaultsProperties;
        this.pageTreeRepository = pageTreeRepository;
        this.similaritySink = similaritySink;
        this.partitionRouter = partitionRouter;
        this.properties = properties;
    }

    /**
     * Runs every configured root for every configured language.
     */
    public BulkUpdateReport updateAll(String modeOverride) {
        List<Integer> roots = properties.getRootIds().isEmpty()
            ? partitionRouter.availableRootIds()
            : properties.getRootIds();
        BulkUpdateReport total = BulkUpdateReport.empty();
        for (Integer rootId : roots) {
            for (Integer languageId : properties.getLanguageIds()) {
                total = total.plus(updateSite(rootId, languageId, modeOverride));
            }
        }
        logger.info("similarity_bulk_done roots={} updated={} errors={}", roots.size(), total.updated(), total.errors());
        return total;
    }

    public BulkUpdateReport updateSite(int rootId, int languageId, String modeOverride) {
        String mode = modeOverride == null || modeOverride.isBlank() ? properties.getMode() : modeOverride;
        SimilaritySettings settings = defaultsProperties.resolve(Map.of(SimilaritySettings.SIMILARITY_MODE, mode));

        List<Integer> pageIds = pageTreeRepository.findContentPageIds(rootId);
        logger.info("similarity_bulk_site root={} language={} mode={} pages={}", rootId, languageId, mode, pageIds.size());

        int updated = 0;
        int errors = 0;
        for (int i = 0; i < pageIds.size(); i++) {
            if (i > 0 && !pause()) {
                logger.warn("similarity_bulk_interrupted root={} processed={}", rootId, i);
                break;
            }
            int pageId = pageIds.get(i);
            try {
                DocumentRef ref = DocumentRef.page(pageId);
                SimilarityResult result = similarityService.findSimilar(new SimilarityRequest(ref, languageId, null), settings);
                if (result.isDegraded()) {
                    errors++;
                    logger.warn("similarity_bulk_page_degraded page={} root={} language={}", pageId, rootId, languageId);
                    continue;
                }
                similaritySink.replace(ref, rootId, languageId, result.getResults());
                updated++;
            } catch (RuntimeException e) {
                errors++;
                logger.warn("similarity_bulk_page_failed page={} root={} language={} reason={}", pageId, rootId, languageId,
                    e.getMessage());
            }
        }
        Metrics.counter("similarity.bulk.pages.total", "outcome", "updated").increment(updated);
        Metrics.counter("similarity.bulk.pages.total", "outcome", "error").increment(errors);
        return new BulkUpdateReport(updated, errors);
    }

    private boolean pause() {
        long throttleMs = properties.getThrottleMs();
        if (throttleMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(throttleMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
