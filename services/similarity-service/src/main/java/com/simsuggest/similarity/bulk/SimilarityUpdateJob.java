package com.simsuggest.similarity.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SimilarityUpdateJob {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityUpdateJob.class);

    private final BulkSimilarityUpdater updater;
    private final BulkUpdateProperties properties;

    public SimilarityUpdateJob(BulkSimilarityUpdater updater, BulkUpdateProperties properties) {
        this.updater = updater;
        this.properties = properties;
    }

    @Scheduled(
        fixedDelayString = "${similarity.bulk.fixed-delay-ms:86400000}",
        initialDelayString = "${similarity.bulk.initial-delay-ms:60000}"
    )
    public void rebuildSimilarities() {
        if (!properties.isEnabled()) {
            return;
        }
        BulkUpdateReport report = updater.updateAll(null);
        logger.info("similarity_update_job_done updated={} errors={}", report.updated(), report.errors());
    }
}
