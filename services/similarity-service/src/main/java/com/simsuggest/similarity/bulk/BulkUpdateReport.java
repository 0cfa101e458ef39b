package com.simsuggest.similarity.bulk;

public record BulkUpdateReport(int updated, int errors) {
    public static BulkUpdateReport empty() {
        return new BulkUpdateReport(0, 0);
    }

    public BulkUpdateReport plus(BulkUpdateReport other) {
        return new BulkUpdateReport(updated + other.updated, errors + other.errors);
    }
}
