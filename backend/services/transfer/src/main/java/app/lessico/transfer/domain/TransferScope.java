package app.lessico.transfer.domain;

import app.lessico.transfer.store.RecordCollection;

/**
 * The four independently importable and exportable record categories.
 */
public enum TransferScope {
    words(RecordCollection.words, "words", "words_only", "words"),
    performance(RecordCollection.performance, "wordPerformance", "performance_only", "word_performance"),
    history(RecordCollection.test_sessions, "testHistory", "test_history_only", "test_history"),
    statistics(RecordCollection.statistics, "statistics", "statistics_only", "statistics");

    private final RecordCollection collection;
    private final String bundleKey;
    private final String exportType;
    private final String filePrefix;

    TransferScope(RecordCollection collection, String bundleKey, String exportType, String filePrefix) {
        this.collection = collection;
        this.bundleKey = bundleKey;
        this.exportType = exportType;
        this.filePrefix = filePrefix;
    }

    public RecordCollection collection() {
        return collection;
    }

    public String bundleKey() {
        return bundleKey;
    }

    public String exportType() {
        return exportType;
    }

    public String filePrefix() {
        return filePrefix;
    }
}
