package app.lessico.transfer.model;

public interface RecordVisitor<R> {

    R visitWord(WordRecord word);

    R visitPerformance(PerformanceRecord performance);

    R visitTestSession(TestSessionRecord session);

    R visitStatistics(StatisticsRecord statistics);
}
