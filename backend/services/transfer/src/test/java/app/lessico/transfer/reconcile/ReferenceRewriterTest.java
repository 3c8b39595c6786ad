package app.lessico.transfer.reconcile;

import app.lessico.transfer.model.OwnerFields;
import app.lessico.transfer.model.PerformanceRecord;
import app.lessico.transfer.model.StatisticsRecord;
import app.lessico.transfer.model.TestSessionRecord;
import app.lessico.transfer.model.WordRecord;
import app.lessico.transfer.store.RecordCollection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static app.lessico.transfer.support.TransferFixtures.performance;
import static app.lessico.transfer.support.TransferFixtures.session;
import static app.lessico.transfer.support.TransferFixtures.statistics;
import static app.lessico.transfer.support.TransferFixtures.word;
import static org.assertj.core.api.Assertions.assertThat;

class ReferenceRewriterTest {

    private final ReferenceRewriter rewriter = new ReferenceRewriter();

    @Test
    void overwritesEveryOwnerFieldAndLeavesTheInputAlone() {
        ObjectNode body = word("w1", "apple", "mela", "tenant-a");
        body.putObject("audit").putArray("editors").addObject().put("userId", "tenant-c");
        ObjectNode before = body.deepCopy();

        RewriteOutcome outcome = rewriter.rewrite(new WordRecord(body), "tenant-b", ResolvedTarget.inPlace("w1"), ReferenceIndex.empty());

        ObjectNode written = outcome.record().body();
        assertThat(OwnerFields.collect(written)).isNotEmpty().allMatch("tenant-b"::equals);
        assertThat(written.path("userId").asText()).isEqualTo("tenant-b");
        assertThat(written.path("firestoreMetadata").path("userId").asText()).isEqualTo("tenant-b");
        assertThat(body).isEqualTo(before);
        assertThat(written).isNotSameAs(body);
    }

    @Test
    void stampsSessionIdentityAndDefaultsDeleted() {
        ObjectNode body = session("t1", null, "w1", "apple");
        body.remove("deleted");

        RewriteOutcome outcome = rewriter.rewrite(new TestSessionRecord(body), "tenant-b", ResolvedTarget.remapped("t1", "t9"), ReferenceIndex.empty());

        ObjectNode written = outcome.record().body();
        assertThat(written.path("id").asText()).isEqualTo("t9");
        assertThat(written.path("sessionId").asText()).isEqualTo("t9");
        assertThat(written.path("deleted").asBoolean(true)).isFalse();
        assertThat(written.path("userId").asText()).isEqualTo("tenant-b");
        assertThat(written.has("firestoreMetadata")).isFalse();
    }

    @Test
    void performanceFollowsItsWordId() {
        RewriteOutcome outcome = rewriter.rewrite(new PerformanceRecord(performance("old", "apple", "tenant-a")),
                "tenant-b", new ResolvedTarget("old", "w7", true), ReferenceIndex.empty());

        assertThat(outcome.record().body().path("id").asText()).isEqualTo("w7");
        assertThat(outcome.record().body().path("wordId").asText()).isEqualTo("w7");
    }

    @Test
    void repairsSessionWordReferencesByNaturalKeyWhenRemapped() {
        ReferenceIndex index = ReferenceIndex.empty();
        index.words().register("Apple", "w-new");

        RewriteOutcome outcome = rewriter.rewrite(new TestSessionRecord(session("t1", "tenant-a", "w-old", "apple")),
                "tenant-b", ResolvedTarget.remapped("t1", "t2"), index);

        JsonNode written = outcome.record().body();
        assertThat(written.at("/exportData/detailedAnswers/0/word/id").asText()).isEqualTo("w-new");
        assertThat(written.at("/exportData/wrongWords/0/id").asText()).isEqualTo("w-new");
        assertThat(written.at("/analytics/insights/0/data/wordId").asText()).isEqualTo("w-new");
        assertThat(outcome.repaired()).isEqualTo(3);
        assertThat(outcome.unresolved()).isZero();
    }

    @Test
    void leavesReferencesUntouchedWhenNotRemapped() {
        ReferenceIndex index = ReferenceIndex.empty();
        index.words().register("apple", "w-new");

        RewriteOutcome outcome = rewriter.rewrite(new TestSessionRecord(session("t1", null, "w-old", "apple")),
                "tenant-b", ResolvedTarget.inPlace("t1"), index);

        assertThat(outcome.record().body().at("/exportData/wrongWords/0/id").asText()).isEqualTo("w-old");
        assertThat(outcome.repaired()).isZero();
    }

    @Test
    void countsUnresolvedReferencesAndKeepsTheirIds() {
        ObjectNode body = session("t1", "tenant-a", "w-old", "ghost");
        ((ArrayNode) body.at("/exportData/wrongWords")).addObject().put("id", "w-bare");

        RewriteOutcome outcome = rewriter.rewrite(new TestSessionRecord(body), "tenant-b", ResolvedTarget.remapped("t1", "t2"), ReferenceIndex.empty());

        JsonNode written = outcome.record().body();
        assertThat(written.at("/exportData/detailedAnswers/0/word/id").asText()).isEqualTo("w-old");
        assertThat(written.at("/exportData/wrongWords/1/id").asText()).isEqualTo("w-bare");
        assertThat(outcome.unresolved()).isEqualTo(4);
        assertThat(outcome.repaired()).isZero();
    }

    @Test
    void repairsStatisticsWordListsSessionsAndWordIdsFromLedger() {
        RemapTable remaps = new RemapTable();
        remaps.register(RecordCollection.test_sessions, "t-old", "t-new");
        remaps.register(RecordCollection.words, "w-old", "w-new");
        ReferenceIndex index = new ReferenceIndex(new NaturalKeyIndex(), Set.of(), remaps);
        index.words().register("apple", "w-new");

        RewriteOutcome outcome = rewriter.rewrite(new StatisticsRecord(statistics("s1", "tenant-a", "t-old", "w-old", "apple")),
                "tenant-b", ResolvedTarget.remapped("s1", "s2"), index);

        JsonNode written = outcome.record().body();
        assertThat(written.at("/chapterStats/1/words/0/id").asText()).isEqualTo("w-new");
        assertThat(written.at("/performanceData/wordPerformances/0/id").asText()).isEqualTo("w-new");
        assertThat(written.at("/performanceData/wordPerformances/0/wordId").asText()).isEqualTo("w-new");
        assertThat(written.at("/recentSessions/0").asText()).isEqualTo("t-new");
        assertThat(written.at("/wordIds/0").asText()).isEqualTo("w-new");
        assertThat(outcome.repaired()).isEqualTo(4);
        assertThat(outcome.unresolved()).isZero();
    }

    @Test
    void sessionsNeitherOwnedNorRemappedAreUnresolved() {
        ObjectNode body = statistics("s1", null, "t-unknown", "w1", "apple");
        ((ArrayNode) body.get("recentSessions")).addObject().put("sessionId", "t-own");
        ReferenceIndex index = new ReferenceIndex(new NaturalKeyIndex(), Set.of("t-own"), new RemapTable());
        index.words().register("apple", "w1");

        RewriteOutcome outcome = rewriter.rewrite(new StatisticsRecord(body), "tenant-b", ResolvedTarget.remapped("s1", "s2"), index);

        assertThat(outcome.record().body().at("/recentSessions/0").asText()).isEqualTo("t-unknown");
        assertThat(outcome.unresolved()).isEqualTo(1);
    }
}
