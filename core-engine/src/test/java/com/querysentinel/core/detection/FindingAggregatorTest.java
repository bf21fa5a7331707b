package com.querysentinel.core.detection;

import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FindingAggregator}.
 */
class FindingAggregatorTest {

    private static final Instant T1 = Instant.parse("2024-05-01T18:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T09:00:00Z");

    @Test
    @DisplayName("Should order by user ascending, then start time descending")
    void shouldOrderByUserThenNewestFirst() {
        AnomalyFinding bobOld = finding("BOB", "b1", T2, AnomalyType.TIME_OF_DAY);
        AnomalyFinding aliceOld = finding("ALICE", "a1", T2, AnomalyType.TIME_OF_DAY);
        AnomalyFinding aliceNew = finding("ALICE", "a2", T1, AnomalyType.TABLE_ACCESS);

        List<AnomalyFinding> result = FindingAggregator.aggregate(List.of(
                List.of(bobOld, aliceOld),
                List.of(),
                List.of(aliceNew)));

        assertThat(result).containsExactly(aliceNew, aliceOld, bobOld);
    }

    @Test
    @DisplayName("Should list the newer finding first regardless of anomaly type")
    void shouldIgnoreTypeWhenTimesDiffer() {
        AnomalyFinding olderTimeOfDay = finding("ALICE", "a1", T2, AnomalyType.TIME_OF_DAY);
        AnomalyFinding newerTableAccess = finding("ALICE", "a2", T1, AnomalyType.TABLE_ACCESS);

        List<AnomalyFinding> result = FindingAggregator.aggregate(List.of(
                List.of(olderTimeOfDay), List.of(newerTableAccess)));

        assertThat(result).containsExactly(newerTableAccess, olderTimeOfDay);
    }

    @Test
    @DisplayName("Should break ties by query id, then anomaly type")
    void shouldBreakTiesDeterministically() {
        AnomalyFinding q2Table = finding("ALICE", "q2", T1, AnomalyType.TABLE_ACCESS);
        AnomalyFinding q2Complexity = finding("ALICE", "q2", T1, AnomalyType.COMPLEXITY);
        AnomalyFinding q1Table = finding("ALICE", "q1", T1, AnomalyType.TABLE_ACCESS);

        List<AnomalyFinding> result = FindingAggregator.aggregate(List.of(
                List.of(q2Table, q2Complexity, q1Table)));

        assertThat(result).containsExactly(q1Table, q2Complexity, q2Table);
    }

    @Test
    @DisplayName("Should keep duplicate findings")
    void shouldKeepDuplicates() {
        AnomalyFinding finding = finding("ALICE", "q1", T1, AnomalyType.COMPLEXITY);

        assertThat(FindingAggregator.aggregate(List.of(List.of(finding), List.of(finding)))).hasSize(2);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AnomalyFinding finding(String user, String queryId, Instant start, AnomalyType type) {
        return AnomalyFinding.builder()
                .userName(user)
                .queryId(queryId)
                .startTime(start)
                .queryText("SELECT 1")
                .anomalyType(type)
                .anomalyDetails(type.getLabel())
                .build();
    }
}
