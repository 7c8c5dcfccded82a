package com.rkflow.caseengine.status;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the fixed status table.
 */
class StatusCatalogTest {

    @Test
    void everyName_hasStrictlyIncreasingLevel() {
        List<String> names = StatusCatalog.names();
        assertThat(names).hasSize(31);
        for (int i = 0; i < names.size(); i++) {
            assertThat(StatusCatalog.levelOf(names.get(i))).isEqualTo(i + 1);
        }
    }

    @Test
    void namedLevels_matchPipeline() {
        assertThat(StatusCatalog.levelOf(StatusCatalog.INIT)).isEqualTo(1);
        assertThat(StatusCatalog.levelOf(StatusCatalog.CONFIRM_PROPOSAL)).isEqualTo(2);
        assertThat(StatusCatalog.levelOf("3/3 Awaiting Result")).isEqualTo(StatusCatalog.MAX_INTERVIEW_LEVEL);
        assertThat(StatusCatalog.levelOf(StatusCatalog.NEGOTIATION)).isEqualTo(27);
        assertThat(StatusCatalog.AWARDED_LEVEL).isEqualTo(28);
        assertThat(StatusCatalog.NO_ROLLBACK_LEVEL).isEqualTo(29);
        assertThat(StatusCatalog.levelOf(StatusCatalog.OFFBOARDING)).isEqualTo(31);
    }

    @Test
    void roundBasedNames_areTheStageTimesRoundTagCross() {
        long roundBased = StatusCatalog.names().stream()
                .filter(n -> StatusCatalog.metaOf(n).isRoundBased())
                .count();
        assertThat(roundBased).isEqualTo(24);

        assertThat(StatusCatalog.metaOf("Proposal Sent"))
                .isEqualTo(new StatusMeta(Stage.PROPOSAL, 1, 1));
        assertThat(StatusCatalog.metaOf("2/3 Interview Set"))
                .isEqualTo(new StatusMeta(Stage.SETUP, 2, 3));
        assertThat(StatusCatalog.metaOf(StatusCatalog.AWARDED)).isEqualTo(StatusMeta.OTHER);
    }

    @Test
    void statusAt_findsExistingCombinationOnly() {
        assertThat(StatusCatalog.statusAt(2, 2, Stage.ADJUST)).contains("2/2 Interview Scheduling");
        assertThat(StatusCatalog.statusAt(1, 1, Stage.WAITING)).contains("Awaiting Result");
        assertThat(StatusCatalog.statusAt(3, 2, Stage.PROPOSAL)).isEmpty();
    }

    @Test
    void proposalNamesFor_listsEveryRoundOfThatTotal() {
        assertThat(StatusCatalog.proposalNamesFor(3))
                .containsExactly("1/3 Proposal Sent", "2/3 Proposal Sent", "3/3 Proposal Sent");
        assertThat(StatusCatalog.proposalNamesFor(null)).isEmpty();
    }

    @Test
    void groupLevel_isLowestLevelOfStageAndRound() {
        assertThat(StatusCatalog.groupLevel("1/3 Interview Scheduling")).isEqualTo(6);
        assertThat(StatusCatalog.groupLevel("2/3 Proposal Sent")).isEqualTo(15);
        assertThat(StatusCatalog.groupLevel(StatusCatalog.NEGOTIATION)).isEqualTo(27);
    }

    @Test
    void maxTotalRounds_defaultsToOne() {
        assertThat(StatusCatalog.maxTotalRounds(List.of(StatusCatalog.INIT))).isEqualTo(1);
        assertThat(StatusCatalog.maxTotalRounds(List.of("1/2 Proposal Sent", "1/3 Interview Set"))).isEqualTo(3);
    }

    @Test
    void unknownName_isProgrammingError_butRanksZeroWhenPersisted() {
        assertThatThrownBy(() -> StatusCatalog.levelOf("Hired"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hired");
        assertThat(StatusCatalog.persistedLevel(null)).isZero();
        assertThat(StatusCatalog.persistedLevel("Hired")).isZero();
        assertThat(StatusCatalog.isKnown("Hired")).isFalse();
    }
}
