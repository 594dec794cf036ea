package com.sampleci.tracker.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageTest {

    @Test
    void orderedStages_areTheFourProgressStagesInOrder() {
        assertThat(Stage.orderedStages())
                .containsExactly(Stage.PREPARATION, Stage.BUILDING, Stage.TESTING, Stage.COMPLETED);
    }

    @Test
    void indexOf_isMonotonicWithStageOrder() {
        assertThat(Stage.indexOf(Stage.PREPARATION)).isLessThan(Stage.indexOf(Stage.BUILDING));
        assertThat(Stage.indexOf(Stage.BUILDING)).isLessThan(Stage.indexOf(Stage.TESTING));
        assertThat(Stage.indexOf(Stage.TESTING)).isLessThan(Stage.indexOf(Stage.COMPLETED));
        assertThat(Stage.indexOf(Stage.PREPARATION)).isZero();
        assertThat(Stage.indexOf(Stage.COMPLETED)).isEqualTo(3);
    }

    @Test
    void indexOf_canceledAndNull_isMinusOne() {
        assertThat(Stage.indexOf(Stage.CANCELED)).isEqualTo(-1);
        assertThat(Stage.indexOf(null)).isEqualTo(-1);
    }

    @Test
    void orderedStages_cannotBeModified() {
        assertThatThrownBy(() -> Stage.orderedStages().add(Stage.CANCELED))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void isTerminal_onlyForCompletedAndCanceled() {
        assertThat(Stage.COMPLETED.isTerminal()).isTrue();
        assertThat(Stage.CANCELED.isTerminal()).isTrue();
        assertThat(Stage.PREPARATION.isTerminal()).isFalse();
        assertThat(Stage.BUILDING.isTerminal()).isFalse();
        assertThat(Stage.TESTING.isTerminal()).isFalse();
    }

    @Test
    void fromValue_parsesWireValuesCaseInsensitively() {
        assertThat(Stage.fromValue("building")).isEqualTo(Stage.BUILDING);
        assertThat(Stage.fromValue(" Canceled ")).isEqualTo(Stage.CANCELED);
    }

    @Test
    void fromValue_unknown_throws() {
        assertThatThrownBy(() -> Stage.fromValue("deploying"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deploying");
        assertThatThrownBy(() -> Stage.fromValue(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void labels_matchTheUi() {
        assertThat(Stage.CANCELED.label()).isEqualTo("Canceled/Error");
        assertThat(Stage.TESTING.value()).isEqualTo("testing");
    }
}
