package uk.gegc.qaloader.features.staging.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StagingStateMachineTest {

    @Test
    @DisplayName("PENDING and DUPLICATE can be approved or rejected but never imported directly")
    void awaitingReviewTransitions() {
        assertThat(StagingStateMachine.PENDING.canTransitionTo(StagedQuestionStatus.APPROVED)).isTrue();
        assertThat(StagingStateMachine.PENDING.canTransitionTo(StagedQuestionStatus.REJECTED)).isTrue();
        assertThat(StagingStateMachine.PENDING.canTransitionTo(StagedQuestionStatus.IMPORTED)).isFalse();
        assertThat(StagingStateMachine.DUPLICATE.canTransitionTo(StagedQuestionStatus.PENDING)).isTrue();
        assertThat(StagingStateMachine.DUPLICATE.canTransitionTo(StagedQuestionStatus.APPROVED)).isTrue();
        assertThat(StagingStateMachine.DUPLICATE.canTransitionTo(StagedQuestionStatus.IMPORTED)).isFalse();
    }

    @Test
    @DisplayName("APPROVED and REJECTED can swap; only APPROVED imports")
    void reviewedTransitions() {
        assertThat(StagingStateMachine.isValidTransition(StagedQuestionStatus.APPROVED, StagedQuestionStatus.REJECTED)).isTrue();
        assertThat(StagingStateMachine.isValidTransition(StagedQuestionStatus.REJECTED, StagedQuestionStatus.APPROVED)).isTrue();
        assertThat(StagingStateMachine.isValidTransition(StagedQuestionStatus.APPROVED, StagedQuestionStatus.IMPORTED)).isTrue();
        assertThat(StagingStateMachine.isValidTransition(StagedQuestionStatus.REJECTED, StagedQuestionStatus.IMPORTED)).isFalse();
    }

    @Test
    @DisplayName("IMPORTED is final; null inputs return false")
    void finalAndInvalid() {
        for (StagedQuestionStatus target : StagedQuestionStatus.values()) {
            assertThat(StagingStateMachine.IMPORTED.canTransitionTo(target)).isFalse();
        }
        assertThat(StagingStateMachine.isValidTransition(null, StagedQuestionStatus.APPROVED)).isFalse();
        assertThat(StagingStateMachine.isValidTransition(StagedQuestionStatus.PENDING, null)).isFalse();
    }
}
