package uk.gegc.qaloader.features.staging.domain.model;

import java.util.Set;

public enum StagingStateMachine {
    PENDING(Set.of(StagedQuestionStatus.DUPLICATE, StagedQuestionStatus.APPROVED, StagedQuestionStatus.REJECTED)),
    DUPLICATE(Set.of(StagedQuestionStatus.PENDING, StagedQuestionStatus.APPROVED, StagedQuestionStatus.REJECTED)),
    APPROVED(Set.of(StagedQuestionStatus.REJECTED, StagedQuestionStatus.IMPORTED)),
    REJECTED(Set.of(StagedQuestionStatus.APPROVED)),
    IMPORTED(Set.of());

    private final Set<StagedQuestionStatus> allowedTransitions;

    StagingStateMachine(Set<StagedQuestionStatus> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(StagedQuestionStatus targetStatus) {
        return targetStatus != null && allowedTransitions.contains(targetStatus);
    }

    public static boolean isValidTransition(StagedQuestionStatus from, StagedQuestionStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return StagingStateMachine.valueOf(from.name()).canTransitionTo(to);
    }
}
