package uk.gegc.qaloader.features.staging.domain.model;

public enum ReviewAction {
    APPROVE(StagedQuestionStatus.APPROVED),
    REJECT(StagedQuestionStatus.REJECTED);

    private final StagedQuestionStatus targetStatus;

    ReviewAction(StagedQuestionStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public StagedQuestionStatus getTargetStatus() {
        return targetStatus;
    }
}
