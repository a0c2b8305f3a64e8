package dev.pekelund.loyalty.submission;

public enum SubmissionStage {
    START,
    EXTRACTING,
    VALIDATING,
    CHECKING_DUPLICATE,
    CHECKING_DAILY_LIMIT,
    AWARDING,
    ACCEPTED,
    REJECTED
}
