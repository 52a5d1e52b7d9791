package com.roboticsradar.pipeline.model;

/**
 * Why an item did not make it into the store. Every reason belongs to one stage so the
 * cycle summary can report counts per stage as well as per reason.
 */
public enum RejectionReason {
    STUB("stub", Stage.FILTER),
    TOO_SHORT("too_short", Stage.FILTER),
    INVALID_URL("invalid_url", Stage.FILTER),
    TOO_OLD("too_old", Stage.FILTER),
    EXCLUDED("excluded", Stage.RELEVANCE),
    NOT_RELEVANT("not_relevant", Stage.RELEVANCE),
    UNSUPPORTED_LANGUAGE("unsupported_language", Stage.RELEVANCE),
    ALREADY_EXISTS("already_exists", Stage.DUPLICATE),
    DUPLICATE_URL("duplicate_url", Stage.DUPLICATE),
    DUPLICATE_TITLE("duplicate_title", Stage.DUPLICATE),
    DUPLICATE_CONTENT("duplicate_content", Stage.DUPLICATE),
    ANALYSIS_ERROR("analysis_error", Stage.ERROR),
    STORE_ERROR("store_error", Stage.ERROR);

    /** {@code ERROR} counts items dropped by an unexpected failure rather than by a rule. */
    public enum Stage { FILTER, RELEVANCE, DUPLICATE, ERROR }

    private final String code;
    private final Stage stage;

    RejectionReason(String code, Stage stage) {
        this.code = code;
        this.stage = stage;
    }

    public String code() { return code; }
    public Stage stage() { return stage; }
}
