package com.llmcouncil.common.exception;

public class TotalStageFailureException extends CouncilException {
    private final String stage;

    public TotalStageFailureException(String stage, String message) {
        super(ErrorKind.TOTAL_STAGE_FAILURE, "[" + stage + "] " + message);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
