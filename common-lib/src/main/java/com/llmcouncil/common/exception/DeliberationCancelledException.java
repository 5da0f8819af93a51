package com.llmcouncil.common.exception;

public class DeliberationCancelledException extends CouncilException {

    public DeliberationCancelledException(String deliberationId) {
        super(ErrorKind.CANCELLED, "Deliberation " + deliberationId + " was cancelled");
    }
}
