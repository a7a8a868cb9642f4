package com.github.salilvnair.convflow.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ConversationFlowException extends RuntimeException {

    private final ConversationFlowErrorCode code;
    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ConversationFlowException(
            ConversationFlowErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConversationFlowException(
            ConversationFlowErrorCode code,
            String overrideMessage) {
        super(overrideMessage);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConversationFlowException(
            ConversationFlowErrorCode code,
            String overrideMessage,
            Throwable cause) {
        super(overrideMessage, cause);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ConversationFlowException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
