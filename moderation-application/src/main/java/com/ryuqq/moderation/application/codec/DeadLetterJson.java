package com.ryuqq.moderation.application.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Dead-letter envelope wire format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeadLetterJson {

    @JsonProperty("original_message")
    private TaskMessageJson originalMessage;

    @JsonProperty("failure_reason")
    private String failureReason;

    @JsonProperty("failure_type")
    private String failureType;

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("retry_count_at_failure")
    private Integer retryCountAtFailure;

    @JsonProperty("dead_lettered_at")
    private String deadLetteredAt;

    public TaskMessageJson getOriginalMessage() { return originalMessage; }
    public void setOriginalMessage(TaskMessageJson originalMessage) { this.originalMessage = originalMessage; }

    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }

    public String getFailureType() { return failureType; }
    public void setFailureType(String failureType) { this.failureType = failureType; }

    public String getErrorCode() { return errorCode; }
    public void setErrorCode(String errorCode) { this.errorCode = errorCode; }

    public Integer getRetryCountAtFailure() { return retryCountAtFailure; }
    public void setRetryCountAtFailure(Integer retryCountAtFailure) { this.retryCountAtFailure = retryCountAtFailure; }

    public String getDeadLetteredAt() { return deadLetteredAt; }
    public void setDeadLetteredAt(String deadLetteredAt) { this.deadLetteredAt = deadLetteredAt; }
}
