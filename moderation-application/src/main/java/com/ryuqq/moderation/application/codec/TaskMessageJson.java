package com.ryuqq.moderation.application.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Task message wire format.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskMessageJson {

    @JsonProperty("task_id")
    private Long taskId;

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("retry_count")
    private Integer retryCount;

    @JsonProperty("last_error")
    private String lastError;

    public Long getTaskId() { return taskId; }
    public void setTaskId(Long taskId) { this.taskId = taskId; }

    public Long getItemId() { return itemId; }
    public void setItemId(Long itemId) { this.itemId = itemId; }

    public String getTimestamp() { return timestamp; }
    public void setTimestamp(String timestamp) { this.timestamp = timestamp; }

    public Integer getRetryCount() { return retryCount; }
    public void setRetryCount(Integer retryCount) { this.retryCount = retryCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
}
