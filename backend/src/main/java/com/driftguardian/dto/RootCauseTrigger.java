package com.driftguardian.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RootCauseTrigger {
    Status status;
    UUID jobId;
    String message;

    public enum Status {
        NOT_REQUIRED,
        MODEL_NOT_ATTACHED,
        QUEUED
    }
}
