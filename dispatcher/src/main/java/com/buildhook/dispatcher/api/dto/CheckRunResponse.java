package com.buildhook.dispatcher.api.dto;

import com.buildhook.dispatcher.model.CheckRunRecord;

public record CheckRunResponse(
        String taskId,
        String checkSuiteId,
        String checkRunId
) {
    public static CheckRunResponse from(CheckRunRecord record) {
        return new CheckRunResponse(record.getTaskId(), record.getCheckSuiteId(), record.getCheckRunId());
    }
}
