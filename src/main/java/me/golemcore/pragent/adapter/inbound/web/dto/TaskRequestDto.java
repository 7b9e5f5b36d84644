package me.golemcore.pragent.adapter.inbound.web.dto;

import me.golemcore.pragent.domain.model.TaskRequest;

/**
 * Change request body accepted by the task endpoints.
 */
public record TaskRequestDto(String repoUrl, String description, String branchName, String targetBranch) {

    public TaskRequest toTaskRequest() {
        return new TaskRequest(repoUrl, description, blankToNull(branchName), blankToNull(targetBranch));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
