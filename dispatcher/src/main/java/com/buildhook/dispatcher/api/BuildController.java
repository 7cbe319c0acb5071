package com.buildhook.dispatcher.api;

import com.buildhook.dispatcher.api.dto.BuildPage;
import com.buildhook.dispatcher.api.dto.BuildResponse;
import com.buildhook.dispatcher.api.dto.CheckRunResponse;
import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.service.BuildQueryService;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only view of build records.
 *
 * GET /builds                            list, optionally filtered by organization, repository, sha
 * GET /builds/{taskGroupId}              one build
 * GET /builds/{taskGroupId}/check-runs   the check runs opened for that build's tasks
 */
@RestController
@RequestMapping("/builds")
public class BuildController {

    private final BuildQueryService buildQueryService;

    public BuildController(BuildQueryService buildQueryService) {
        this.buildQueryService = buildQueryService;
    }

    @GetMapping
    public BuildPage list(@RequestParam(required = false) String organization,
                          @RequestParam(required = false) String repository,
                          @RequestParam(required = false) String sha,
                          @RequestParam(defaultValue = "0") int page,
                          @RequestParam(defaultValue = "20") int size) {
        Page<Build> result = buildQueryService.search(organization, repository, sha, page, size);
        return new BuildPage(
                result.getContent().stream().map(BuildResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements(),
                result.hasNext());
    }

    /**
     * Returns 404 if no build exists for the task group.
     */
    @GetMapping("/{taskGroupId}")
    public BuildResponse get(@PathVariable String taskGroupId) {
        return buildQueryService.findByTaskGroupId(taskGroupId)
                .map(BuildResponse::from)
                .orElseThrow(() -> notFound(taskGroupId));
    }

    @GetMapping("/{taskGroupId}/check-runs")
    public List<CheckRunResponse> checkRuns(@PathVariable String taskGroupId) {
        buildQueryService.findByTaskGroupId(taskGroupId).orElseThrow(() -> notFound(taskGroupId));
        return buildQueryService.checkRuns(taskGroupId).stream()
                .map(CheckRunResponse::from)
                .toList();
    }

    private static ResponseStatusException notFound(String taskGroupId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Build not found: " + taskGroupId);
    }
}
