package com.buildhook.dispatcher.service;

import com.buildhook.dispatcher.model.Build;
import com.buildhook.dispatcher.model.CheckRunRecord;
import com.buildhook.dispatcher.repository.BuildRepository;
import com.buildhook.dispatcher.repository.CheckRunRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the build records, for the status API.
 */
@Service
@Transactional(readOnly = true)
public class BuildQueryService {

    static final int MAX_PAGE_SIZE = 100;

    private final BuildRepository    buildRepo;
    private final CheckRunRepository checkRunRepo;

    public BuildQueryService(BuildRepository buildRepo, CheckRunRepository checkRunRepo) {
        this.buildRepo    = buildRepo;
        this.checkRunRepo = checkRunRepo;
    }

    /** Filters are optional; newest first. */
    public Page<Build> search(String organization, String repository, String sha, int page, int size) {
        PageRequest request = PageRequest.of(
                Math.max(page, 0),
                Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "updated"));
        return buildRepo.search(organization, repository, sha, request);
    }

    public Optional<Build> findByTaskGroupId(String taskGroupId) {
        return buildRepo.findById(taskGroupId);
    }

    public List<CheckRunRecord> checkRuns(String taskGroupId) {
        return checkRunRepo.findByTaskGroupId(taskGroupId);
    }
}
