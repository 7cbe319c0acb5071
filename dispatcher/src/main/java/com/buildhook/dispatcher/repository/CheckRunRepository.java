package com.buildhook.dispatcher.repository;

import com.buildhook.dispatcher.model.CheckRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD operations for the check_runs table.
 */
public interface CheckRunRepository extends JpaRepository<CheckRunRecord, CheckRunRecord.Pk> {

    List<CheckRunRecord> findByTaskGroupId(String taskGroupId);
}
