package com.buildhook.dispatcher.repository;

import com.buildhook.dispatcher.model.Build;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * CRUD + listing queries for the builds table.
 */
public interface BuildRepository extends JpaRepository<Build, String> {

    /**
     * Builds filtered by any combination of organization, repository and sha.
     * A null filter matches everything.
     */
    @Query("""
            SELECT b FROM Build b
            WHERE (:organization IS NULL OR b.organization = :organization)
              AND (:repository   IS NULL OR b.repository   = :repository)
              AND (:sha          IS NULL OR b.sha          = :sha)
            """)
    Page<Build> search(@Param("organization") String organization,
                       @Param("repository") String repository,
                       @Param("sha") String sha,
                       Pageable pageable);
}
