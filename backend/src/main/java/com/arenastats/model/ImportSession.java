package com.arenastats.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One run of the log importer over a log file.
 */
@Getter
@Setter
@Entity
@Table(name = "import_sessions")
public class ImportSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_file", nullable = false, length = 500)
    private String logFile;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_modified")
    private OffsetDateTime fileModified;

    @Column(name = "matches_imported", nullable = false)
    private Integer matchesImported = 0;

    @Column(name = "matches_skipped", nullable = false)
    private Integer matchesSkipped = 0;

    @Column(name = "matches_failed", nullable = false)
    private Integer matchesFailed = 0;

    @Column(name = "parse_errors", nullable = false)
    private Integer parseErrors = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ImportSessionStatus status = ImportSessionStatus.RUNNING;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at", nullable = false, updatable = false)
    private OffsetDateTime startedAt = OffsetDateTime.now();

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
