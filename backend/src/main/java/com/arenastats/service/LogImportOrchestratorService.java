package com.arenastats.service;

import com.arenastats.parser.LogParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Re-imports the configured client log on startup and periodically afterwards, so matches
 * played since the last run show up without a manual import.
 */
@Service
public class LogImportOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(LogImportOrchestratorService.class);

    @Value("${arenastats.import.enabled:true}")
    private boolean importEnabled;

    @Value("${arenastats.import.run-on-startup:true}")
    private boolean runOnStartup;

    @Value("${arenastats.import.log-path:}")
    private String logPath;

    @Value("${arenastats.import.force:false}")
    private boolean force;

    private final MatchImportService matchImportService;

    public LogImportOrchestratorService(MatchImportService matchImportService) {
        this.matchImportService = matchImportService;
    }

    /**
     * Triggers the first import once app startup is complete.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!importEnabled || !runOnStartup) {
            log.debug("Startup import skipped (enabled={}, runOnStartup={})", importEnabled, runOnStartup);
            return;
        }
        runImportCycle("startup");
    }

    @Scheduled(
            fixedDelayString = "${arenastats.import.interval-ms:300000}",
            initialDelayString = "${arenastats.import.initial-delay-ms:60000}")
    public void scheduledImport() {
        runImportCycle("scheduler");
    }

    /**
     * Runs one import of the configured log.
     *
     * @param source Source label for logging (startup/scheduler)
     * @return Number of newly imported matches
     */
    int runImportCycle(String source) {
        if (!importEnabled) {
            log.debug("Import cycle ({}) skipped: import disabled", source);
            return 0;
        }
        if (logPath == null || logPath.isBlank()) {
            log.debug("Import cycle ({}) skipped: no log path configured", source);
            return 0;
        }

        Path path = Paths.get(logPath.trim());
        try {
            ImportSummary summary = matchImportService.importLog(path, force);
            log.info("Import cycle ({}) complete: {} found, {} imported, {} skipped",
                    source, summary.matchesFound(), summary.matchesImported(), summary.matchesSkipped());
            return summary.matchesImported();
        } catch (LogParseException e) {
            log.warn("Import cycle ({}) could not read {}: {}", source, path, e.getMessage());
            return 0;
        } catch (Exception e) {
            log.error("Import cycle ({}) failed for {}", source, path, e);
            return 0;
        }
    }
}
