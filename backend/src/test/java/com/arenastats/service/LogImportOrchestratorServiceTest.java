package com.arenastats.service;

import com.arenastats.parser.InvalidLogFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogImportOrchestratorServiceTest {

    @Mock
    private MatchImportService matchImportService;

    @InjectMocks
    private LogImportOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(orchestrator, "importEnabled", true);
        ReflectionTestUtils.setField(orchestrator, "runOnStartup", true);
        ReflectionTestUtils.setField(orchestrator, "logPath", " /logs/Player.log ");
        ReflectionTestUtils.setField(orchestrator, "force", false);
    }

    @Test
    void runImportCycle_importsConfiguredLog() {
        when(matchImportService.importLog(Path.of("/logs/Player.log"), false))
                .thenReturn(new ImportSummary(1L, 3, 2, 1, 0, 0));

        assertEquals(2, orchestrator.runImportCycle("scheduler"));
    }

    @Test
    void runImportCycle_skipsWhenDisabledOrUnconfigured() {
        ReflectionTestUtils.setField(orchestrator, "importEnabled", false);
        assertEquals(0, orchestrator.runImportCycle("scheduler"));

        ReflectionTestUtils.setField(orchestrator, "importEnabled", true);
        ReflectionTestUtils.setField(orchestrator, "logPath", "  ");
        assertEquals(0, orchestrator.runImportCycle("scheduler"));

        verify(matchImportService, never()).importLog(any(), anyBoolean());
    }

    @Test
    void runImportCycle_swallowsImportFailures() {
        when(matchImportService.importLog(any(), anyBoolean()))
                .thenThrow(new InvalidLogFormatException("Log file is empty", "/logs/Player.log"))
                .thenThrow(new IllegalStateException("database down"));

        assertEquals(0, orchestrator.runImportCycle("scheduler"));
        assertEquals(0, orchestrator.runImportCycle("scheduler"));
    }

    @Test
    void onApplicationReady_honoursStartupSwitch() {
        ReflectionTestUtils.setField(orchestrator, "runOnStartup", false);

        orchestrator.onApplicationReady();

        verify(matchImportService, never()).importLog(any(), anyBoolean());
    }

    @Test
    void onApplicationReady_passesForceFlag() {
        ReflectionTestUtils.setField(orchestrator, "force", true);
        when(matchImportService.importLog(Path.of("/logs/Player.log"), true))
                .thenReturn(new ImportSummary(1L, 1, 1, 0, 0, 0));

        orchestrator.onApplicationReady();

        verify(matchImportService).importLog(Path.of("/logs/Player.log"), true);
    }
}
