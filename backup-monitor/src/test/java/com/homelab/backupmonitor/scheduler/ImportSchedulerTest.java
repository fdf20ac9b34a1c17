package com.homelab.backupmonitor.scheduler;

import com.homelab.backupmonitor.config.BackupMonitorProperties;
import com.homelab.backupmonitor.model.ImportRun;
import com.homelab.backupmonitor.service.MetricsImportService;
import com.homelab.backupmonitor.store.BackupRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.config.IntervalTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImportScheduler")
class ImportSchedulerTest {

    @Mock
    private MetricsImportService importService;

    @Mock
    private BackupRecordStore store;

    private BackupMonitorProperties properties;
    private ImportScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new BackupMonitorProperties();
        scheduler = new ImportScheduler(importService, store, properties);
    }

    @Test
    @DisplayName("a failed pass is logged and the next pass still runs")
    void failedPassDoesNotStopSchedule() {
        when(importService.importFromSource(any()))
                .thenThrow(new DataAccessResourceFailureException("database is locked"))
                .thenReturn(ImportRun.builder().recordsInserted(4).build());

        assertThatCode(scheduler::runScheduledImport).doesNotThrowAnyException();
        assertThatCode(scheduler::runScheduledImport).doesNotThrowAnyException();

        verify(importService, times(2)).importFromSource(any());
    }

    @Test
    @DisplayName("the first pass is tagged STARTUP and later passes SCHEDULED")
    void triggers() {
        when(importService.importFromSource(any())).thenReturn(ImportRun.builder().build());

        scheduler.runScheduledImport();
        scheduler.runScheduledImport();

        var order = inOrder(importService);
        order.verify(importService).importFromSource(ImportRun.Trigger.STARTUP);
        order.verify(importService).importFromSource(ImportRun.Trigger.SCHEDULED);
    }

    @Test
    @DisplayName("registers a fixed-delay task that starts immediately")
    void registersFixedDelayTask() {
        properties.getImporting().setIntervalHours("6");
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler.configureTasks(registrar);

        List<IntervalTask> tasks = registrar.getFixedDelayTaskList();
        assertThat(tasks).hasSize(1);
        assertThat(tasks.get(0).getIntervalDuration()).isEqualTo(Duration.ofHours(6));
        assertThat(tasks.get(0).getInitialDelayDuration()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("clamps a too-small interval to one minute")
    void clampsInterval() {
        properties.getImporting().setIntervalHours("0.001");
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler.configureTasks(registrar);

        assertThat(registrar.getFixedDelayTaskList().get(0).getIntervalDuration())
                .isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("startup survives an unavailable database")
    void startupToleratesSchemaFailure() {
        doThrow(new DataAccessResourceFailureException("unable to open database file"))
                .when(store).ensureSchema();

        assertThatCode(scheduler::onStartup).doesNotThrowAnyException();
        verify(store).ensureSchema();
    }
}
