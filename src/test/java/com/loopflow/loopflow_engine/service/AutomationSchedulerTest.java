package com.loopflow.loopflow_engine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.engine.ExecutionMode;
import com.loopflow.loopflow_engine.engine.ExecutionRequest;
import com.loopflow.loopflow_engine.engine.GraphExecutor;
import com.loopflow.loopflow_engine.engine.RunOutcome;
import com.loopflow.loopflow_engine.engine.RunStatus;
import com.loopflow.loopflow_engine.exception.InvalidGraphException;
import com.loopflow.loopflow_engine.exception.ScheduleConfigurationException;
import com.loopflow.loopflow_engine.model.domain.Automation;
import com.loopflow.loopflow_engine.model.domain.AutomationNode;
import com.loopflow.loopflow_engine.model.domain.ExecutionLogEntry;
import com.loopflow.loopflow_engine.model.domain.IntervalUnit;
import com.loopflow.loopflow_engine.model.domain.ScheduleSpec;
import com.loopflow.loopflow_engine.model.domain.WorkflowSchedule;
import com.loopflow.loopflow_engine.model.step.SetVariableStep;
import com.loopflow.loopflow_engine.repository.AutomationRepository;
import com.loopflow.loopflow_engine.repository.ExecutionLogRepository;
import com.loopflow.loopflow_engine.repository.ScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutomationSchedulerTest {

    @TempDir
    Path dataDir;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ObjectProvider<CronEngine> cronEngines;

    @Mock
    private GraphExecutor graphExecutor;

    private AutomationRepository automations;
    private ScheduleRepository schedules;
    private ExecutionLogRepository logs;
    private AutomationScheduler scheduler;

    @BeforeEach
    void setUp() {
        LoopflowProperties properties = new LoopflowProperties();
        properties.setDataDir(dataDir.toString());
        ObjectMapper mapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        automations = new AutomationRepository(properties, mapper);
        schedules = new ScheduleRepository(properties, mapper);
        logs = new ExecutionLogRepository(properties, mapper);
        scheduler = new AutomationScheduler(taskScheduler, cronEngines, graphExecutor, automations, schedules, logs);
    }

    private Automation storedAutomation(String id) {
        Automation automation = Automation.builder()
                .id(id)
                .name("Flow " + id)
                .nodes(new ArrayList<>(List.of(AutomationNode.of("n1", SetVariableStep.of("x", "1")))))
                .variables(Map.of("seed", 1))
                .build();
        return automations.save(automation);
    }

    private static RunOutcome completed() {
        return RunOutcome.builder()
                .status(RunStatus.COMPLETED)
                .stepsExecuted(1)
                .stepsSucceeded(1)
                .visitedNodeIds(List.of("n1"))
                .duration(Duration.ofMillis(12))
                .finalVariables(Map.of("seed", 1, "x", 1))
                .build();
    }

    private void runScheduledTasksImmediately() {
        doAnswer(invocation -> {
            invocation.getArgument(0, Runnable.class).run();
            return null;
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void onceInThePastRunsImmediatelyThenDisablesTheSchedule() {
        storedAutomation("f1");
        runScheduledTasksImmediately();
        when(graphExecutor.execute(any(), any())).thenReturn(completed());

        WorkflowSchedule schedule = scheduler.createSchedule("f1", new ScheduleSpec.Once("2020-01-01T00:00:00Z"), true);

        List<ExecutionLogEntry> entries = scheduler.getExecutionLogs("f1", 10);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).isSuccess()).isTrue();
        assertThat(entries.get(0).getStepsExecuted()).isEqualTo(1);
        assertThat(entries.get(0).getFinalVariables()).isNull();
        assertThat(schedules.findById(schedule.getId())).get().extracting(WorkflowSchedule::isEnabled).isEqualTo(false);
        assertThat(scheduler.getScheduledTasks()).isEmpty();

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(any(Runnable.class), at.capture());
        assertThat(at.getValue()).isAfter(Instant.parse("2020-01-01T00:00:00Z"));
    }

    @Test
    void eachRunGetsAFreshScopeAndTheScheduleHeadlessFlag() {
        storedAutomation("f1");
        when(graphExecutor.execute(any(), any())).thenReturn(completed());

        ExecutionLogEntry entry = scheduler.runNow("f1", false);

        ArgumentCaptor<ExecutionRequest> request = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(graphExecutor).execute(any(Automation.class), request.capture());
        assertThat(request.getValue().getMode()).isEqualTo(ExecutionMode.WINDOWED);
        assertThat(request.getValue().getScope().asMap()).containsExactly(Map.entry("seed", 1));
        assertThat(entry.getFinalVariables()).containsEntry("x", 1);
        assertThat(logs.findRecent("f1", 5)).hasSize(1);
    }

    @Test
    void invalidGraphIsLoggedAsAFailedRun() {
        storedAutomation("f1");
        when(graphExecutor.execute(any(), any())).thenThrow(new InvalidGraphException("No nodes to execute"));

        ExecutionLogEntry entry = scheduler.runNow("f1", null);

        assertThat(entry.isSuccess()).isFalse();
        assertThat(entry.getError()).isEqualTo("No nodes to execute");
        assertThat(scheduler.getExecutionLogs("f1", 5)).extracting(ExecutionLogEntry::getError)
                .containsExactly("No nodes to execute");
    }

    @Test
    void runNowOfUnknownAutomationFails() {
        assertThatThrownBy(() -> scheduler.runNow("ghost", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Automation not found: ghost");
    }

    @Test
    void intervalArmsFixedRateTimerAndUnscheduleCancelsIt() {
        Automation automation = storedAutomation("f1");
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        boolean armed = scheduler.scheduleAutomation(automation, new ScheduleSpec.Interval(2, IntervalUnit.HOURS), "s1", null);

        assertThat(armed).isTrue();
        ArgumentCaptor<Instant> first = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), first.capture(), eq(Duration.ofHours(2)));
        assertThat(first.getValue()).isAfter(Instant.now().plus(Duration.ofMinutes(119)));
        assertThat(scheduler.getScheduledTasks()).singleElement()
                .satisfies(task -> {
                    assertThat(task.getScheduleId()).isEqualTo("s1");
                    assertThat(task.getScheduleType()).isEqualTo("interval");
                    assertThat(task.isHeadless()).isTrue();
                });

        assertThat(scheduler.unscheduleAutomation("s1")).isTrue();
        verify(future).cancel(false);
        assertThat(scheduler.getScheduledTasks()).isEmpty();
        assertThat(scheduler.unscheduleAutomation("s1")).isFalse();
    }

    @Test
    void reschedulingTheSameIdReplacesTheTimer() {
        Automation automation = storedAutomation("f1");
        ScheduledFuture<?> first = mock(ScheduledFuture.class);
        ScheduledFuture<?> second = mock(ScheduledFuture.class);
        doReturn(first, second).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.scheduleAutomation(automation, new ScheduleSpec.Interval(5, IntervalUnit.MINUTES), "s1", null);
        scheduler.scheduleAutomation(automation, new ScheduleSpec.Interval(10, IntervalUnit.MINUTES), "s1", null);

        verify(first).cancel(false);
        assertThat(scheduler.getScheduledTasks()).hasSize(1);
    }

    @Test
    void manualScheduleArmsNothing() {
        Automation automation = storedAutomation("f1");

        assertThat(scheduler.scheduleAutomation(automation, new ScheduleSpec.Manual(), "s1", null)).isFalse();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void cronGoesThroughTheCronEngine() {
        Automation automation = storedAutomation("f1");
        when(cronEngines.getIfAvailable()).thenReturn(new SpringCronEngine());

        boolean armed = scheduler.scheduleAutomation(automation, new ScheduleSpec.Cron("*/15 * * * *"), "s1", null);

        assertThat(armed).isTrue();
        verify(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Test
    void invalidCronArmsNothing() {
        Automation automation = storedAutomation("f1");
        when(cronEngines.getIfAvailable()).thenReturn(new SpringCronEngine());

        assertThatThrownBy(() -> scheduler.scheduleAutomation(automation, new ScheduleSpec.Cron("every tuesday"), "s1", null))
                .isInstanceOf(ScheduleConfigurationException.class);
        assertThat(scheduler.getScheduledTasks()).isEmpty();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void cronWithoutEngineIsAConfigurationError() {
        Automation automation = storedAutomation("f1");

        assertThatThrownBy(() -> scheduler.scheduleAutomation(automation, new ScheduleSpec.Cron("0 9 * * *"), "s1", null))
                .isInstanceOf(ScheduleConfigurationException.class)
                .hasMessageContaining("no cron engine");
    }

    @Test
    void createScheduleWithInvalidCronKeepsNothing() {
        storedAutomation("f1");
        when(cronEngines.getIfAvailable()).thenReturn(new SpringCronEngine());

        assertThatThrownBy(() -> scheduler.createSchedule("f1", new ScheduleSpec.Cron("61 * * * *"), null))
                .isInstanceOf(ScheduleConfigurationException.class);
        assertThat(schedules.findAll()).isEmpty();
    }

    @Test
    void startupReplayArmsOnlyEnabledSchedulesWithExistingAutomations() {
        storedAutomation("f1");
        schedules.save(WorkflowSchedule.builder().id("on").workflowId("f1")
                .schedule(new ScheduleSpec.Interval(1, IntervalUnit.DAYS)).build());
        schedules.save(WorkflowSchedule.builder().id("off").workflowId("f1").enabled(false)
                .schedule(new ScheduleSpec.Interval(1, IntervalUnit.DAYS)).build());
        schedules.save(WorkflowSchedule.builder().id("orphan").workflowId("deleted")
                .schedule(new ScheduleSpec.Interval(1, IntervalUnit.DAYS)).build());
        schedules.save(WorkflowSchedule.builder().id("broken").workflowId("f1")
                .schedule(new ScheduleSpec.Interval(0, IntervalUnit.MINUTES)).build());

        int armed = scheduler.loadAndActivateSchedules();

        assertThat(armed).isEqualTo(1);
        assertThat(scheduler.getScheduledTasks()).extracting(ScheduledTask::getScheduleId).containsExactly("on");
    }

    @Test
    void toggleOffPersistsAndDisarms() {
        storedAutomation("f1");
        schedules.save(WorkflowSchedule.builder().id("s1").workflowId("f1")
                .schedule(new ScheduleSpec.Interval(30, IntervalUnit.MINUTES)).build());
        scheduler.loadAndActivateSchedules();

        scheduler.toggle("s1", false);

        assertThat(schedules.findById("s1")).get().extracting(WorkflowSchedule::isEnabled).isEqualTo(false);
        assertThat(scheduler.getScheduledTasks()).isEmpty();

        scheduler.toggle("s1", true);

        assertThat(schedules.findById("s1")).get().extracting(WorkflowSchedule::isEnabled).isEqualTo(true);
        assertThat(scheduler.getScheduledTasks()).hasSize(1);
    }

    @Test
    void deleteScheduleRemovesFileAndTimer() {
        storedAutomation("f1");
        WorkflowSchedule schedule = scheduler.createSchedule("f1", new ScheduleSpec.Interval(3, IntervalUnit.HOURS), null);

        assertThat(scheduler.deleteSchedule(schedule.getId())).isTrue();
        assertThat(schedules.findById(schedule.getId())).isEmpty();
        assertThat(scheduler.getScheduledTasks()).isEmpty();
    }

    @Test
    void cleanupCancelsEverything() {
        Automation automation = storedAutomation("f1");
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        scheduler.scheduleAutomation(automation, new ScheduleSpec.Interval(1, IntervalUnit.MINUTES), "s1", null);

        scheduler.cleanup();

        verify(future).cancel(false);
        assertThat(scheduler.getScheduledTasks()).isEmpty();
    }

    @Test
    void oneTimeRunFinishingLateLeavesAReArmedTimerInPlace() {
        Automation automation = storedAutomation("f1");
        schedules.save(WorkflowSchedule.builder().id("s1").workflowId("f1")
                .schedule(new ScheduleSpec.Once("2999-01-01T00:00:00Z")).build());
        when(graphExecutor.execute(any(), any())).thenReturn(completed());
        ArgumentCaptor<Runnable> onceRun = ArgumentCaptor.forClass(Runnable.class);
        ScheduledFuture<?> onceFuture = mock(ScheduledFuture.class);
        ScheduledFuture<?> intervalFuture = mock(ScheduledFuture.class);
        doReturn(onceFuture).when(taskScheduler).schedule(onceRun.capture(), any(Instant.class));
        doReturn(intervalFuture).when(taskScheduler)
                .scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));

        scheduler.scheduleAutomation(automation, new ScheduleSpec.Once("2999-01-01T00:00:00Z"), "s1", null);
        scheduler.scheduleAutomation(automation, new ScheduleSpec.Interval(1, IntervalUnit.HOURS), "s1", null);
        onceRun.getValue().run();

        assertThat(scheduler.getScheduledTasks()).singleElement()
                .extracting(ScheduledTask::getScheduleType).isEqualTo("interval");
        assertThat(schedules.findById("s1")).get().extracting(WorkflowSchedule::isEnabled).isEqualTo(true);
        assertThat(logs.findRecent("f1", 5)).hasSize(1);
    }

    @Test
    void unexpectedRuntimeFailureStillWritesALogEntry() {
        storedAutomation("f1");
        when(graphExecutor.execute(any(), any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenThrow(new NullPointerException());

        ExecutionLogEntry first = scheduler.runNow("f1", true);
        ExecutionLogEntry second = scheduler.runNow("f1", true);

        assertThat(first.isSuccess()).isFalse();
        assertThat(first.getError()).isEqualTo("boom");
        assertThat(second.getError()).isEqualTo("NullPointerException");
        assertThat(logs.findRecent("f1", 5)).hasSize(2);
    }
}
