package com.loopflow.loopflow_engine.service;

import com.loopflow.loopflow_engine.engine.ExecutionMode;
import com.loopflow.loopflow_engine.engine.ExecutionRequest;
import com.loopflow.loopflow_engine.engine.GraphExecutor;
import com.loopflow.loopflow_engine.engine.RunOutcome;
import com.loopflow.loopflow_engine.exception.AutomationException;
import com.loopflow.loopflow_engine.exception.ScheduleConfigurationException;
import com.loopflow.loopflow_engine.model.domain.Automation;
import com.loopflow.loopflow_engine.model.domain.ExecutionLogEntry;
import com.loopflow.loopflow_engine.model.domain.ScheduleSpec;
import com.loopflow.loopflow_engine.model.domain.WorkflowSchedule;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.repository.AutomationRepository;
import com.loopflow.loopflow_engine.repository.ExecutionLogRepository;
import com.loopflow.loopflow_engine.repository.ScheduleRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Arms timers for stored schedules and runs the automation when one fires.
 *
 * At most one timer exists per schedule id. Every firing loads the automation fresh from
 * disk, runs it with a new variable scope and appends one execution log entry. Nothing
 * thrown by a run escapes into the task scheduler's threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationScheduler {

    private final TaskScheduler              taskScheduler;
    private final ObjectProvider<CronEngine> cronEngineProvider;
    private final GraphExecutor              graphExecutor;
    private final AutomationRepository       automationRepository;
    private final ScheduleRepository         scheduleRepository;
    private final ExecutionLogRepository     executionLogRepository;

    private final Map<String, ArmedTask> tasks = new ConcurrentHashMap<>();

    private record ArmedTask(ScheduledTask info, ScheduledFuture<?> future) {
        void cancel() {
            if (future != null) future.cancel(false);
        }
    }

    // ── Arming ────────────────────────────────────────────────────────────────

    /**
     * Arms a timer for {@code automation} under {@code scheduleId}, replacing any timer
     * already registered for that id.
     *
     * @param headless overrides the automation's own flag when not null
     * @return false for a manual schedule, true once a timer is armed
     * @throws ScheduleConfigurationException when the schedule cannot be armed
     */
    public boolean scheduleAutomation(Automation automation, ScheduleSpec spec, String scheduleId, Boolean headless) {
        if (spec == null || spec instanceof ScheduleSpec.Manual) {
            unscheduleAutomation(scheduleId);
            return false;
        }
        unscheduleAutomation(scheduleId);

        String automationId = automation.getId();
        boolean runHeadless = headless != null ? headless : automation.isHeadless();
        ZoneId zone = ZoneId.systemDefault();
        Instant now = Instant.now();

        ScheduledTask info = ScheduledTask.builder()
                .scheduleId(scheduleId)
                .automationId(automationId)
                .automationName(automation.getName())
                .scheduleType(spec.typeName())
                .headless(runHeadless)
                .armedAt(now)
                .build();

        ScheduledFuture<?> future;
        AtomicBoolean finished = new AtomicBoolean(false);
        AtomicReference<ArmedTask> self = new AtomicReference<>();

        if (spec instanceof ScheduleSpec.Interval interval) {
            Duration period = interval.period();
            future = taskScheduler.scheduleAtFixedRate(
                    () -> fire(scheduleId, automationId, headless), now.plus(period), period);
            log.info("Schedule {} armed: '{}' every {} {}", scheduleId, automation.getName(),
                    interval.interval(), interval.unit().name().toLowerCase());

        } else if (spec instanceof ScheduleSpec.Cron cron) {
            CronEngine cronEngine = cronEngineProvider.getIfAvailable();
            if (cronEngine == null) {
                throw new ScheduleConfigurationException("Cron schedules are not supported: no cron engine is available");
            }
            future = taskScheduler.schedule(
                    () -> fire(scheduleId, automationId, headless), cronEngine.trigger(cron.expression(), zone));
            log.info("Schedule {} armed: '{}' on cron '{}'", scheduleId, automation.getName(), cron.expression());

        } else if (spec instanceof ScheduleSpec.Once once) {
            Instant at = once.resolveInstant(zone);
            if (at.isBefore(now)) {
                log.info("Schedule {} target {} is in the past, running '{}' now", scheduleId, at, automation.getName());
                at = now;
            } else {
                log.info("Schedule {} armed: '{}' once at {}", scheduleId, automation.getName(), at);
            }
            future = taskScheduler.schedule(() -> fireOnce(scheduleId, automationId, headless, finished, self), at);

        } else {
            throw new ScheduleConfigurationException("Unsupported schedule type: " + spec.typeName());
        }

        ArmedTask armed = new ArmedTask(info, future);
        self.set(armed);
        tasks.put(scheduleId, armed);
        // a once task may already have run on a synchronous scheduler
        if (finished.get()) tasks.remove(scheduleId, armed);
        return true;
    }

    public boolean unscheduleAutomation(String scheduleId) {
        ArmedTask armed = tasks.remove(scheduleId);
        if (armed == null) return false;
        armed.cancel();
        log.info("Schedule {} disarmed", scheduleId);
        return true;
    }

    public List<ScheduledTask> getScheduledTasks() {
        return tasks.values().stream().map(ArmedTask::info).toList();
    }

    /**
     * Re-arms every enabled stored schedule. Called once at startup; entries whose
     * automation is gone or whose schedule is invalid are skipped.
     *
     * @return number of timers armed
     */
    public int loadAndActivateSchedules() {
        int armed = 0;
        for (WorkflowSchedule schedule : scheduleRepository.findAll()) {
            if (!schedule.isEnabled()) continue;
            Optional<Automation> automation = automationRepository.findById(schedule.getWorkflowId());
            if (automation.isEmpty()) {
                log.warn("Schedule {} skipped: automation {} not found", schedule.getId(), schedule.getWorkflowId());
                continue;
            }
            try {
                if (scheduleAutomation(automation.get(), schedule.getSchedule(), schedule.getId(), schedule.getHeadless())) {
                    armed++;
                }
            } catch (AutomationException e) {
                log.warn("Schedule {} skipped: {}", schedule.getId(), e.getMessage());
            }
        }
        log.info("Activated {} stored schedule(s)", armed);
        return armed;
    }

    // ── Stored schedules ──────────────────────────────────────────────────────

    /**
     * Stores a new schedule entry for an automation and arms it. An entry whose schedule
     * cannot be armed is not kept.
     */
    public WorkflowSchedule createSchedule(String automationId, ScheduleSpec spec, Boolean headless) {
        Automation automation = automationRepository.findById(automationId)
                .orElseThrow(() -> new IllegalArgumentException("Automation not found: " + automationId));

        WorkflowSchedule schedule = WorkflowSchedule.builder()
                .id(UUID.randomUUID().toString())
                .workflowId(automationId)
                .workflowName(automation.getName())
                .schedule(spec != null ? spec : new ScheduleSpec.Manual())
                .headless(headless)
                .build();
        scheduleRepository.save(schedule);

        try {
            scheduleAutomation(automation, schedule.getSchedule(), schedule.getId(), headless);
        } catch (RuntimeException e) {
            scheduleRepository.deleteById(schedule.getId());
            throw e;
        }
        return schedule;
    }

    /**
     * Persists the enabled flag. Disabling cancels the timer; enabling arms it again from
     * now, missed firings are not caught up.
     */
    public WorkflowSchedule toggle(String scheduleId, boolean enabled) {
        WorkflowSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new IllegalArgumentException("Schedule not found: " + scheduleId));
        schedule.setEnabled(enabled);
        scheduleRepository.save(schedule);

        if (!enabled) {
            unscheduleAutomation(scheduleId);
            return schedule;
        }
        Automation automation = automationRepository.findById(schedule.getWorkflowId())
                .orElseThrow(() -> new IllegalArgumentException("Automation not found: " + schedule.getWorkflowId()));
        scheduleAutomation(automation, schedule.getSchedule(), scheduleId, schedule.getHeadless());
        return schedule;
    }

    public boolean deleteSchedule(String scheduleId) {
        unscheduleAutomation(scheduleId);
        return scheduleRepository.deleteById(scheduleId);
    }

    public List<ExecutionLogEntry> getExecutionLogs(String automationId, int limit) {
        return executionLogRepository.findRecent(automationId, limit);
    }

    // ── Running ───────────────────────────────────────────────────────────────

    /** Runs an automation immediately on the calling thread and records the outcome. */
    public ExecutionLogEntry runNow(String automationId, Boolean headless) {
        Automation automation = automationRepository.findById(automationId)
                .orElseThrow(() -> new IllegalArgumentException("Automation not found: " + automationId));
        return executeAndLog(automation, headless);
    }

    private void fire(String scheduleId, String automationId, Boolean headless) {
        try {
            Optional<Automation> automation = automationRepository.findById(automationId);
            if (automation.isEmpty()) {
                log.warn("Schedule {} fired but automation {} no longer exists", scheduleId, automationId);
                return;
            }
            log.info("Schedule {} fired for '{}'", scheduleId, automation.get().getName());
            executeAndLog(automation.get(), headless);
        } catch (RuntimeException e) {
            log.error("Schedule {} run of automation {} failed: {}", scheduleId, automationId, e.getMessage(), e);
        }
    }

    private void fireOnce(String scheduleId, String automationId, Boolean headless,
                          AtomicBoolean finished, AtomicReference<ArmedTask> self) {
        try {
            fire(scheduleId, automationId, headless);
        } finally {
            finished.set(true);
            // only this task; the id may have been re-armed meanwhile
            ArmedTask armed = self.get();
            if (armed != null) tasks.remove(scheduleId, armed);
            if (armed == null || !tasks.containsKey(scheduleId)) {
                disableStoredSchedule(scheduleId);
            }
        }
    }

    private void disableStoredSchedule(String scheduleId) {
        try {
            scheduleRepository.findById(scheduleId).ifPresent(schedule -> {
                schedule.setEnabled(false);
                scheduleRepository.save(schedule);
            });
        } catch (AutomationException e) {
            log.error("Could not disable one-time schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    private ExecutionLogEntry executeAndLog(Automation automation, Boolean headless) {
        boolean runHeadless = headless != null ? headless : automation.isHeadless();
        ExecutionMode mode = runHeadless ? ExecutionMode.HEADLESS : ExecutionMode.WINDOWED;
        Instant started = Instant.now();

        ExecutionLogEntry.ExecutionLogEntryBuilder entry = ExecutionLogEntry.builder()
                .automationId(automation.getId())
                .automationName(automation.getName())
                .timestamp(started);
        try {
            RunOutcome outcome = graphExecutor.execute(automation,
                    ExecutionRequest.of(mode, new RuntimeVariableScope(automation.getVariables())));
            entry.success(outcome.isSuccess())
                    .error(outcome.getError())
                    .durationMs(outcome.getDuration().toMillis())
                    .stepsExecuted(outcome.getStepsExecuted())
                    .stepsSucceeded(outcome.getStepsSucceeded());
            if (mode == ExecutionMode.WINDOWED) {
                entry.finalVariables(outcome.getFinalVariables());
            }
        } catch (RuntimeException e) {
            if (!(e instanceof AutomationException)) {
                log.error("Automation '{}' crashed", automation.getName(), e);
            }
            entry.success(false)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .durationMs(Duration.between(started, Instant.now()).toMillis());
        }

        ExecutionLogEntry written = entry.build();
        log.info("Automation '{}' finished: success={} in {} ms{}", automation.getName(), written.isSuccess(),
                written.getDurationMs(), written.getError() != null ? " (" + written.getError() + ")" : "");
        try {
            executionLogRepository.append(written);
        } catch (AutomationException e) {
            log.error("Could not write execution log for {}: {}", automation.getId(), e.getMessage());
        }
        return written;
    }

    @PreDestroy
    public void cleanup() {
        tasks.values().forEach(ArmedTask::cancel);
        int count = tasks.size();
        tasks.clear();
        log.info("Cancelled {} scheduled task(s)", count);
    }
}
