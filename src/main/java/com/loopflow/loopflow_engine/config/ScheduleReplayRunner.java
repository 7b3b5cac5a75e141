package com.loopflow.loopflow_engine.config;

import com.loopflow.loopflow_engine.service.AutomationScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Re-arms the stored schedules once the context is up.
 * Set loopflow.scheduler.replay-on-startup=false to start with no timers.
 */
@Slf4j
@Component
public class ScheduleReplayRunner implements ApplicationRunner {

    private final AutomationScheduler scheduler;
    private final LoopflowProperties properties;

    public ScheduleReplayRunner(AutomationScheduler scheduler, LoopflowProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getScheduler().isReplayOnStartup()) {
            log.info("Schedule replay disabled; no stored schedules armed");
            return;
        }
        log.info("Loading stored schedules from {}", properties.dataPath().toAbsolutePath());
        int armed = scheduler.loadAndActivateSchedules();
        if (armed == 0) {
            log.info("No schedules armed at startup");
        }
    }
}
