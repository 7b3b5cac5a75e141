package com.loopflow.loopflow_engine.config;

import com.loopflow.loopflow_engine.model.domain.Credential;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything under the {@code loopflow.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "loopflow")
public class LoopflowProperties {

    public enum Edition { COMMUNITY, ENTERPRISE }

    /** Root of the automation, schedule and log files. */
    private String dataDir = System.getProperty("user.home") + "/.loopflow";

    private Edition edition = Edition.COMMUNITY;

    /** Upper bound for enterprise systemCommand steps that do not set their own timeout. */
    private int commandTimeoutSeconds = 60;

    private Scheduler scheduler = new Scheduler();
    private Browser browser = new Browser();

    /** Credentials by id, served by the configured credential lookup. */
    private Map<String, Credential> credentials = new LinkedHashMap<>();

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public boolean isEnterprise() {
        return edition == Edition.ENTERPRISE;
    }

    @Data
    public static class Scheduler {
        private int poolSize = 4;
        private boolean replayOnStartup = true;
    }

    @Data
    public static class Browser {
        private int viewportWidth = 1280;
        private int viewportHeight = 800;
        private double navigationTimeoutMs = 30_000;
        private double selectorTimeoutMs = 10_000;
        /** Where screenshots without an explicit save path are written. */
        private String screenshotDir = ".";
    }
}
