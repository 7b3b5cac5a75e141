package com.loopflow.loopflow_engine.executor.impl;

import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.exception.CapabilityUnavailableException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.model.step.EnterpriseStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.Step;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Host-level steps: file system, shell commands, environment variables and JDBC queries.
 *
 * Only the enterprise edition runs them. In the community edition every one of them fails
 * with {@link CapabilityUnavailableException} before touching the host.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnterpriseStepHandler implements StepHandler {

    private static final boolean WINDOWS = File.separatorChar == '\\';

    // Statements answered with a result set; anything else is run as an update
    private static final Pattern LEADING_KEYWORD = Pattern.compile("\\s*\\(*\\s*([A-Za-z]+)");
    private static final Set<String> ROW_KEYWORDS =
            Set.of("SELECT", "WITH", "VALUES", "SHOW", "EXPLAIN", "DESCRIBE", "DESC", "PRAGMA", "TABLE");

    private final LoopflowProperties properties;

    // environmentVariable "set" stays inside this process
    private final Map<String, String> environmentOverrides = new ConcurrentHashMap<>();

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.of(NodeType.FILE_SYSTEM, NodeType.SYSTEM_COMMAND,
                NodeType.ENVIRONMENT_VARIABLE, NodeType.DATABASE_QUERY);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        EnterpriseStep es = (EnterpriseStep) step;
        if (!properties.isEnterprise()) {
            String capability = capabilityOf(es.type());
            throw new CapabilityUnavailableException(capability,
                    "Feature '" + capability + "' requires the Enterprise edition");
        }

        Object result = switch (es.type()) {
            case FILE_SYSTEM          -> fileSystem(es, context);
            case SYSTEM_COMMAND       -> systemCommand(es, context);
            case ENVIRONMENT_VARIABLE -> environmentVariable(es, context);
            case DATABASE_QUERY       -> databaseQuery(es, context);
            default -> throw new UnsupportedOperationException("Not an enterprise step: " + es.type());
        };
        return StepResult.of(result);
    }

    static String capabilityOf(NodeType type) {
        return switch (type) {
            case FILE_SYSTEM    -> "fileSystemAutomation";
            case DATABASE_QUERY -> "databaseAutomation";
            default             -> "systemAutomation";
        };
    }

    // ── File system ───────────────────────────────────────────────────────────

    private Object fileSystem(EnterpriseStep step, StepContext context) {
        String operation = step.operation() == null || step.operation().isBlank() ? "read" : step.operation();
        String sourceText = context.resolve(step.sourcePath());
        if (sourceText.isBlank()) {
            throw new StepExecutionException("fileSystem step has no sourcePath");
        }
        Path source = Path.of(sourceText).toAbsolutePath().normalize();
        Charset charset = charsetOf(step.encoding());

        try {
            switch (operation) {
                case "read":
                    return Files.readString(source, charset);
                case "write": {
                    String content = context.resolve(step.content());
                    if (content.isEmpty()) throw new StepExecutionException("Content is required for write operation");
                    Files.writeString(source, content, charset);
                    return Map.of("success", true, "path", source.toString());
                }
                case "copy":
                case "move": {
                    String dest = context.resolve(step.destinationPath());
                    if (dest.isBlank()) {
                        throw new StepExecutionException("Destination path is required for " + operation + " operation");
                    }
                    Path target = Path.of(dest).toAbsolutePath().normalize();
                    if ("copy".equals(operation)) {
                        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                    } else {
                        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
                    }
                    return Map.of("success", true, "from", source.toString(), "to", target.toString());
                }
                case "delete":
                    Files.delete(source);
                    return Map.of("success", true, "path", source.toString());
                case "exists":
                    return Map.of("exists", Files.exists(source), "path", source.toString());
                default:
                    throw new StepExecutionException("Unknown file operation: " + operation);
            }
        } catch (IOException e) {
            throw new StepExecutionException("File " + operation + " failed for " + source + ": "
                    + StepExecutionException.describe(e), e);
        }
    }

    private static Charset charsetOf(String encoding) {
        if (encoding == null || encoding.isBlank()) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(encoding);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new StepExecutionException("Unsupported encoding: " + encoding, e);
        }
    }

    // ── System command ────────────────────────────────────────────────────────

    private Object systemCommand(EnterpriseStep step, StepContext context) {
        String command = context.resolve(step.command()).trim();
        if (command.isEmpty()) {
            throw new StepExecutionException("systemCommand step has no command");
        }
        StringBuilder full = new StringBuilder(command);
        step.args().forEach(arg -> full.append(' ').append(context.resolve(arg)));

        List<String> argv = WINDOWS ? List.of("cmd", "/c", full.toString()) : List.of("sh", "-c", full.toString());
        ProcessBuilder builder = new ProcessBuilder(argv);
        String cwd = context.resolve(step.workingDirectory());
        if (!cwd.isBlank()) builder.directory(new File(cwd));

        int timeoutSeconds = step.timeoutSeconds() != null && step.timeoutSeconds() > 0
                ? step.timeoutSeconds() : properties.getCommandTimeoutSeconds();

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("loopflow-cmd-", ".out");
            stderrFile = Files.createTempFile("loopflow-cmd-", ".err");
            builder.redirectOutput(stdoutFile.toFile()).redirectError(stderrFile.toFile());

            log.info("[Enterprise] Running command: {}", full);
            Process process = builder.start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new StepExecutionException("Command timed out after " + timeoutSeconds + "s: " + command);
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("stdout", Files.readString(stdoutFile));
            result.put("stderr", Files.readString(stderrFile));
            result.put("exitCode", process.exitValue());
            return result;
        } catch (IOException e) {
            throw new StepExecutionException("Command failed to start: " + StepExecutionException.describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("Command interrupted: " + command, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    // ── Environment ───────────────────────────────────────────────────────────

    private Object environmentVariable(EnterpriseStep step, StepContext context) {
        String name = context.resolve(step.variableName()).trim();
        if (name.isEmpty()) {
            throw new StepExecutionException("environmentVariable step has no variableName");
        }
        String operation = step.operation() == null || step.operation().isBlank() ? "get" : step.operation();

        if ("get".equals(operation)) {
            String value = environmentOverrides.get(name);
            if (value == null) value = System.getenv(name);
            return value != null ? value : "";
        }
        if ("set".equals(operation)) {
            String value = context.resolve(step.value());
            if (value.isEmpty()) throw new StepExecutionException("Value is required for set operation");
            environmentOverrides.put(name, value);
            return Map.of("success", true, "variable", name, "value", value);
        }
        throw new StepExecutionException("Unknown operation: " + operation);
    }

    // ── Database ──────────────────────────────────────────────────────────────

    private Object databaseQuery(EnterpriseStep step, StepContext context) {
        if ("mongodb".equalsIgnoreCase(step.databaseType())) {
            throw new StepExecutionException("Database type mongodb is not supported; use a JDBC database");
        }
        String url = context.resolve(step.connectionString()).trim();
        String query = context.resolve(step.query());
        if (url.isEmpty()) throw new StepExecutionException("databaseQuery step has no connectionString");
        if (query.isBlank()) throw new StepExecutionException("databaseQuery step has no query");
        if (!url.startsWith("jdbc:")) url = "jdbc:" + url;

        Object[] params = step.parameters().stream()
                .map(param -> param instanceof String s ? context.resolve(s) : param)
                .toArray();

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url, true);
        try {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            Map<String, Object> output = new LinkedHashMap<>();
            if (returnsRows(query)) {
                List<Map<String, Object>> rows = jdbcTemplate.queryForList(query, params);
                output.put("rows", rows);
                output.put("rowCount", rows.size());
            } else {
                output.put("rowsAffected", jdbcTemplate.update(query, params));
            }
            return output;
        } catch (DataAccessException ex) {
            log.error("databaseQuery failed: {}", ex.getMostSpecificCause().getMessage());
            throw new StepExecutionException("SQL error: " + ex.getMostSpecificCause().getMessage(), ex);
        } finally {
            dataSource.destroy();
        }
    }

    static boolean returnsRows(String query) {
        Matcher m = LEADING_KEYWORD.matcher(query);
        return m.lookingAt() && ROW_KEYWORDS.contains(m.group(1).toUpperCase(Locale.ROOT));
    }
}
