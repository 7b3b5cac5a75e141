package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Host-level step available only in the enterprise edition.
 *
 * fileSystem          → operation (read|write|copy|move|delete|exists), sourcePath, destinationPath, content, encoding
 * systemCommand       → command, args, workingDirectory, timeoutSeconds
 * environmentVariable → operation (get|set), variableName, value
 * databaseQuery       → databaseType, connectionString, query, parameters
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnterpriseStep(NodeType type,
                             String operation,
                             String sourcePath,
                             String destinationPath,
                             String content,
                             String encoding,
                             String command,
                             List<String> args,
                             String workingDirectory,
                             Integer timeoutSeconds,
                             String variableName,
                             String value,
                             String databaseType,
                             String connectionString,
                             String query,
                             List<Object> parameters,
                             String storeKey) implements Step {

    public EnterpriseStep {
        NodeType.requireFamily(type, NodeType.Family.ENTERPRISE);
        args       = args != null ? args : List.of();
        parameters = parameters != null ? parameters : List.of();
    }
}
