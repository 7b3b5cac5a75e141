package com.loopflow.loopflow_engine.model.step;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FileUploadStep(NodeType type, String selector, String filePath) implements Step {

    public FileUploadStep {
        type = NodeType.FILE_UPLOAD;
    }
}
