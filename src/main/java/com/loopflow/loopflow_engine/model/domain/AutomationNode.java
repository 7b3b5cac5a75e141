package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.loopflow.loopflow_engine.model.step.BranchCondition;
import com.loopflow.loopflow_engine.model.step.NodeKind;
import com.loopflow.loopflow_engine.model.step.NodeKindDeserializer;
import com.loopflow.loopflow_engine.model.step.NodeType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomationNode {

    private String id;

    @JsonDeserialize(using = NodeKindDeserializer.class)
    private NodeKind kind;

    // Canvas coordinates; the engine never reads them
    private Map<String, Object> position = new LinkedHashMap<>();

    public static AutomationNode of(String id, NodeKind kind) {
        return new AutomationNode(id, kind, new LinkedHashMap<>());
    }

    @JsonIgnore
    public NodeType getType() {
        return kind != null ? kind.type() : null;
    }

    @JsonIgnore
    public boolean isBranch() {
        return kind instanceof BranchCondition;
    }
}
