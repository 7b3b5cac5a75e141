package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AutomationEdge {

    public static final String IF   = "if";
    public static final String ELSE = "else";

    private String id;
    private String source;
    private String target;

    // "if" / "else" on edges leaving a condition node, absent otherwise
    @JsonAlias("sourceHandle")
    private String branch;

    public static AutomationEdge plain(String id, String source, String target) {
        return new AutomationEdge(id, source, target, null);
    }

    public static AutomationEdge branch(String id, String source, String target, String branch) {
        return new AutomationEdge(id, source, target, branch);
    }

    @JsonIgnore
    public boolean isLabelled() {
        return branch != null && !branch.isBlank();
    }
}
