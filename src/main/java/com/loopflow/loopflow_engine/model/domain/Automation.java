package com.loopflow.loopflow_engine.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.loopflow.loopflow_engine.exception.InvalidGraphException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A user-authored automation: the step graph plus its schedule and default variables.
 * Stored as one JSON document per automation and always overwritten as a whole.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Automation {

    private String id;
    private String name;
    private String description;

    @Builder.Default
    private List<AutomationNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<AutomationEdge> edges = new ArrayList<>();

    @Builder.Default
    private ScheduleSpec schedule = new ScheduleSpec.Manual();

    @Builder.Default
    private boolean headless = true;

    @Builder.Default
    private boolean enabled = true;

    // Seed values copied into every run's variable scope
    @Builder.Default
    private Map<String, Object> variables = new LinkedHashMap<>();

    public Optional<AutomationNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId() != null && n.getId().equals(nodeId)).findFirst();
    }

    /**
     * Appends an edge after checking it against the edges already leaving the same node.
     * A condition node takes at most one "if" and one "else" edge; any other node takes
     * at most one unlabelled edge and no labelled ones.
     */
    public void addEdge(AutomationEdge edge) {
        checkEdge(edge, edges);
        edges.add(edge);
    }

    /** Re-checks every edge of the graph with the same rules as {@link #addEdge}. */
    public void validateBranchLabels() {
        List<AutomationEdge> accepted = new ArrayList<>();
        for (AutomationEdge edge : edges) {
            checkEdge(edge, accepted);
            accepted.add(edge);
        }
    }

    private void checkEdge(AutomationEdge edge, List<AutomationEdge> existing) {
        boolean branchSource = findNode(edge.getSource()).map(AutomationNode::isBranch).orElse(false);

        if (branchSource) {
            String label = edge.getBranch();
            if (!AutomationEdge.IF.equals(label) && !AutomationEdge.ELSE.equals(label)) {
                throw new InvalidGraphException("Edge " + edge.getId() + " leaves condition node "
                        + edge.getSource() + " and must be labelled \"if\" or \"else\", got: " + label);
            }
            boolean taken = existing.stream()
                    .anyMatch(e -> edge.getSource().equals(e.getSource()) && label.equals(e.getBranch()));
            if (taken) {
                throw new InvalidGraphException("Condition node " + edge.getSource()
                        + " already has an \"" + label + "\" edge");
            }
            return;
        }

        if (edge.isLabelled()) {
            throw new InvalidGraphException("Edge " + edge.getId() + " carries branch label \""
                    + edge.getBranch() + "\" but " + edge.getSource() + " is not a condition node");
        }
        boolean taken = existing.stream()
                .anyMatch(e -> edge.getSource() != null && edge.getSource().equals(e.getSource()) && !e.isLabelled());
        if (taken) {
            throw new InvalidGraphException("Node " + edge.getSource() + " already has an outgoing edge");
        }
    }
}
