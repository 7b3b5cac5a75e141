package com.loopflow.loopflow_engine.engine;

import com.loopflow.loopflow_engine.exception.AutomationException;
import com.loopflow.loopflow_engine.exception.InvalidGraphException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepDispatcher;
import com.loopflow.loopflow_engine.executor.condition.ConditionalEvaluator;
import com.loopflow.loopflow_engine.io.HeadlessBrowserLauncher;
import com.loopflow.loopflow_engine.io.WindowedBrowserSurface;
import com.loopflow.loopflow_engine.model.domain.Automation;
import com.loopflow.loopflow_engine.model.domain.AutomationEdge;
import com.loopflow.loopflow_engine.model.domain.AutomationNode;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.DomCondition;
import com.loopflow.loopflow_engine.model.step.NodeKind;
import com.loopflow.loopflow_engine.model.step.Step;
import com.loopflow.loopflow_engine.model.step.VariableCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks an automation graph depth-first from every start node.
 *
 * Start nodes are the nodes nothing points at, in node order. After a node succeeds its
 * successors run before any sibling of the node: all outgoing edges of an action node, or
 * only the "if" / "else" edges of a condition node. Cycles are allowed and bounded only by
 * {@link #MAX_NODE_VISITS}. The first failing node ends the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphExecutor {

    static final int MAX_NODE_VISITS = 10_000;

    private final StepDispatcher                         dispatcher;
    private final ConditionalEvaluator                   conditionalEvaluator;
    private final HeadlessBrowserLauncher                headlessLauncher;
    private final ObjectProvider<WindowedBrowserSurface> windowedSurfaceProvider;

    public RunOutcome execute(Automation automation, ExecutionRequest request) {
        List<AutomationNode> nodes = automation.getNodes();
        if (nodes == null || nodes.isEmpty()) {
            throw new InvalidGraphException("No nodes to execute");
        }

        Map<String, AutomationNode> nodeMap = new LinkedHashMap<>();
        nodes.forEach(n -> nodeMap.putIfAbsent(n.getId(), n));
        List<AutomationEdge> edges = validEdges(automation.getEdges(), nodeMap);
        List<AutomationNode> startNodes = findStartNodes(nodes, edges);

        Map<String, List<AutomationEdge>> outgoing = new HashMap<>();
        edges.forEach(e -> outgoing.computeIfAbsent(e.getSource(), k -> new ArrayList<>()).add(e));

        RuntimeVariableScope scope = request.getScope() != null
                ? request.getScope() : new RuntimeVariableScope(automation.getVariables());
        NodeStatusListener listener = request.getListener();
        StopSignal stopSignal = request.getStopSignal();

        Instant started = Instant.now();
        List<String> visited = new ArrayList<>();
        int succeeded = 0;

        Deque<AutomationNode> stack = new ArrayDeque<>();
        for (int i = startNodes.size() - 1; i >= 0; i--) {
            stack.push(startNodes.get(i));
        }

        log.info("Run {} of '{}' started: {} start node(s), {} mode",
                request.getRunId(), automation.getName(), startNodes.size(), request.getMode());

        try (BrowserSession browser = new BrowserSession(request.getMode(), headlessLauncher,
                windowedSurfaceProvider.getIfAvailable())) {
            StepContext context = new StepContext(request.getRunId(), scope, browser);

            while (!stack.isEmpty()) {
                if (stopSignal.isStopped()) {
                    log.info("Run {} stopped after {} node visits", request.getRunId(), visited.size());
                    return outcome(RunStatus.STOPPED, null, visited, succeeded, started, scope);
                }
                if (visited.size() >= MAX_NODE_VISITS) {
                    String error = "Maximum iteration limit reached (" + MAX_NODE_VISITS + " node visits)";
                    log.warn("Run {} aborted: {}", request.getRunId(), error);
                    return outcome(RunStatus.FAILED, error, visited, succeeded, started, scope);
                }

                AutomationNode node = stack.pop();
                visited.add(node.getId());
                listener.onNodeStatus(node.getId(), NodeStatus.RUNNING, null);

                Boolean branch;
                try {
                    branch = runNode(node, context, browser);
                } catch (Exception ex) {
                    String msg = AutomationException.describe(ex);
                    log.error("Node {} ({}) failed in run {}: {}", node.getId(), typeName(node), request.getRunId(), msg);
                    listener.onNodeStatus(node.getId(), NodeStatus.ERROR, msg);
                    return outcome(RunStatus.FAILED, msg, visited, succeeded, started, scope);
                }

                succeeded++;
                listener.onNodeStatus(node.getId(), NodeStatus.SUCCESS, null);

                List<AutomationEdge> next = outgoing.getOrDefault(node.getId(), List.of());
                for (int i = next.size() - 1; i >= 0; i--) {
                    AutomationEdge edge = next.get(i);
                    if (branch == null || edge.getBranch() != null
                            && edge.getBranch().equals(branch ? AutomationEdge.IF : AutomationEdge.ELSE)) {
                        stack.push(nodeMap.get(edge.getTarget()));
                    }
                }
            }
        }

        log.info("Run {} of '{}' completed: {} node visits", request.getRunId(), automation.getName(), visited.size());
        return outcome(RunStatus.COMPLETED, null, visited, succeeded, started, scope);
    }

    /** Branch taken by a condition node, or null for an action node. */
    private Boolean runNode(AutomationNode node, StepContext context, BrowserSession browser) {
        NodeKind kind = node.getKind();
        if (kind instanceof DomCondition dom) {
            return conditionalEvaluator.evaluateDomCondition(dom, browser.get(), context.scope());
        }
        if (kind instanceof VariableCondition variable) {
            return conditionalEvaluator.evaluateVariableCondition(variable, context.scope());
        }
        if (kind instanceof Step step) {
            dispatcher.execute(step, context);
        }
        return null;
    }

    private static List<AutomationEdge> validEdges(List<AutomationEdge> edges, Map<String, AutomationNode> nodeMap) {
        List<AutomationEdge> valid = new ArrayList<>();
        if (edges == null) return valid;
        for (AutomationEdge edge : edges) {
            if (edge.getSource() != null && nodeMap.containsKey(edge.getSource())
                    && edge.getTarget() != null && nodeMap.containsKey(edge.getTarget())) {
                valid.add(edge);
            } else {
                log.warn("Ignoring edge {} with unknown endpoint ({} → {})", edge.getId(), edge.getSource(), edge.getTarget());
            }
        }
        return valid;
    }

    static List<AutomationNode> findStartNodes(List<AutomationNode> nodes, List<AutomationEdge> edges) {
        Map<String, Integer> indegree = new HashMap<>();
        nodes.forEach(n -> indegree.put(n.getId(), 0));
        edges.forEach(e -> indegree.merge(e.getTarget(), 1, Integer::sum));

        List<AutomationNode> startNodes = nodes.stream()
                .filter(n -> indegree.getOrDefault(n.getId(), 0) == 0)
                .toList();
        if (startNodes.isEmpty()) {
            throw new InvalidGraphException("No start nodes found in workflow. All nodes have incoming edges.");
        }
        return startNodes;
    }

    private static RunOutcome outcome(RunStatus status, String error, List<String> visited, int succeeded,
                                      Instant started, RuntimeVariableScope scope) {
        return RunOutcome.builder()
                .status(status)
                .error(error)
                .stepsExecuted(visited.size())
                .stepsSucceeded(succeeded)
                .visitedNodeIds(Collections.unmodifiableList(new ArrayList<>(visited)))
                .duration(Duration.between(started, Instant.now()))
                .finalVariables(scope.snapshot())
                .build();
    }

    private static String typeName(AutomationNode node) {
        return node.getType() != null ? node.getType().getJsonName() : "none";
    }
}
