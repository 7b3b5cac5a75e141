package com.loopflow.loopflow_engine.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.exception.InvalidGraphException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepDispatcher;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.executor.condition.ConditionalEvaluator;
import com.loopflow.loopflow_engine.executor.impl.ApiCallStepHandler;
import com.loopflow.loopflow_engine.executor.impl.BrowserStepHandler;
import com.loopflow.loopflow_engine.executor.impl.VariableStepHandler;
import com.loopflow.loopflow_engine.io.BrowserActions;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.io.HeadlessBrowserLauncher;
import com.loopflow.loopflow_engine.io.HttpCallRequest;
import com.loopflow.loopflow_engine.io.HttpCallResponse;
import com.loopflow.loopflow_engine.io.HttpCaller;
import com.loopflow.loopflow_engine.io.WindowedBrowserSurface;
import com.loopflow.loopflow_engine.model.domain.Automation;
import com.loopflow.loopflow_engine.model.domain.AutomationEdge;
import com.loopflow.loopflow_engine.model.domain.AutomationNode;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.ApiCallStep;
import com.loopflow.loopflow_engine.model.step.ExtractStep;
import com.loopflow.loopflow_engine.model.step.ModifyOperation;
import com.loopflow.loopflow_engine.model.step.ModifyVariableStep;
import com.loopflow.loopflow_engine.model.step.NavigateStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.SetVariableStep;
import com.loopflow.loopflow_engine.model.step.Step;
import com.loopflow.loopflow_engine.model.step.VariableCheck;
import com.loopflow.loopflow_engine.model.step.VariableCondition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GraphExecutorTest {

    @Mock
    private HeadlessBrowserLauncher launcher;

    @Mock
    private BrowserActions browser;

    @Mock
    private HttpCaller httpCaller;

    @Mock
    private CredentialLookup credentialLookup;

    @Mock
    private ObjectProvider<WindowedBrowserSurface> windowedSurfaces;

    private GraphExecutor executor;

    @BeforeEach
    void setUp() {
        List<StepHandler> handlers = List.of(
                new BrowserStepHandler(credentialLookup, new LoopflowProperties()),
                new VariableStepHandler(),
                new ApiCallStepHandler(httpCaller, new ObjectMapper()));
        StepDispatcher dispatcher = new StepDispatcher(withUnusedTypesCovered(handlers));
        dispatcher.init();
        executor = new GraphExecutor(dispatcher, new ConditionalEvaluator(), launcher, windowedSurfaces);
    }

    /** The dispatcher refuses to start with unclaimed types; the integrations are not exercised here. */
    private static List<StepHandler> withUnusedTypesCovered(List<StepHandler> handlers) {
        Set<NodeType> rest = EnumSet.noneOf(NodeType.class);
        for (NodeType type : NodeType.values()) {
            if (!type.isCondition() && handlers.stream().noneMatch(h -> h.supportedTypes().contains(type))) {
                rest.add(type);
            }
        }
        List<StepHandler> all = new ArrayList<>(handlers);
        all.add(new StepHandler() {
            @Override
            public Set<NodeType> supportedTypes() {
                return rest;
            }

            @Override
            public StepResult execute(Step step, StepContext context) {
                throw new IllegalStateException("not expected in this test: " + step.type());
            }
        });
        return all;
    }

    private static Automation graph(List<AutomationNode> nodes, List<AutomationEdge> edges) {
        return Automation.builder().id("a1").name("test").nodes(new ArrayList<>(nodes)).edges(new ArrayList<>(edges)).build();
    }

    private static RunOutcome run(GraphExecutor executor, Automation automation, NodeStatusListener listener) {
        return executor.execute(automation, ExecutionRequest.builder()
                .scope(new RuntimeVariableScope(automation.getVariables()))
                .listener(listener)
                .build());
    }

    @Test
    void linearScenarioWithBrowserAndHttp() {
        when(launcher.launch()).thenReturn(browser);
        when(browser.extractText(".price")).thenReturn("$19.99");
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(201, "{\"id\":7}"));

        Automation automation = graph(List.of(
                        AutomationNode.of("open", NavigateStep.of("https://shop.example/{{item}}")),
                        AutomationNode.of("read", ExtractStep.of(".price", "price")),
                        AutomationNode.of("post", new ApiCallStep(NodeType.API_CALL, "POST", "https://api.example/prices",
                                "{\"item\":\"{{item}}\",\"price\":\"{{price}}\"}", null, "saved", null)),
                        AutomationNode.of("done", SetVariableStep.of("finished", "true"))),
                List.of(AutomationEdge.plain("e1", "open", "read"),
                        AutomationEdge.plain("e2", "read", "post"),
                        AutomationEdge.plain("e3", "post", "done")));
        automation.setVariables(Map.of("item", "widget"));

        List<String> events = new ArrayList<>();
        RunOutcome outcome = run(executor, automation, (id, status, error) -> events.add(id + ":" + status));

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(outcome.getStepsExecuted()).isEqualTo(4);
        assertThat(outcome.getStepsSucceeded()).isEqualTo(4);
        assertThat(outcome.getVisitedNodeIds()).containsExactly("open", "read", "post", "done");
        assertThat(outcome.getFinalVariables())
                .containsEntry("price", "$19.99")
                .containsEntry("saved", Map.of("id", 7))
                .containsEntry("finished", true);
        assertThat(events).containsExactly("open:RUNNING", "open:SUCCESS", "read:RUNNING", "read:SUCCESS",
                "post:RUNNING", "post:SUCCESS", "done:RUNNING", "done:SUCCESS");

        verify(browser).navigate("https://shop.example/widget");
        ArgumentCaptor<HttpCallRequest> sent = ArgumentCaptor.forClass(HttpCallRequest.class);
        verify(httpCaller).exchange(sent.capture());
        assertThat(sent.getValue().body()).isEqualTo("{\"item\":\"widget\",\"price\":\"$19.99\"}");
        verify(browser).close();
    }

    @Test
    void cycleStopsAtVisitLimit() {
        Automation automation = graph(List.of(
                        AutomationNode.of("s", SetVariableStep.of("n", "0")),
                        AutomationNode.of("a", ModifyVariableStep.of("n", ModifyOperation.INCREMENT, "1")),
                        AutomationNode.of("b", ModifyVariableStep.of("n", ModifyOperation.INCREMENT, "1"))),
                List.of(AutomationEdge.plain("e1", "s", "a"),
                        AutomationEdge.plain("e2", "a", "b"),
                        AutomationEdge.plain("e3", "b", "a")));

        AtomicInteger running = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        RunOutcome outcome = run(executor, automation, (id, status, error) -> {
            if (status == NodeStatus.RUNNING) running.incrementAndGet();
            if (status == NodeStatus.ERROR) errors.incrementAndGet();
        });

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(outcome.getError()).isEqualTo("Maximum iteration limit reached (10000 node visits)");
        assertThat(running.get()).isEqualTo(GraphExecutor.MAX_NODE_VISITS);
        assertThat(outcome.getStepsExecuted()).isEqualTo(10_000);
        assertThat(errors.get()).isZero();
        assertThat(outcome.getFinalVariables()).containsEntry("n", 9_999);
        verifyNoInteractions(launcher);
    }

    @Test
    void conditionFollowsOnlyTheMatchingBranch() {
        Automation automation = graph(List.of(
                        AutomationNode.of("stock", SetVariableStep.of("stock", "5")),
                        AutomationNode.of("check", VariableCondition.of(VariableCheck.VARIABLE_GREATER_THAN, "stock", "3", true)),
                        AutomationNode.of("yes", SetVariableStep.of("path", "if")),
                        AutomationNode.of("no", SetVariableStep.of("path", "else"))),
                List.of(AutomationEdge.plain("e1", "stock", "check"),
                        AutomationEdge.branch("e2", "check", "yes", AutomationEdge.IF),
                        AutomationEdge.branch("e3", "check", "no", AutomationEdge.ELSE)));

        RunOutcome outcome = run(executor, automation, NodeStatusListener.NONE);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getVisitedNodeIds()).containsExactly("stock", "check", "yes");
        assertThat(outcome.getFinalVariables()).containsEntry("path", "if");
    }

    @Test
    void failingNodeEndsTheRunWithItsMessage() {
        when(httpCaller.exchange(any())).thenReturn(HttpCallResponse.of(404, ""));
        Automation automation = graph(List.of(
                        AutomationNode.of("call", ApiCallStep.get("https://api.example/missing", "r")),
                        AutomationNode.of("after", SetVariableStep.of("reached", "true"))),
                List.of(AutomationEdge.plain("e1", "call", "after")));

        List<String> errors = new ArrayList<>();
        RunOutcome outcome = run(executor, automation, (id, status, error) -> {
            if (status == NodeStatus.ERROR) errors.add(id + ": " + error);
        });

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(outcome.getError()).isEqualTo("API call GET https://api.example/missing failed with HTTP 404");
        assertThat(errors).containsExactly("call: API call GET https://api.example/missing failed with HTTP 404");
        assertThat(outcome.getFinalVariables()).doesNotContainKey("reached");
    }

    @Test
    void stopSignalPreventsFurtherNodes() {
        Automation automation = graph(List.of(
                        AutomationNode.of("one", SetVariableStep.of("x", "1")),
                        AutomationNode.of("two", SetVariableStep.of("y", "2"))),
                List.of(AutomationEdge.plain("e1", "one", "two")));
        StopSignal stop = new StopSignal();

        RunOutcome outcome = executor.execute(automation, ExecutionRequest.builder()
                .stopSignal(stop)
                .listener((id, status, error) -> {
                    if (status == NodeStatus.SUCCESS) stop.stop();
                })
                .build());

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.STOPPED);
        assertThat(outcome.getVisitedNodeIds()).containsExactly("one");
    }

    @Test
    void windowedRunWithoutSurfaceFailsAtFirstBrowserNode() {
        Automation automation = graph(List.of(AutomationNode.of("open", NavigateStep.of("https://example.com"))), List.of());

        RunOutcome outcome = executor.execute(automation, ExecutionRequest.of(ExecutionMode.WINDOWED, null));

        assertThat(outcome.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(outcome.getError()).isEqualTo("No windowed browser surface is available for this run");
        verify(launcher, never()).launch();
    }

    @Test
    void windowedSurfaceIsNotClosedByTheRun() {
        WindowedBrowserSurface surface = () -> browser;
        when(windowedSurfaces.getIfAvailable()).thenReturn(surface);
        Automation automation = graph(List.of(AutomationNode.of("open", NavigateStep.of("https://example.com"))), List.of());

        RunOutcome outcome = executor.execute(automation, ExecutionRequest.of(ExecutionMode.WINDOWED, null));

        assertThat(outcome.isSuccess()).isTrue();
        verify(browser).navigate("https://example.com");
        verify(browser, never()).close();
    }

    @Test
    void graphWithoutNodesOrStartIsRejected() {
        assertThatThrownBy(() -> run(executor, graph(List.of(), List.of()), NodeStatusListener.NONE))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("No nodes to execute");

        Automation loop = graph(List.of(
                        AutomationNode.of("a", SetVariableStep.of("x", "1")),
                        AutomationNode.of("b", SetVariableStep.of("y", "1"))),
                List.of(AutomationEdge.plain("e1", "a", "b"), AutomationEdge.plain("e2", "b", "a")));
        assertThatThrownBy(() -> run(executor, loop, NodeStatusListener.NONE))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessage("No start nodes found in workflow. All nodes have incoming edges.");
    }

    @Test
    void headlessBrowserIsOnlyLaunchedWhenNeeded() {
        Automation automation = graph(List.of(AutomationNode.of("v", SetVariableStep.of("x", "1"))), List.of());

        run(executor, automation, NodeStatusListener.NONE);

        verifyNoInteractions(launcher);
    }
}
