package com.loopflow.loopflow_engine.executor;

import com.loopflow.loopflow_engine.io.BrowserActions;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;

import java.util.function.Supplier;

/**
 * Per-run state handed to every handler: the run's variables and its browser.
 * The browser is only acquired the first time a handler asks for it.
 */
public class StepContext {

    private final String runId;
    private final RuntimeVariableScope scope;
    private final Supplier<BrowserActions> browser;

    public StepContext(String runId, RuntimeVariableScope scope, Supplier<BrowserActions> browser) {
        this.runId = runId;
        this.scope = scope;
        this.browser = browser;
    }

    public String runId() {
        return runId;
    }

    public RuntimeVariableScope scope() {
        return scope;
    }

    public BrowserActions browser() {
        return browser.get();
    }

    /** Shorthand for {@code scope().substitute(template)}. */
    public String resolve(String template) {
        return scope.substitute(template);
    }
}
