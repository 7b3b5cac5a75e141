package com.loopflow.loopflow_engine.executor.impl;

import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.exception.CredentialException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.executor.StepHandler;
import com.loopflow.loopflow_engine.executor.StepResult;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.scope.NumericText;
import com.loopflow.loopflow_engine.model.step.ClickStep;
import com.loopflow.loopflow_engine.model.step.ExtractStep;
import com.loopflow.loopflow_engine.model.step.FileUploadStep;
import com.loopflow.loopflow_engine.model.step.HoverStep;
import com.loopflow.loopflow_engine.model.step.NavigateStep;
import com.loopflow.loopflow_engine.model.step.NodeType;
import com.loopflow.loopflow_engine.model.step.ScreenshotStep;
import com.loopflow.loopflow_engine.model.step.ScrollStep;
import com.loopflow.loopflow_engine.model.step.SelectOptionStep;
import com.loopflow.loopflow_engine.model.step.Step;
import com.loopflow.loopflow_engine.model.step.TypeStep;
import com.loopflow.loopflow_engine.model.step.WaitStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.Set;

/**
 * Page-driving steps plus {@code wait}. Every selector, URL and typed value goes through
 * variable substitution first. The browser is only touched once all inputs are resolved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BrowserStepHandler implements StepHandler {

    private static final DateTimeFormatter SCREENSHOT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final String DEFAULT_CREDENTIAL_FIELD = "password";

    private final CredentialLookup credentialLookup;
    private final LoopflowProperties properties;

    @Override
    public Set<NodeType> supportedTypes() {
        return EnumSet.of(NodeType.NAVIGATE, NodeType.CLICK, NodeType.TYPE, NodeType.WAIT,
                NodeType.SCREENSHOT, NodeType.EXTRACT, NodeType.SCROLL, NodeType.SELECT_OPTION,
                NodeType.FILE_UPLOAD, NodeType.HOVER);
    }

    @Override
    public StepResult execute(Step step, StepContext context) {
        return switch (step.type()) {
            case NAVIGATE      -> navigate((NavigateStep) step, context);
            case CLICK         -> click((ClickStep) step, context);
            case TYPE          -> type((TypeStep) step, context);
            case WAIT          -> waitFor((WaitStep) step, context);
            case SCREENSHOT    -> screenshot((ScreenshotStep) step, context);
            case EXTRACT       -> extract((ExtractStep) step, context);
            case SCROLL        -> scroll((ScrollStep) step, context);
            case SELECT_OPTION -> selectOption((SelectOptionStep) step, context);
            case FILE_UPLOAD   -> fileUpload((FileUploadStep) step, context);
            case HOVER         -> hover((HoverStep) step, context);
            default -> throw new UnsupportedOperationException("Not a browser step: " + step.type());
        };
    }

    // ── Navigation & input ────────────────────────────────────────────────────

    private StepResult navigate(NavigateStep step, StepContext context) {
        String url = required(context.resolve(step.url()), "navigate", "url");
        log.debug("Navigating to {}", url);
        context.browser().navigate(url);
        return StepResult.of(url);
    }

    private StepResult click(ClickStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "click", "selector");
        log.debug("Clicking {}", selector);
        context.browser().click(selector);
        return StepResult.empty();
    }

    private StepResult type(TypeStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "type", "selector");
        String text = hasText(step.credentialId())
                ? credentialValue(step, context)
                : context.resolve(step.value());

        log.debug("Typing into {}", selector);
        context.browser().type(selector, text);
        return StepResult.empty();
    }

    private String credentialValue(TypeStep step, StepContext context) {
        String credentialId = context.resolve(step.credentialId());
        Credential credential = credentialLookup.getCredential(credentialId);
        if (credential == null) {
            throw new CredentialException("Credential not found: " + credentialId);
        }
        String field = hasText(step.credentialField()) ? step.credentialField() : DEFAULT_CREDENTIAL_FIELD;
        String value = credential.firstField(field, "value");
        if (value == null) {
            throw new CredentialException("Credential " + credentialId + " has no '" + field + "' field");
        }
        return value;
    }

    private StepResult hover(HoverStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "hover", "selector");
        context.browser().hover(selector);
        return StepResult.empty();
    }

    private StepResult selectOption(SelectOptionStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "selectOption", "selector");
        if (hasText(step.optionValue())) {
            String value = context.resolve(step.optionValue());
            context.browser().selectOption(selector, value);
            return StepResult.of(value);
        }
        if (step.optionIndex() != null) {
            context.browser().selectOptionByIndex(selector, step.optionIndex());
            return StepResult.of(step.optionIndex());
        }
        throw new StepExecutionException("selectOption needs an optionValue or an optionIndex");
    }

    private StepResult fileUpload(FileUploadStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "fileUpload", "selector");
        Path file = Path.of(required(context.resolve(step.filePath()), "fileUpload", "filePath"));
        if (!Files.isRegularFile(file)) {
            throw new StepExecutionException("File to upload does not exist: " + file);
        }
        context.browser().uploadFile(selector, file);
        return StepResult.of(file.toString());
    }

    private StepResult scroll(ScrollStep step, StepContext context) {
        if (step.scrollType() == null) {
            throw new StepExecutionException("scroll needs a scrollType (toElement or byAmount)");
        }
        switch (step.scrollType()) {
            case TO_ELEMENT -> {
                String selector = required(context.resolve(step.selector()), "scroll", "selector");
                context.browser().scrollTo(selector);
            }
            case BY_AMOUNT -> {
                if (step.scrollAmount() == null) {
                    throw new StepExecutionException("scroll byAmount needs a scrollAmount");
                }
                context.browser().scrollBy(step.scrollAmount());
            }
        }
        return StepResult.empty();
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    private StepResult extract(ExtractStep step, StepContext context) {
        String selector = required(context.resolve(step.selector()), "extract", "selector");
        String text = context.browser().extractText(selector);
        log.debug("Extracted from {}: {}", selector, text);
        return StepResult.of(text);
    }

    private StepResult screenshot(ScreenshotStep step, StepContext context) {
        String requested = context.resolve(step.savePath());
        Path target = hasText(requested)
                ? Path.of(requested)
                : Path.of(properties.getBrowser().getScreenshotDir(),
                          "screenshot_" + LocalDateTime.now().format(SCREENSHOT_STAMP) + ".png");

        byte[] png = context.browser().screenshot();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(target, png);
        } catch (IOException e) {
            throw new StepExecutionException("Could not save screenshot to " + target + ": " + e.getMessage(), e);
        }
        log.info("Screenshot saved to {}", target);
        return StepResult.of(target.toString());
    }

    // ── Timing ────────────────────────────────────────────────────────────────

    private StepResult waitFor(WaitStep step, StepContext context) {
        double seconds = NumericText.parseInt(context.resolve(step.value()));
        long millis = Double.isNaN(seconds) || seconds < 0 ? 0L : (long) seconds * 1000L;
        log.debug("Waiting {} ms", millis);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("Wait interrupted", e);
        }
        return StepResult.of(millis);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String required(String value, String stepName, String field) {
        if (!hasText(value)) {
            throw new StepExecutionException(stepName + " step has no " + field);
        }
        return value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
