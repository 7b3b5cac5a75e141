package com.loopflow.loopflow_engine.executor.impl;

import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.exception.CredentialException;
import com.loopflow.loopflow_engine.exception.StepExecutionException;
import com.loopflow.loopflow_engine.executor.StepContext;
import com.loopflow.loopflow_engine.io.BrowserActions;
import com.loopflow.loopflow_engine.io.CredentialLookup;
import com.loopflow.loopflow_engine.model.domain.Credential;
import com.loopflow.loopflow_engine.model.scope.RuntimeVariableScope;
import com.loopflow.loopflow_engine.model.step.ExtractStep;
import com.loopflow.loopflow_engine.model.step.NavigateStep;
import com.loopflow.loopflow_engine.model.step.ScreenshotStep;
import com.loopflow.loopflow_engine.model.step.SelectOptionStep;
import com.loopflow.loopflow_engine.model.step.TypeStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BrowserStepHandlerTest {

    @Mock
    private BrowserActions browser;

    @Mock
    private CredentialLookup credentialLookup;

    @TempDir
    Path tempDir;

    private BrowserStepHandler handler;
    private StepContext context;

    @BeforeEach
    void setUp() {
        handler = new BrowserStepHandler(credentialLookup, new LoopflowProperties());
        context = new StepContext("run", new RuntimeVariableScope(Map.of("host", "shop.example")), () -> browser);
    }

    @Test
    void navigateSubstitutesUrl() {
        Object url = handler.execute(NavigateStep.of("https://{{host}}/cart"), context).value();

        verify(browser).navigate("https://shop.example/cart");
        assertThat(url).isEqualTo("https://shop.example/cart");
    }

    @Test
    void extractReturnsElementText() {
        when(browser.extractText("h1")).thenReturn("Kettle");

        assertThat(handler.execute(ExtractStep.of("h1", "title"), context).value()).isEqualTo("Kettle");
    }

    @Test
    void typeReadsSecretFromCredential() {
        when(credentialLookup.getCredential("shop-login")).thenReturn(new Credential("login", Map.of("password", "s3cret")));

        handler.execute(TypeStep.fromCredential("#pw", "shop-login", null), context);

        verify(browser).type("#pw", "s3cret");
    }

    @Test
    void typeWithMissingCredentialNeverTouchesThePage() {
        assertThatThrownBy(() -> handler.execute(TypeStep.fromCredential("#pw", "ghost", null), context))
                .isInstanceOf(CredentialException.class)
                .hasMessage("Credential not found: ghost");
        verify(browser, never()).type(anyString(), anyString());
    }

    @Test
    void selectOptionWithoutValueOrIndexFails() {
        SelectOptionStep step = new SelectOptionStep(null, "#size", null, null);
        assertThatThrownBy(() -> handler.execute(step, context)).isInstanceOf(StepExecutionException.class);
    }

    @Test
    void screenshotIsWrittenToRequestedPath() throws Exception {
        when(browser.screenshot()).thenReturn(new byte[] {1, 2, 3});
        Path target = tempDir.resolve("shots/page.png");

        Object saved = handler.execute(ScreenshotStep.to(target.toString()), context).value();

        assertThat(saved).isEqualTo(target.toString());
        assertThat(Files.readAllBytes(target)).containsExactly(1, 2, 3);
    }
}
