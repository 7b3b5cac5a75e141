package com.loopflow.loopflow_engine.engine;

import com.loopflow.loopflow_engine.exception.CapabilityUnavailableException;
import com.loopflow.loopflow_engine.io.BrowserActions;
import com.loopflow.loopflow_engine.io.HeadlessBrowserLauncher;
import com.loopflow.loopflow_engine.io.WindowedBrowserSurface;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * The browser of one run, acquired the first time a node asks for it.
 * Only a headless browser is closed here; a windowed surface belongs to its provider.
 */
@Slf4j
class BrowserSession implements Supplier<BrowserActions>, AutoCloseable {

    private final ExecutionMode mode;
    private final HeadlessBrowserLauncher launcher;
    private final WindowedBrowserSurface windowedSurface;   // null when the host registered none

    private BrowserActions browser;

    BrowserSession(ExecutionMode mode, HeadlessBrowserLauncher launcher, WindowedBrowserSurface windowedSurface) {
        this.mode = mode;
        this.launcher = launcher;
        this.windowedSurface = windowedSurface;
    }

    @Override
    public BrowserActions get() {
        if (browser == null) {
            if (mode == ExecutionMode.WINDOWED) {
                if (windowedSurface == null) {
                    throw new CapabilityUnavailableException("windowedBrowser",
                            "No windowed browser surface is available for this run");
                }
                browser = windowedSurface.acquire();
            } else {
                browser = launcher.launch();
            }
        }
        return browser;
    }

    @Override
    public void close() {
        if (browser == null || mode != ExecutionMode.HEADLESS) return;
        try {
            browser.close();
        } catch (Exception e) {
            log.warn("Failed to close headless browser: {}", e.getMessage());
        }
    }
}
