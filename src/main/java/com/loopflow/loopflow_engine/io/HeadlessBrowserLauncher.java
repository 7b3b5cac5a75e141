package com.loopflow.loopflow_engine.io;

import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Starts a private headless Chromium for one run. Each call creates its own Playwright
 * driver, so concurrent runs never share a page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeadlessBrowserLauncher {

    private final LoopflowProperties properties;

    public BrowserActions launch() {
        LoopflowProperties.Browser settings = properties.getBrowser();
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(settings.getViewportWidth(), settings.getViewportHeight()));
            Page page = context.newPage();
            page.setDefaultNavigationTimeout(settings.getNavigationTimeoutMs());
            page.setDefaultTimeout(settings.getSelectorTimeoutMs());
            log.debug("Headless browser launched ({}x{})", settings.getViewportWidth(), settings.getViewportHeight());
            return new PlaywrightBrowserActions(playwright, browser, page, settings.getSelectorTimeoutMs());
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }
}
