package com.loopflow.loopflow_engine.io;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.SelectOption;
import com.microsoft.playwright.options.WaitForSelectorState;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * {@link BrowserActions} over a Playwright page. Owns the Playwright driver and browser it was
 * launched with and releases both on {@link #close()}.
 */
@Slf4j
public class PlaywrightBrowserActions implements BrowserActions {

    private final Playwright playwright;
    private final Browser browser;
    private final Page page;
    private final double selectorTimeoutMs;

    public PlaywrightBrowserActions(Playwright playwright, Browser browser, Page page, double selectorTimeoutMs) {
        this.playwright = playwright;
        this.browser = browser;
        this.page = page;
        this.selectorTimeoutMs = selectorTimeoutMs;
    }

    // ── Navigation & input ────────────────────────────────────────────────────

    @Override
    public void navigate(String url) {
        page.navigate(url);
    }

    @Override
    public void click(String selector) {
        Locator target = require(selector);
        target.click(new Locator.ClickOptions().setTimeout(selectorTimeoutMs));
    }

    @Override
    public void type(String selector, String text) {
        Locator target = require(selector);
        target.pressSequentially(text, new Locator.PressSequentiallyOptions().setTimeout(selectorTimeoutMs));
    }

    @Override
    public void hover(String selector) {
        require(selector).hover(new Locator.HoverOptions().setTimeout(selectorTimeoutMs));
    }

    @Override
    public void selectOption(String selector, String value) {
        require(selector).selectOption(value);
    }

    @Override
    public void selectOptionByIndex(String selector, int index) {
        require(selector).selectOption(new SelectOption().setIndex(index));
    }

    @Override
    public void uploadFile(String selector, Path file) {
        require(selector).setInputFiles(file);
    }

    @Override
    public void scrollTo(String selector) {
        require(selector).scrollIntoViewIfNeeded();
    }

    @Override
    public void scrollBy(int pixels) {
        page.mouse().wheel(0, pixels);
    }

    @Override
    public byte[] screenshot() {
        return page.screenshot();
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Override
    public String extractText(String selector) {
        Locator target = find(selector);
        if (target == null) return null;
        String text = target.textContent();
        return text != null ? text.trim() : null;
    }

    @Override
    public boolean elementExists(String selector) {
        return find(selector) != null;
    }

    @Override
    public String readText(String selector) {
        Locator target = find(selector);
        if (target == null) return "";
        String text = target.innerText();
        return text != null ? text : "";
    }

    // ── Selector resolution ───────────────────────────────────────────────────

    /** First element matching the selector as CSS, then as XPath; null when neither matches. */
    private Locator find(String selector) {
        Locator css = firstMatch("css=" + selector);
        if (css != null) return css;
        return firstMatch("xpath=" + selector);
    }

    private Locator firstMatch(String qualified) {
        try {
            Locator locator = page.locator(qualified).first();
            return locator.count() > 0 ? locator : null;
        } catch (PlaywrightException e) {
            // selector is not valid in this syntax
            log.trace("Selector '{}' rejected: {}", qualified, e.getMessage());
            return null;
        }
    }

    /** Like {@link #find} but waits up to the selector timeout for the element to attach. */
    private Locator require(String selector) {
        Locator found = find(selector);
        if (found != null) return found;
        Locator css = page.locator("css=" + selector).first();
        css.waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(selectorTimeoutMs));
        return css;
    }

    @Override
    public void close() {
        try {
            browser.close();
        } finally {
            playwright.close();
        }
    }
}
