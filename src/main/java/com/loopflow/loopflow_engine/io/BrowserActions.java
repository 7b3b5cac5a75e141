package com.loopflow.loopflow_engine.io;

import java.nio.file.Path;

/**
 * The page-driving surface a run works against, headless or windowed.
 * Implementations resolve selectors the same way as {@link PageQuery}.
 */
public interface BrowserActions extends PageQuery, AutoCloseable {

    void navigate(String url);

    void click(String selector);

    void type(String selector, String text);

    /** Trimmed text content of the first match, or null when nothing matches. */
    String extractText(String selector);

    void scrollTo(String selector);

    void scrollBy(int pixels);

    void selectOption(String selector, String value);

    void selectOptionByIndex(String selector, int index);

    void uploadFile(String selector, Path file);

    void hover(String selector);

    /** PNG bytes of the current viewport. */
    byte[] screenshot();

    @Override
    void close();
}
