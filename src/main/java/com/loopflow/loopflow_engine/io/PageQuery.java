package com.loopflow.loopflow_engine.io;

/**
 * Read-only view of the current page used by DOM conditions.
 * Selectors are tried as CSS first and as XPath when CSS finds nothing.
 * A missing element never throws: it reads as absent / empty text.
 */
public interface PageQuery {

    boolean elementExists(String selector);

    /** Visible text of the first match, or "" when nothing matches. */
    String readText(String selector);
}
