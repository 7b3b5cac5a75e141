package com.loopflow.loopflow_engine.io;

/**
 * Supplies the visible, user-facing browser for windowed runs. The surface stays owned by
 * its provider: the engine never closes it. No implementation ships with the engine; a host
 * application registers one as a bean.
 */
public interface WindowedBrowserSurface {

    BrowserActions acquire();
}
