package com.loopflow.loopflow_engine.io;

/**
 * Outbound HTTP used by every integration step.
 *
 * Any response, 2xx or not, is returned. Transport failures (connection refused,
 * timeout, DNS) are thrown as {@link org.springframework.web.client.ResourceAccessException}.
 */
public interface HttpCaller {

    HttpCallResponse exchange(HttpCallRequest request);
}
