package com.loopflow.loopflow_engine.io;

import com.loopflow.loopflow_engine.config.LoopflowProperties;
import com.loopflow.loopflow_engine.model.domain.Credential;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Serves the credentials declared under {@code loopflow.credentials.<id>}. */
@Component
@RequiredArgsConstructor
public class ConfiguredCredentialLookup implements CredentialLookup {

    private final LoopflowProperties properties;

    @Override
    public Credential getCredential(String id) {
        if (id == null || id.isBlank()) return null;
        return properties.getCredentials().get(id);
    }
}
