package com.loopflow.loopflow_engine.io;

import com.loopflow.loopflow_engine.model.domain.Credential;

/**
 * Source of decrypted credentials. Returns null for an unknown id; callers decide whether
 * that is an error.
 */
public interface CredentialLookup {

    Credential getCredential(String id);
}
