package com.amumal.backend.modules.auth.application;

import com.amumal.backend.modules.auth.domain.AuthFailureReason;

public class CredentialRejectedException extends RuntimeException {

    private final AuthFailureReason reason;

    public CredentialRejectedException(AuthFailureReason reason) {
        super("Credential rejected: " + reason);
        this.reason = reason;
    }

    public CredentialRejectedException(AuthFailureReason reason, Throwable cause) {
        super("Credential rejected: " + reason, cause);
        this.reason = reason;
    }

    public AuthFailureReason getReason() {
        return reason;
    }
}
