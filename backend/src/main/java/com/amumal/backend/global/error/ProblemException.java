package com.amumal.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ErrorCategory category;
    private final String code;
    private final String detail;

    public ProblemException(ErrorCategory category, String code) {
        this(category, code, null, null);
    }

    public ProblemException(ErrorCategory category, String code, String detail) {
        this(category, code, detail, null);
    }

    public ProblemException(ErrorCategory category, String code, String detail, Throwable cause) {
        super(category.status(), code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.category = category;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException unauthenticated() {
        return new ProblemException(ErrorCategory.UNAUTHENTICATED, "UNAUTHENTICATED", "인증이 필요합니다.");
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
