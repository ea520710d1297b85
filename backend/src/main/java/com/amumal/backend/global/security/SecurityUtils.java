package com.amumal.backend.global.security;

import com.amumal.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser principal)) {
            throw ProblemException.unauthenticated();
        }
        return principal;
    }

    public static long getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
