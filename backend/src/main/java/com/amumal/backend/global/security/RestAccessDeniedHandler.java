package com.amumal.backend.global.security;

import java.io.IOException;

import com.amumal.backend.global.error.ErrorCategory;
import com.amumal.backend.global.error.ProblemException;
import com.amumal.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        problemResponseWriter.write(request, response,
                new ProblemException(ErrorCategory.FORBIDDEN, "FORBIDDEN", "접근 권한이 없습니다."));
    }
}
