package com.amumal.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;

public record WithdrawRequest(
        @NotBlank(message = "password is required") String password,
        @AssertTrue(message = "agree must be true") boolean agree
) {
}
