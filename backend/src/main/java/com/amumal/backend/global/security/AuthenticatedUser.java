package com.amumal.backend.global.security;

public record AuthenticatedUser(long userId) {
}
