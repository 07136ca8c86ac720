package com.graphqldemo.auth.token;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {
}
