package com.nei10u.lunar.model;

import lombok.Builder;

import java.time.LocalDateTime;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

    @Builder
    public ErrorResponse {
    }
}
