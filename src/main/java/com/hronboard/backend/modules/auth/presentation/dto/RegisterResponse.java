package com.hronboard.backend.modules.auth.presentation.dto;

public record RegisterResponse(String message, UserResponse user) {
}
