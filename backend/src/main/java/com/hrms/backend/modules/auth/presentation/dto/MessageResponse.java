package com.hrms.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
