package com.hamco.api.dto;

public record MessageResponse(String message) {
}
