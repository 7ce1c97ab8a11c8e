package com.vet.scheduling.dto;

public record ErrorResponse(String error, String message) {
}
