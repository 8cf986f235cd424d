package com.example.slidereplace;

public record ErrorResponse(String code, String message) {
}
