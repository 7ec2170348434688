package com.example.auth_gateway.api;

public record ApiErrorResponse(String code, String message) {}
