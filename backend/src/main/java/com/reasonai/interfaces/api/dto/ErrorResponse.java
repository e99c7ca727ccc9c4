package com.reasonai.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
