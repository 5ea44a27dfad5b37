package com.bko.racebuddy.plan.web.dto;

public record ErrorResponseDto(String code, String message) { }
