package com.linkanalysis.linkanalysis.web.dto;

public record ErrorResponse(String error, String message) {
}
