package com.phillippitts.selfconsistency.presentation.dto;

public record ChatMessage(String role, String content) {
}
