package com.agentrunner.dto;

public record Notification(String title, String content) {
}
