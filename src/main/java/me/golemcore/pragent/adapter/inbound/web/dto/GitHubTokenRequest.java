package me.golemcore.pragent.adapter.inbound.web.dto;

public record GitHubTokenRequest(String token) {
}
