package com.lexintel.collectors.config;

public record RssSourceConfig(String source, String url) {
}
