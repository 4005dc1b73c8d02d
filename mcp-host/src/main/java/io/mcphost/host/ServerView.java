/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.host;

import io.mcphost.config.ServerDefinition;

/**
 * 展示给主机应用的服务器定义，附带当前是否在运行。
 */
public record ServerView(ServerDefinition definition, boolean running) {
}
