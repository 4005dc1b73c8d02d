/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.client.McpConnectionEvent;

/**
 * 监督器转发的连接事件，附带来源服务器id。
 */
public record McpServerEvent(String serverId, McpConnectionEvent event) {
}
