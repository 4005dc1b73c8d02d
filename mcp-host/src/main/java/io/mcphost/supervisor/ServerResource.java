/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpSchema;

/**
 * 带有来源服务器信息的资源。
 */
public record ServerResource(String serverId, String serverName, McpSchema.Resource resource) {
}
