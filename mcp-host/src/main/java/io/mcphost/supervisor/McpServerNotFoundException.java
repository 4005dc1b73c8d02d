/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpError;

/**
 * 请求的服务器id在定义存储中不存在。
 */
public class McpServerNotFoundException extends McpError {

	private final String serverId;

	public McpServerNotFoundException(String serverId) {
		super("Server not found: " + serverId);
		this.serverId = serverId;
	}

	public String getServerId() {
		return this.serverId;
	}

}
