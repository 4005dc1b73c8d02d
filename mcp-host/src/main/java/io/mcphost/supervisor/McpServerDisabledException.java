/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpError;

/**
 * 服务器定义存在但未启用，不能启动。
 */
public class McpServerDisabledException extends McpError {

	private final String serverId;

	public McpServerDisabledException(String serverId) {
		super("Server is disabled: " + serverId);
		this.serverId = serverId;
	}

	public String getServerId() {
		return this.serverId;
	}

}
