/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpError;

/**
 * 调用目标服务器当前没有运行中的连接。
 */
public class McpServerNotRunningException extends McpError {

	private final String serverId;

	public McpServerNotRunningException(String serverId) {
		super("Server is not running: " + serverId);
		this.serverId = serverId;
	}

	public String getServerId() {
		return this.serverId;
	}

}
