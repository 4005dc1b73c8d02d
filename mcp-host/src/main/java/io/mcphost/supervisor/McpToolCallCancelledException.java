/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpError;

/**
 * 工具调用因{@link McpServerSupervisor#cancelAllToolCalls()}被放弃。服务器可能仍在执行该调用，
 * 但它的响应会被丢弃。
 */
public class McpToolCallCancelledException extends McpError {

	private final String serverId;

	private final String toolName;

	public McpToolCallCancelledException(String serverId, String toolName) {
		super("Tool call cancelled: " + serverId + "/" + toolName);
		this.serverId = serverId;
		this.toolName = toolName;
	}

	public String getServerId() {
		return this.serverId;
	}

	public String getToolName() {
		return this.toolName;
	}

}
