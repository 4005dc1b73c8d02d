/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpError;

/**
 * 没有运行中的服务器提供该名称的工具。
 */
public class McpToolNotFoundException extends McpError {

	private final String toolName;

	public McpToolNotFoundException(String toolName) {
		super("Tool not found: " + toolName);
		this.toolName = toolName;
	}

	public String getToolName() {
		return this.toolName;
	}

}
