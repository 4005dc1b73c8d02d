/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.spec.McpSchema;

/**
 * 带有来源服务器信息的工具。
 *
 * @param serverId 提供该工具的服务器id
 * @param serverName 提供该工具的服务器名称
 * @param tool 工具描述
 */
public record ServerTool(String serverId, String serverName, McpSchema.Tool tool) {

	/**
	 * 跨服务器唯一的工具名称，形如{@code serverName__toolName}。
	 */
	public String qualifiedName() {
		return new QualifiedToolName(this.serverName, this.tool.name()).toString();
	}

}
