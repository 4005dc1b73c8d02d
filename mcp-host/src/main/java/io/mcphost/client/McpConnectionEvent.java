/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

import java.util.List;

import io.mcphost.spec.McpSchema;

/**
 * 单个服务器连接发出的事件，通过{@link McpServerConnection#events()}订阅。
 *
 * @author Christian Tzolov
 */
public sealed interface McpConnectionEvent {

	/**
	 * 握手以及首次工具/资源发现完成。
	 */
	record Connected(McpSchema.Implementation serverInfo,
			McpSchema.ServerCapabilities capabilities) implements McpConnectionEvent {
	}

	/**
	 * 连接已断开，可能是主动断开，也可能是服务器进程退出。
	 */
	record Disconnected(String reason) implements McpConnectionEvent {
	}

	/**
	 * 连接过程失败，连接已进入{@link ConnectionState#FAILED}。
	 */
	record Error(Throwable error) implements McpConnectionEvent {
	}

	record ToolsUpdated(List<McpSchema.Tool> tools) implements McpConnectionEvent {
	}

	record ResourcesUpdated(List<McpSchema.Resource> resources) implements McpConnectionEvent {
	}

	/**
	 * 服务器报告某个资源的内容发生了变化。
	 */
	record ResourceUpdated(String uri, Object params) implements McpConnectionEvent {
	}

	/**
	 * 收到的任意通知，包括已被专门处理的通知。
	 */
	record Notification(String method, Object params) implements McpConnectionEvent {
	}

}
