/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

import java.util.List;

import io.mcphost.spec.McpSchema;

/**
 * 某一时刻服务器连接状态的快照。
 *
 * @param connected 是否处于{@link ConnectionState#CONNECTED}
 * @param state 连接状态
 * @param serverInfo 握手时服务器报告的实现信息
 * @param capabilities 服务器声明的能力
 * @param tools 缓存的工具列表
 * @param resources 缓存的资源列表
 */
public record ServerStatus( // @formatter:off
	boolean connected,
	ConnectionState state,
	McpSchema.Implementation serverInfo,
	McpSchema.ServerCapabilities capabilities,
	List<McpSchema.Tool> tools,
	List<McpSchema.Resource> resources) { // @formatter:on

	private static final ServerStatus NOT_RUNNING = new ServerStatus(false, ConnectionState.DISCONNECTED, null,
			null, List.of(), List.of());

	/**
	 * 没有运行中连接的服务器的状态。
	 */
	public static ServerStatus notRunning() {
		return NOT_RUNNING;
	}

}
