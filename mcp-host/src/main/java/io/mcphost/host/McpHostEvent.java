/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.host;

/**
 * 主机适配器发给观察者的事件。
 */
public sealed interface McpHostEvent {

	/**
	 * 服务器定义集合发生了变化（创建、修改、删除或启用状态切换），观察者应重新读取列表。
	 *
	 * @param serverId 发生变化的服务器id
	 */
	record ServersChanged(String serverId) implements McpHostEvent {
	}

}
