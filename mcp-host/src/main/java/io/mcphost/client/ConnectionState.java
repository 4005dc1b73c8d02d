/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

/**
 * 服务器连接的生命周期状态。
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED
 *                      \-> FAILED
 * </pre>
 *
 * 连接一旦离开{@code CONNECTED}或进入{@code FAILED}就不会再被使用，重新启动总是创建新的连接。
 */
public enum ConnectionState {

	DISCONNECTED,

	CONNECTING,

	CONNECTED,

	FAILED

}
