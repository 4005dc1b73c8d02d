/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcphost.spec.McpSchema;
import io.mcphost.util.Assert;

/**
 * 服务器连接的配置。所有连接共享同一份配置，由监督器在创建连接时传入。
 *
 * <p>
 * 示例：<pre>{@code
 * McpConnectionSpec spec = McpConnectionSpec.builder()
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .clientInfo(new Implementation("my-host", "2.0.0"))
 *     .build();
 * }</pre>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public final class McpConnectionSpec {

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);

	public static final McpSchema.Implementation DEFAULT_CLIENT_INFO = new McpSchema.Implementation("mcp-host",
			"1.0.0");

	private final Duration requestTimeout;

	private final Duration closeTimeout;

	private final McpSchema.Implementation clientInfo;

	private final McpSchema.ClientCapabilities capabilities;

	private final ObjectMapper objectMapper;

	private McpConnectionSpec(Builder builder) {
		this.requestTimeout = builder.requestTimeout;
		this.closeTimeout = builder.closeTimeout;
		this.clientInfo = builder.clientInfo;
		this.capabilities = builder.capabilities;
		this.objectMapper = builder.objectMapper;
	}

	public static McpConnectionSpec defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/** 单个请求等待响应的最长时间 */
	public Duration requestTimeout() {
		return this.requestTimeout;
	}

	/** 关闭时等待服务器进程退出的最长时间 */
	public Duration closeTimeout() {
		return this.closeTimeout;
	}

	public McpSchema.Implementation clientInfo() {
		return this.clientInfo;
	}

	public McpSchema.ClientCapabilities capabilities() {
		return this.capabilities;
	}

	public ObjectMapper objectMapper() {
		return this.objectMapper;
	}

	/**
	 * {@link McpConnectionSpec}的构建器。
	 */
	public static final class Builder {

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;

		private McpSchema.Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private McpSchema.ClientCapabilities capabilities = McpSchema.ClientCapabilities.defaults();

		private ObjectMapper objectMapper;

		private Builder() {
		}

		/**
		 * 设置请求超时。超过此时间仍未收到响应的请求以
		 * {@link io.mcphost.spec.McpRequestTimeoutException}结束。
		 * @param requestTimeout 超时时间，不能为null
		 * @return 此构建器实例
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder closeTimeout(Duration closeTimeout) {
			Assert.notNull(closeTimeout, "Close timeout must not be null");
			this.closeTimeout = closeTimeout;
			return this;
		}

		/**
		 * 设置握手时发送给服务器的客户端实现信息。
		 * @param clientInfo 客户端信息，不能为null
		 * @return 此构建器实例
		 */
		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public Builder capabilities(McpSchema.ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public McpConnectionSpec build() {
			if (this.objectMapper == null) {
				this.objectMapper = new ObjectMapper();
			}
			return new McpConnectionSpec(this);
		}

	}

}
