/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import io.mcphost.client.McpConnectionEvent;
import io.mcphost.client.McpConnectionSpec;
import io.mcphost.client.McpServerConnection;
import io.mcphost.client.ServerStatus;
import io.mcphost.config.ServerDefinition;
import io.mcphost.config.ServerDefinitionStore;
import io.mcphost.spec.McpConnectionClosedException;
import io.mcphost.spec.McpError;
import io.mcphost.spec.McpSchema;
import io.mcphost.util.Assert;
import io.mcphost.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * 管理一组运行中的MCP服务器连接。
 *
 * <p>
 * 监督器负责：
 * <ul>
 * <li>启动时自动启动已启用且标记为自动启动的服务器
 * <li>按id启动、停止、重启服务器，以及关闭时并发停止全部服务器
 * <li>汇总所有运行中服务器的工具和资源
 * <li>按服务器id或按（限定）工具名路由工具调用
 * <li>在不保存、不注册的前提下试连接候选定义
 * </ul>
 *
 * <p>
 * {@code sessions}只包含运行中的连接：连接成功之后才注册，停止或进程退出时移除。
 * 同一id的并发启动共享同一次启动过程，不会启动第二个进程。
 *
 * <p>
 * 示例：<pre>{@code
 * McpServerSupervisor supervisor = McpServerSupervisor.builder(store)
 *     .restartDelay(Duration.ofMillis(500))
 *     .build();
 * supervisor.initialize().block();
 * CallToolResult result = supervisor.callToolByName("files__read", Map.of("path", "a.txt")).block();
 * }</pre>
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpServerConnection
 */
public class McpServerSupervisor {

	private static final Logger logger = LoggerFactory.getLogger(McpServerSupervisor.class);

	public static final Duration DEFAULT_RESTART_DELAY = Duration.ofSeconds(1);

	public static final Duration DEFAULT_TEST_TIMEOUT = Duration.ofSeconds(15);

	private final ServerDefinitionStore store;

	private final Function<ServerDefinition, McpServerConnection> connectionFactory;

	private final Duration restartDelay;

	private final Duration testTimeout;

	/** 运行中的连接，按服务器id排序 */
	private final ConcurrentSkipListMap<String, McpServerConnection> sessions = new ConcurrentSkipListMap<>();

	/** 进行中的启动过程 */
	private final ConcurrentHashMap<String, Mono<ServerStatus>> pendingStarts = new ConcurrentHashMap<>();

	private final AtomicBoolean initialized = new AtomicBoolean(false);

	/** 工具调用取消的代数，每次取消加一 */
	private final AtomicLong cancelGeneration = new AtomicLong(0);

	private final Sinks.Many<Long> cancellations = Sinks.many().multicast().directBestEffort();

	private final Sinks.Many<McpServerEvent> eventSink = Sinks.many().multicast().directBestEffort();

	McpServerSupervisor(Builder builder) {
		this.store = builder.store;
		this.restartDelay = builder.restartDelay;
		this.testTimeout = builder.testTimeout;
		McpConnectionSpec connectionSpec = builder.connectionSpec;
		this.connectionFactory = builder.connectionFactory != null ? builder.connectionFactory
				: definition -> new McpServerConnection(definition, connectionSpec);
	}

	public static Builder builder(ServerDefinitionStore store) {
		return new Builder(store);
	}

	/**
	 * 所有连接事件的热流，每个事件附带来源服务器id。
	 */
	public Flux<McpServerEvent> events() {
		return this.eventSink.asFlux();
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 启动所有已启用且自动启动的服务器。重复调用只记录日志。单个服务器启动失败只记录日志，
	 * 不影响其余服务器。
	 * @return 全部启动尝试结束后完成的Mono
	 */
	public Mono<Void> initialize() {
		return Mono.defer(() -> {
			if (!this.initialized.compareAndSet(false, true)) {
				logger.info("MCP supervisor already initialized");
				return Mono.empty();
			}
			logger.info("Initializing MCP supervisor");
			return Mono.fromCallable(this.store::listConfigs)
				.subscribeOn(Schedulers.boundedElastic())
				.flatMapIterable(configs -> configs)
				.filter(definition -> definition.enabled() && definition.autoStart())
				.concatMap(definition -> startServer(definition.id()).onErrorResume(error -> {
					logger.error("Failed to auto-start MCP server {}: {}", definition.name(), error.getMessage());
					return Mono.empty();
				}))
				.doOnComplete(() -> logger.info("MCP supervisor initialized with {} running servers",
						getRunningCount()))
				.doOnError(error -> {
					// the definitions could not be read; a later call may try again
					this.initialized.set(false);
					logger.error("Failed to initialize MCP supervisor: {}", error.getMessage());
				})
				.then();
		});
	}

	/**
	 * 启动服务器。
	 * <ul>
	 * <li>已连接时直接返回其状态
	 * <li>存在未连接的旧连接时先丢弃它
	 * <li>同一id正在启动时共享那次启动
	 * </ul>
	 * @param serverId 服务器id
	 * @return 连接成功后的服务器状态；定义不存在时以{@link McpServerNotFoundException}结束，
	 * 未启用时以{@link McpServerDisabledException}结束
	 */
	public Mono<ServerStatus> startServer(String serverId) {
		return Mono.defer(() -> {
			Assert.hasText(serverId, "Server id must not be empty");

			McpServerConnection existing = this.sessions.get(serverId);
			if (existing != null) {
				if (existing.isConnected()) {
					logger.debug("MCP server {} is already running", serverId);
					return Mono.just(existing.status());
				}
				if (this.sessions.remove(serverId, existing)) {
					logger.info("Discarding stale connection for MCP server {}", serverId);
					existing.disconnect().subscribe(null,
							error -> logger.warn("Error discarding stale connection {}: {}", serverId,
									error.getMessage()));
				}
			}

			return this.pendingStarts.computeIfAbsent(serverId,
					id -> Mono.defer(() -> runningStatus(id).map(Mono::just).orElseGet(() -> doStart(id)))
						.doFinally(signal -> this.pendingStarts.remove(id))
						.cache());
		});
	}

	private Mono<ServerStatus> doStart(String serverId) {
		return loadDefinition(serverId).flatMap(definition -> {
			if (!definition.enabled()) {
				return Mono.error(new McpServerDisabledException(serverId));
			}
			McpServerConnection connection = this.connectionFactory.apply(definition);
			connection.events().subscribe(event -> onConnectionEvent(serverId, connection, event));

			return connection.connect().then(Mono.defer(() -> register(serverId, connection)));
		});
	}

	/**
	 * 已注册且仍连接的服务器状态。另一次启动可能在本次检查{@code sessions}之后、进入
	 * {@code pendingStarts}之前完成注册。
	 */
	private Optional<ServerStatus> runningStatus(String serverId) {
		McpServerConnection running = this.sessions.get(serverId);
		return running != null && running.isConnected() ? Optional.of(running.status()) : Optional.empty();
	}

	private Mono<ServerStatus> register(String serverId, McpServerConnection connection) {
		McpServerConnection winner = this.sessions.putIfAbsent(serverId, connection);
		if (winner != null && winner != connection) {
			if (winner.isConnected()) {
				logger.warn("MCP server {} was started concurrently, closing duplicate connection", serverId);
				return connection.disconnect().then(Mono.fromSupplier(winner::status));
			}
			this.sessions.replace(serverId, winner, connection);
		}
		// the process may have exited between the handshake and the registration
		if (!connection.isConnected()) {
			this.sessions.remove(serverId, connection);
			return Mono.error(new McpConnectionClosedException("Server " + serverId + " exited while starting"));
		}
		logger.info("MCP server {} started", connection.definition().name());
		return Mono.just(connection.status());
	}

	private Mono<ServerDefinition> loadDefinition(String serverId) {
		return Mono.fromCallable(() -> this.store.getConfig(serverId))
			.subscribeOn(Schedulers.boundedElastic())
			.filter(Optional::isPresent)
			.map(Optional::get)
			.switchIfEmpty(Mono.error(() -> new McpServerNotFoundException(serverId)));
	}

	/**
	 * 停止服务器。服务器未运行时什么也不做；正在启动时先等待启动结束。
	 * @param serverId 服务器id
	 * @return 服务器进程释放后完成的Mono
	 */
	public Mono<Void> stopServer(String serverId) {
		return Mono.defer(() -> {
			Mono<ServerStatus> pending = this.pendingStarts.get(serverId);
			Mono<Void> awaitPending = pending != null ? pending.then().onErrorResume(error -> Mono.empty())
					: Mono.empty();
			return awaitPending.then(Mono.defer(() -> {
				McpServerConnection connection = this.sessions.remove(serverId);
				if (connection == null) {
					logger.debug("MCP server {} is not running", serverId);
					return Mono.empty();
				}
				logger.info("Stopping MCP server {}", connection.definition().name());
				return connection.disconnect();
			}));
		});
	}

	/**
	 * 停止服务器，等待一段时间后重新启动。
	 * @param serverId 服务器id
	 * @return 新连接的状态
	 */
	public Mono<ServerStatus> restartServer(String serverId) {
		return stopServer(serverId).then(Mono.delay(this.restartDelay)).then(startServer(serverId));
	}

	/**
	 * 并发停止全部运行中的服务器，全部停止后完成。
	 */
	public Mono<Void> stopAll() {
		return Mono.defer(() -> {
			List<String> running = new ArrayList<>(this.sessions.keySet());
			logger.info("Stopping {} MCP servers", running.size());
			return Flux.fromIterable(running).flatMap(serverId -> stopServer(serverId).onErrorResume(error -> {
				logger.error("Failed to stop MCP server {}: {}", serverId, error.getMessage());
				return Mono.empty();
			})).then();
		});
	}

	private void onConnectionEvent(String serverId, McpServerConnection connection, McpConnectionEvent event) {
		if (event instanceof McpConnectionEvent.Disconnected disconnected
				&& this.sessions.remove(serverId, connection)) {
			logger.warn("MCP server {} disconnected: {}", connection.definition().name(), disconnected.reason());
		}
		synchronized (this.eventSink) {
			this.eventSink.tryEmitNext(new McpServerEvent(serverId, event));
		}
	}

	// --------------------------
	// Discovery
	// --------------------------

	/**
	 * 所有运行中服务器的工具，每个服务器内部保持原有顺序。
	 */
	public List<ServerTool> getAllTools() {
		List<ServerTool> tools = new ArrayList<>();
		for (McpServerConnection connection : runningConnections()) {
			ServerDefinition definition = connection.definition();
			for (McpSchema.Tool tool : connection.tools()) {
				tools.add(new ServerTool(definition.id(), definition.name(), tool));
			}
		}
		return tools;
	}

	public List<ServerResource> getAllResources() {
		List<ServerResource> resources = new ArrayList<>();
		for (McpServerConnection connection : runningConnections()) {
			ServerDefinition definition = connection.definition();
			for (McpSchema.Resource resource : connection.resources()) {
				resources.add(new ServerResource(definition.id(), definition.name(), resource));
			}
		}
		return resources;
	}

	private List<McpServerConnection> runningConnections() {
		return this.sessions.values().stream().filter(McpServerConnection::isConnected).toList();
	}

	// --------------------------
	// Invocation
	// --------------------------

	/**
	 * 调用指定服务器上的工具。
	 * @param serverId 服务器id
	 * @param toolName 工具名称
	 * @param arguments 调用参数
	 * @return 工具调用结果；服务器未运行时以{@link McpServerNotRunningException}结束
	 */
	public Mono<McpSchema.CallToolResult> callTool(String serverId, String toolName, Map<String, Object> arguments) {
		return Mono.defer(() -> {
			McpServerConnection connection = this.sessions.get(serverId);
			if (connection == null || !connection.isConnected()) {
				return Mono.error(new McpServerNotRunningException(serverId));
			}
			return cancellable(serverId, toolName, connection.callTool(toolName, arguments));
		});
	}

	/**
	 * 按名称调用工具。名称可以是{@code serverName__toolName}形式的限定名，只在该服务器中查找；
	 * 也可以是裸工具名，按服务器id顺序在所有运行中的服务器中查找第一个提供者。
	 * @param name 限定或裸工具名
	 * @param arguments 调用参数
	 * @return 工具调用结果；找不到工具时以{@link McpToolNotFoundException}结束
	 * @see QualifiedToolName
	 */
	public Mono<McpSchema.CallToolResult> callToolByName(String name, Map<String, Object> arguments) {
		return Mono.defer(() -> {
			QualifiedToolName qualifiedName = QualifiedToolName.parse(name);
			String serverName = qualifiedName.serverName();
			String toolName = qualifiedName.toolName();

			for (McpServerConnection connection : runningConnections()) {
				ServerDefinition definition = connection.definition();
				if (Utils.hasText(serverName) && !serverName.equals(definition.name())) {
					continue;
				}
				boolean provides = connection.tools().stream().anyMatch(tool -> toolName.equals(tool.name()));
				if (provides) {
					logger.debug("Routing tool {} to MCP server {}", toolName, definition.name());
					return cancellable(definition.id(), toolName, connection.callTool(toolName, arguments));
				}
			}
			return Mono.error(new McpToolNotFoundException(name));
		});
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String serverId, String uri) {
		return Mono.defer(() -> {
			McpServerConnection connection = this.sessions.get(serverId);
			if (connection == null || !connection.isConnected()) {
				return Mono.error(new McpServerNotRunningException(serverId));
			}
			return connection.readResource(uri);
		});
	}

	/**
	 * 放弃所有已发起的工具调用。之前发起的调用以{@link McpToolCallCancelledException}结束，
	 * 之后发起的调用不受影响。
	 */
	public void cancelAllToolCalls() {
		long generation = this.cancelGeneration.incrementAndGet();
		logger.info("Cancelling all tool calls, generation {}", generation);
		synchronized (this.cancellations) {
			this.cancellations.tryEmitNext(generation);
		}
	}

	private Mono<McpSchema.CallToolResult> cancellable(String serverId, String toolName,
			Mono<McpSchema.CallToolResult> call) {
		return Mono.defer(() -> {
			long generation = this.cancelGeneration.get();
			// reads the counter again after subscribing so a bump in between is not missed
			Mono<McpSchema.CallToolResult> cancelled = this.cancellations.asFlux()
				.mergeWith(Mono.fromSupplier(this.cancelGeneration::get))
				.filter(current -> current > generation)
				.next()
				.flatMap(current -> Mono
					.<McpSchema.CallToolResult>error(new McpToolCallCancelledException(serverId, toolName)));
			return Mono.firstWithSignal(call, cancelled);
		});
	}

	// --------------------------
	// Test connection
	// --------------------------

	/**
	 * 用一个不保存、不注册的临时连接试连接候选定义。无论结果如何，临时连接都会被断开。
	 * 此方法从不以错误结束，失败体现在返回结果中。
	 * @param candidate 候选定义
	 * @return 试连接结果
	 */
	public Mono<ServerTestResult> testServerConfig(ServerDefinition candidate) {
		return Mono.defer(() -> {
			Assert.notNull(candidate, "Candidate definition must not be null");
			ServerDefinition trial = candidate.toBuilder()
				.id("test_" + System.currentTimeMillis())
				.enabled(true)
				.build();
			McpServerConnection connection = this.connectionFactory.apply(trial);

			return connection.connect()
				.timeout(this.testTimeout)
				.then(Mono.fromSupplier(() -> ServerTestResult.success(connection.serverInfo(), connection.tools(),
						connection.resources().size())))
				.onErrorResume(error -> Mono.just(ServerTestResult.failure(describe(error))))
				.flatMap(result -> connection.disconnect().onErrorResume(error -> {
					logger.warn("Error closing test connection: {}", error.getMessage());
					return Mono.empty();
				}).thenReturn(result));
		}).onErrorResume(error -> Mono.just(ServerTestResult.failure(error)));
	}

	private Throwable describe(Throwable error) {
		if (error instanceof TimeoutException) {
			return new McpError("Connection timed out after " + this.testTimeout.toMillis() + " ms", error);
		}
		return error;
	}

	// --------------------------
	// Status
	// --------------------------

	public boolean isServerRunning(String serverId) {
		McpServerConnection connection = this.sessions.get(serverId);
		return connection != null && connection.isConnected();
	}

	public int getRunningCount() {
		return this.sessions.size();
	}

	public ServerStatus getServerStatus(String serverId) {
		McpServerConnection connection = this.sessions.get(serverId);
		return connection != null ? connection.status() : ServerStatus.notRunning();
	}

	/**
	 * 所有运行中服务器的状态，按服务器id排序。
	 */
	public Map<String, ServerStatus> getAllServerStatus() {
		Map<String, ServerStatus> statuses = new LinkedHashMap<>();
		this.sessions.forEach((serverId, connection) -> statuses.put(serverId, connection.status()));
		return statuses;
	}

	/**
	 * {@link McpServerSupervisor}的构建器。
	 */
	public static final class Builder {

		private final ServerDefinitionStore store;

		private McpConnectionSpec connectionSpec = McpConnectionSpec.defaults();

		private Duration restartDelay = DEFAULT_RESTART_DELAY;

		private Duration testTimeout = DEFAULT_TEST_TIMEOUT;

		private Function<ServerDefinition, McpServerConnection> connectionFactory;

		private Builder(ServerDefinitionStore store) {
			Assert.notNull(store, "Store must not be null");
			this.store = store;
		}

		public Builder connectionSpec(McpConnectionSpec connectionSpec) {
			Assert.notNull(connectionSpec, "Connection spec must not be null");
			this.connectionSpec = connectionSpec;
			return this;
		}

		/**
		 * 设置重启时停止与启动之间的等待时间。
		 * @param restartDelay 等待时间，不能为null
		 * @return 此构建器实例
		 */
		public Builder restartDelay(Duration restartDelay) {
			Assert.notNull(restartDelay, "Restart delay must not be null");
			this.restartDelay = restartDelay;
			return this;
		}

		public Builder testTimeout(Duration testTimeout) {
			Assert.notNull(testTimeout, "Test timeout must not be null");
			this.testTimeout = testTimeout;
			return this;
		}

		/**
		 * 替换创建连接的方式，设置后{@link #connectionSpec(McpConnectionSpec)}不再生效。
		 * @param connectionFactory 按定义创建连接的函数
		 * @return 此构建器实例
		 */
		public Builder connectionFactory(Function<ServerDefinition, McpServerConnection> connectionFactory) {
			Assert.notNull(connectionFactory, "Connection factory must not be null");
			this.connectionFactory = connectionFactory;
			return this;
		}

		public McpServerSupervisor build() {
			return new McpServerSupervisor(this);
		}

	}

}
