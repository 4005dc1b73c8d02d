/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcphost.client.transport.ServerParameters;
import io.mcphost.client.transport.StdioClientTransport;
import io.mcphost.config.ServerDefinition;
import io.mcphost.spec.McpClientSession;
import io.mcphost.spec.McpClientSession.NotificationHandler;
import io.mcphost.spec.McpClientSession.RequestHandler;
import io.mcphost.spec.McpClientTransport;
import io.mcphost.spec.McpConnectionClosedException;
import io.mcphost.spec.McpError;
import io.mcphost.spec.McpHandshakeException;
import io.mcphost.spec.McpSchema;
import io.mcphost.spec.McpSpawnException;
import io.mcphost.util.Assert;
import io.mcphost.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 与一个MCP服务器进程的连接。
 *
 * <p>
 * 连接独占一个子进程，负责：
 * <ul>
 * <li>启动进程并完成{@code initialize}握手
 * <li>发现并缓存服务器提供的工具和资源
 * <li>调用工具、读取资源
 * <li>处理服务器发来的列表变更通知并刷新缓存
 * <li>断开时释放进程并以连接关闭错误结束全部待处理请求
 * </ul>
 *
 * <p>
 * 连接是一次性的：断开或连接失败之后不会再被使用，重新启动服务器总是创建新的连接。
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see McpClientSession
 * @see StdioClientTransport
 */
public class McpServerConnection {

	private static final Logger logger = LoggerFactory.getLogger(McpServerConnection.class);

	private static final TypeReference<McpSchema.InitializeResult> INITIALIZE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ResourcesUpdatedNotification> RESOURCES_UPDATED_TYPE_REF = new TypeReference<>() {
	};

	private final ServerDefinition definition;

	private final McpConnectionSpec spec;

	private final Object lifecycleLock = new Object();

	private final Sinks.Many<McpConnectionEvent> eventSink = Sinks.many().multicast().directBestEffort();

	/** 连接释放只执行一次 */
	private final AtomicBoolean released = new AtomicBoolean(false);

	private volatile ConnectionState state = ConnectionState.DISCONNECTED;

	/** 正在进行的连接过程，并发的connect()调用共享它 */
	private Mono<Void> connectAttempt;

	private volatile McpClientSession session;

	private volatile McpSchema.Implementation serverInfo;

	private volatile McpSchema.ServerCapabilities serverCapabilities;

	private volatile List<McpSchema.Tool> tools = List.of();

	private volatile List<McpSchema.Resource> resources = List.of();

	public McpServerConnection(ServerDefinition definition) {
		this(definition, McpConnectionSpec.defaults());
	}

	/**
	 * 创建新的连接。构造时不会启动进程，进程在{@link #connect()}时才启动。
	 * @param definition 服务器定义
	 * @param spec 连接配置
	 */
	public McpServerConnection(ServerDefinition definition, McpConnectionSpec spec) {
		Assert.notNull(definition, "Definition must not be null");
		Assert.notNull(spec, "Connection spec must not be null");
		this.definition = definition;
		this.spec = spec;
	}

	public ServerDefinition definition() {
		return this.definition;
	}

	public ConnectionState state() {
		return this.state;
	}

	public boolean isConnected() {
		return this.state == ConnectionState.CONNECTED;
	}

	public McpSchema.Implementation serverInfo() {
		return this.serverInfo;
	}

	public McpSchema.ServerCapabilities serverCapabilities() {
		return this.serverCapabilities;
	}

	/**
	 * 缓存的工具列表。列表在刷新时整体替换，返回值本身不可变。
	 */
	public List<McpSchema.Tool> tools() {
		return this.tools;
	}

	public List<McpSchema.Resource> resources() {
		return this.resources;
	}

	/**
	 * 连接事件流。事件只发给当时已订阅的订阅者，连接释放后流结束。
	 * @return 连接事件的热流
	 */
	public Flux<McpConnectionEvent> events() {
		return this.eventSink.asFlux();
	}

	public ServerStatus status() {
		ConnectionState current = this.state;
		return new ServerStatus(current == ConnectionState.CONNECTED, current, this.serverInfo,
				this.serverCapabilities, this.tools, this.resources);
	}

	/**
	 * 仍在等待响应的请求数。
	 */
	public int pendingRequestCount() {
		McpClientSession current = this.session;
		return current != null ? current.pendingRequestCount() : 0;
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * 启动服务器进程并完成握手和首次发现。
	 * <ul>
	 * <li>已连接时立即完成
	 * <li>正在连接时，调用方共享同一次连接过程
	 * <li>连接已释放时以{@link McpConnectionClosedException}结束
	 * </ul>
	 * 任何失败都会使连接进入{@link ConnectionState#FAILED}并释放进程。
	 * @return 连接就绪时完成的Mono
	 */
	public Mono<Void> connect() {
		return Mono.defer(() -> {
			synchronized (this.lifecycleLock) {
				if (this.state == ConnectionState.CONNECTED) {
					return Mono.empty();
				}
				if (this.released.get()) {
					return Mono.error(new McpConnectionClosedException(
							"Connection to " + this.definition.name() + " is closed"));
				}
				if (this.connectAttempt == null) {
					this.state = ConnectionState.CONNECTING;
					this.connectAttempt = doConnect().cache();
				}
				return this.connectAttempt;
			}
		});
	}

	private Mono<Void> doConnect() {
		return Mono.defer(() -> {
			logger.info("Connecting to MCP server {} ({})", this.definition.name(), this.definition.id());
			if (!Utils.hasText(this.definition.command())) {
				return Mono.error(new McpSpawnException("No command configured for " + this.definition.name(), null));
			}

			ServerParameters params = ServerParameters.builder(this.definition.command())
				.args(this.definition.args())
				.env(this.definition.env())
				.build();

			McpClientSession newSession = new McpClientSession(this.spec.requestTimeout(), createTransport(params),
					requestHandlers(), notificationHandlers(), this::onNotification);
			this.session = newSession;

			newSession.onClose().subscribe(null, error -> onProcessClosed(), this::onProcessClosed);

			return newSession.connect()
				.then(Mono.defer(() -> initialize(newSession)))
				.then(Mono.defer(() -> discover(newSession)))
				.then(Mono.defer(this::markConnected));
		}).onErrorResume(error -> {
			logger.error("Failed to connect to MCP server {}: {}", this.definition.name(), error.getMessage());
			return release(ConnectionState.FAILED, new McpConnectionEvent.Error(error)).then(Mono.error(error));
		});
	}

	/**
	 * 为给定参数创建传输层。受保护以允许在测试中替换。
	 * @param params 进程参数
	 * @return 新的传输层
	 */
	protected McpClientTransport createTransport(ServerParameters params) {
		StdioClientTransport transport = new StdioClientTransport(params, this.spec.objectMapper(),
				this.spec.closeTimeout());
		String name = this.definition.name();
		transport.setStdErrorHandler(line -> logger.info("[{}] {}", name, line));
		return transport;
	}

	private Mono<Void> initialize(McpClientSession session) {
		McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(// @formatter:off
				McpSchema.PROTOCOL_VERSION,
				this.spec.capabilities(),
				this.spec.clientInfo()); // @formatter:on

		return session.sendRequest(McpSchema.METHOD_INITIALIZE, initializeRequest, INITIALIZE_RESULT_TYPE_REF)
			.onErrorMap(IllegalArgumentException.class,
					e -> new McpHandshakeException("Malformed initialize result from " + this.definition.name(), e))
			.switchIfEmpty(Mono.error(
					() -> new McpHandshakeException("Missing initialize result from " + this.definition.name())))
			.flatMap(initializeResult -> {
				this.serverCapabilities = initializeResult.capabilities() != null ? initializeResult.capabilities()
						: new McpSchema.ServerCapabilities(null, null, null, null, null);
				this.serverInfo = initializeResult.serverInfo();

				logger.info("Server response with Protocol: {}, Capabilities: {}, Info: {}",
						initializeResult.protocolVersion(), initializeResult.capabilities(),
						initializeResult.serverInfo());

				if (!McpSchema.PROTOCOL_VERSION.equals(initializeResult.protocolVersion())) {
					logger.warn("Server {} answered with protocol version {}", this.definition.name(),
							initializeResult.protocolVersion());
				}

				return session.sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED, null);
			});
	}

	private Mono<Void> discover(McpClientSession session) {
		Mono<Void> fetchTools = this.serverCapabilities.tools() != null
				? listAllTools(session).doOnNext(list -> this.tools = list).then() : Mono.empty();
		Mono<Void> fetchResources = this.serverCapabilities.resources() != null
				? listAllResources(session).doOnNext(list -> this.resources = list).then() : Mono.empty();
		return fetchTools.then(fetchResources);
	}

	private Mono<Void> markConnected() {
		synchronized (this.lifecycleLock) {
			if (this.released.get()) {
				return Mono.error(new McpConnectionClosedException(
						"Connection to " + this.definition.name() + " closed during handshake"));
			}
			this.state = ConnectionState.CONNECTED;
		}
		logger.info("Connected to MCP server {} with {} tools and {} resources", this.definition.name(),
				this.tools.size(), this.resources.size());
		emit(new McpConnectionEvent.Connected(this.serverInfo, this.serverCapabilities));
		return Mono.empty();
	}

	private void onProcessClosed() {
		if (this.released.get()) {
			return;
		}
		if (this.state == ConnectionState.CONNECTED) {
			logger.warn("MCP server {} process exited", this.definition.name());
			release(ConnectionState.DISCONNECTED, new McpConnectionEvent.Disconnected("Server process exited"))
				.subscribe();
		}
		else {
			McpConnectionClosedException error = new McpConnectionClosedException(
					"Server process " + this.definition.name() + " exited during handshake");
			release(ConnectionState.FAILED, new McpConnectionEvent.Error(error)).subscribe();
		}
	}

	/**
	 * 断开连接：结束全部待处理请求，清空缓存并终止进程。重复调用是安全的。
	 * @return 进程释放后完成的Mono
	 */
	public Mono<Void> disconnect() {
		return release(ConnectionState.DISCONNECTED, new McpConnectionEvent.Disconnected("Disconnected"));
	}

	/**
	 * 释放连接。只有第一次调用生效：设置最终状态，发出事件，然后关闭会话。
	 */
	private Mono<Void> release(ConnectionState finalState, McpConnectionEvent event) {
		return Mono.defer(() -> {
			if (!this.released.compareAndSet(false, true)) {
				return Mono.empty();
			}
			synchronized (this.lifecycleLock) {
				this.state = finalState;
			}
			this.tools = List.of();
			this.resources = List.of();

			synchronized (this.eventSink) {
				this.eventSink.tryEmitNext(event);
				this.eventSink.tryEmitComplete();
			}

			McpClientSession current = this.session;
			if (current == null) {
				return Mono.empty();
			}
			logger.debug("Releasing connection to {}", this.definition.name());
			return current.closeGracefully().onErrorResume(error -> {
				logger.warn("Error while closing connection to {}: {}", this.definition.name(), error.getMessage());
				return Mono.empty();
			});
		});
	}

	// --------------------------
	// Operations
	// --------------------------

	/**
	 * 调用服务器上的工具。
	 * @param name 工具名称
	 * @param arguments 调用参数，可以为null
	 * @return 工具调用结果
	 */
	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return withConnectedSession("calling tool " + name,
				session -> session.sendRequest(McpSchema.METHOD_TOOLS_CALL,
						new McpSchema.CallToolRequest(name, arguments != null ? arguments : Map.of()),
						CALL_TOOL_RESULT_TYPE_REF));
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		return withConnectedSession("reading resource " + uri,
				session -> session.sendRequest(McpSchema.METHOD_RESOURCES_READ, new McpSchema.ReadResourceRequest(uri),
						READ_RESOURCE_RESULT_TYPE_REF));
	}

	/**
	 * 向服务器发送通知。服务器未运行时只记录日志并丢弃。
	 * @param method 通知方法
	 * @param params 通知参数
	 * @return 通知写出后完成的Mono
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return Mono.defer(() -> {
			McpClientSession current = this.session;
			if (!isConnected() || current == null) {
				logger.warn("Server {} is not running, dropping notification {}", this.definition.name(), method);
				return Mono.empty();
			}
			return current.sendNotification(method, params);
		});
	}

	private <T> Mono<T> withConnectedSession(String actionName,
			Function<McpClientSession, Mono<T>> operation) {
		return Mono.defer(() -> {
			McpClientSession current = this.session;
			if (!isConnected() || current == null) {
				return Mono.error(new McpError(
						"Server " + this.definition.name() + " must be connected before " + actionName));
			}
			return operation.apply(current);
		});
	}

	private Mono<List<McpSchema.Tool>> listAllTools(McpClientSession session) {
		return session
			.sendRequest(McpSchema.METHOD_TOOLS_LIST, new McpSchema.PaginatedRequest(null), LIST_TOOLS_RESULT_TYPE_REF)
			.expand(page -> Utils.hasText(page.nextCursor())
					? session.sendRequest(McpSchema.METHOD_TOOLS_LIST, new McpSchema.PaginatedRequest(page.nextCursor()),
							LIST_TOOLS_RESULT_TYPE_REF)
					: Mono.empty())
			.concatMapIterable(page -> page.tools() != null ? page.tools() : List.<McpSchema.Tool>of())
			.collectList()
			.map(List::copyOf);
	}

	private Mono<List<McpSchema.Resource>> listAllResources(McpClientSession session) {
		return session
			.sendRequest(McpSchema.METHOD_RESOURCES_LIST, new McpSchema.PaginatedRequest(null),
					LIST_RESOURCES_RESULT_TYPE_REF)
			.expand(page -> Utils.hasText(page.nextCursor())
					? session.sendRequest(McpSchema.METHOD_RESOURCES_LIST,
							new McpSchema.PaginatedRequest(page.nextCursor()), LIST_RESOURCES_RESULT_TYPE_REF)
					: Mono.empty())
			.concatMapIterable(page -> page.resources() != null ? page.resources() : List.<McpSchema.Resource>of())
			.collectList()
			.map(List::copyOf);
	}

	// --------------------------
	// Server initiated messages
	// --------------------------

	private Map<String, RequestHandler<?>> requestHandlers() {
		Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();
		requestHandlers.put(McpSchema.METHOD_PING, params -> Mono.just(Map.of()));
		requestHandlers.put(McpSchema.METHOD_ROOTS_LIST, params -> Mono.just(new McpSchema.ListRootsResult(List.of())));
		return requestHandlers;
	}

	private Map<String, NotificationHandler> notificationHandlers() {
		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, params -> refreshTools());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, params -> refreshResources());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED, this::resourceUpdated);
		return notificationHandlers;
	}

	private void onNotification(McpSchema.JSONRPCNotification notification) {
		emit(new McpConnectionEvent.Notification(notification.method(), notification.params()));
	}

	private Mono<Void> refreshTools() {
		McpClientSession current = this.session;
		if (current == null || this.released.get()) {
			return Mono.empty();
		}
		return listAllTools(current).onErrorResume(error -> {
			logger.error("Failed to refresh tools of {}: {}", this.definition.name(), error.getMessage());
			return Mono.just(List.of());
		}).doOnNext(list -> {
			if (!this.released.get()) {
				this.tools = list;
				logger.debug("Tools of {} changed: {}", this.definition.name(), list.size());
				emit(new McpConnectionEvent.ToolsUpdated(list));
			}
		}).then();
	}

	private Mono<Void> refreshResources() {
		McpClientSession current = this.session;
		if (current == null || this.released.get()) {
			return Mono.empty();
		}
		return listAllResources(current).onErrorResume(error -> {
			logger.error("Failed to refresh resources of {}: {}", this.definition.name(), error.getMessage());
			return Mono.just(List.of());
		}).doOnNext(list -> {
			if (!this.released.get()) {
				this.resources = list;
				logger.debug("Resources of {} changed: {}", this.definition.name(), list.size());
				emit(new McpConnectionEvent.ResourcesUpdated(list));
			}
		}).then();
	}

	private Mono<Void> resourceUpdated(Object params) {
		return Mono.fromRunnable(() -> {
			McpClientSession current = this.session;
			String uri = null;
			if (current != null && params != null) {
				uri = current.unmarshalFrom(params, RESOURCES_UPDATED_TYPE_REF).uri();
			}
			emit(new McpConnectionEvent.ResourceUpdated(uri, params));
		});
	}

	private void emit(McpConnectionEvent event) {
		synchronized (this.eventSink) {
			this.eventSink.tryEmitNext(event);
		}
	}

	@Override
	public String toString() {
		return "McpServerConnection{name=" + this.definition.name() + ", id=" + this.definition.id() + ", state="
				+ this.state + "}";
	}

}
