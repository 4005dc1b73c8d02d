/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.host;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

import io.mcphost.client.ServerStatus;
import io.mcphost.config.ServerDefinition;
import io.mcphost.config.ServerDefinitionStore;
import io.mcphost.spec.McpSchema;
import io.mcphost.supervisor.McpServerNotFoundException;
import io.mcphost.supervisor.McpServerSupervisor;
import io.mcphost.supervisor.ServerResource;
import io.mcphost.supervisor.ServerTestResult;
import io.mcphost.supervisor.ServerTool;
import io.mcphost.util.Assert;
import io.mcphost.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * 主机应用与MCP子系统之间的边界适配器。
 *
 * <p>
 * 把主机命令（服务器定义的增删改查、启停、工具调用、试连接）转换为对
 * {@link ServerDefinitionStore}和{@link McpServerSupervisor}的调用。修改或删除运行中服务器的定义之前
 * 会先停止它。每个改变定义集合的命令都会在{@link #events()}上发出
 * {@link McpHostEvent.ServersChanged}。
 *
 * @author Christian Tzolov
 */
public class McpHostAdapter {

	private static final Logger logger = LoggerFactory.getLogger(McpHostAdapter.class);

	static final String DEFAULT_NAME = "Unnamed Server";

	static final String DEFAULT_ICON = "🔧";

	private static final Comparator<ServerDefinition> NEWEST_FIRST = Comparator
		.comparing(ServerDefinition::createdAt, Comparator.nullsLast(Comparator.<String>reverseOrder()));

	private final McpServerSupervisor supervisor;

	private final ServerDefinitionStore store;

	private final Clock clock;

	private final Sinks.Many<McpHostEvent> eventSink = Sinks.many().multicast().directBestEffort();

	public McpHostAdapter(McpServerSupervisor supervisor, ServerDefinitionStore store) {
		this(supervisor, store, Clock.systemUTC());
	}

	public McpHostAdapter(McpServerSupervisor supervisor, ServerDefinitionStore store, Clock clock) {
		Assert.notNull(supervisor, "Supervisor must not be null");
		Assert.notNull(store, "Store must not be null");
		Assert.notNull(clock, "Clock must not be null");
		this.supervisor = supervisor;
		this.store = store;
		this.clock = clock;
	}

	/**
	 * 定义集合变化事件的热流。
	 */
	public Flux<McpHostEvent> events() {
		return this.eventSink.asFlux();
	}

	// ==================== Server definitions ====================

	/**
	 * 全部服务器定义，最新创建的在前。
	 */
	public Mono<List<ServerView>> listServers() {
		return blocking(() -> this.store.listConfigs()
			.stream()
			.sorted(NEWEST_FIRST)
			.map(definition -> new ServerView(definition, this.supervisor.isServerRunning(definition.id())))
			.toList());
	}

	public Mono<ServerView> getServer(String serverId) {
		return blocking(() -> this.store.getConfig(serverId))
			.filter(Optional::isPresent)
			.map(Optional::get)
			.map(definition -> new ServerView(definition, this.supervisor.isServerRunning(serverId)));
	}

	/**
	 * 创建新的服务器定义。id和时间戳由适配器生成，名称必须唯一。
	 * @param config 新定义，其id和时间戳会被忽略
	 * @return 保存后的定义；名称已存在时以{@link IllegalArgumentException}结束
	 */
	public Mono<ServerDefinition> createServer(ServerDefinition config) {
		return blocking(() -> {
			Assert.notNull(config, "Config must not be null");
			String name = Utils.hasText(config.name()) ? config.name() : DEFAULT_NAME;
			Assert.isTrue(findByName(name).isEmpty(), "Server with name \"" + name + "\" already exists");

			String now = now();
			ServerDefinition created = config.toBuilder()
				.id(UUID.randomUUID().toString())
				.name(name)
				.command(config.command() != null ? config.command() : "")
				.description(config.description() != null ? config.description() : "")
				.icon(config.icon() != null ? config.icon() : DEFAULT_ICON)
				.createdAt(now)
				.updatedAt(now)
				.build();
			return this.store.save(created);
		}).doOnNext(created -> {
			logger.info("Created MCP server {}", created.name());
			serversChanged(created.id());
		});
	}

	/**
	 * 修改服务器定义。服务器正在运行时先停止它；id和创建时间保持不变。
	 * @param serverId 服务器id
	 * @param updates 作用在当前定义构建器上的修改
	 * @return 修改后的定义；定义不存在时以{@link McpServerNotFoundException}结束
	 */
	public Mono<ServerDefinition> updateServer(String serverId, Consumer<ServerDefinition.Builder> updates) {
		return stopServer(serverId).then(blocking(() -> applyUpdate(serverId, updates)))
			.doOnNext(updated -> {
				logger.info("Updated MCP server {}", updated.name());
				serversChanged(updated.id());
			});
	}

	public Mono<ServerDefinition> updateServerByName(String serverName, Consumer<ServerDefinition.Builder> updates) {
		return blocking(() -> findByName(serverName))
			.flatMap(existing -> existing.map(definition -> updateServer(definition.id(), updates))
				.orElseGet(() -> Mono.error(new McpServerNotFoundException(serverName))));
	}

	/**
	 * 删除服务器定义，服务器正在运行时先停止它。
	 * @param serverId 服务器id
	 * @return 定义存在并被删除时为true
	 */
	public Mono<Boolean> deleteServer(String serverId) {
		return stopServer(serverId)
			.then(blocking(() -> this.store.getConfig(serverId).map(this.store::delete).orElse(false)))
			.doOnNext(deleted -> {
				logger.info("Deleted MCP server {}: {}", serverId, deleted);
				serversChanged(serverId);
			});
	}

	public Mono<Boolean> deleteServerByName(String serverName) {
		return blocking(() -> findByName(serverName)).flatMap(existing -> existing
			.map(definition -> deleteServer(definition.id()))
			.orElseGet(() -> Mono.just(false)));
	}

	/**
	 * 切换启用状态。禁用运行中的服务器时停止它。
	 * @param serverId 服务器id
	 * @return 修改后的定义
	 */
	public Mono<ServerDefinition> toggleServerEnabled(String serverId) {
		return blocking(
				() -> this.store.getConfig(serverId).orElseThrow(() -> new McpServerNotFoundException(serverId)))
			.flatMap(current -> blocking(
					() -> applyUpdate(serverId, builder -> builder.enabled(!current.enabled()))))
			.flatMap(updated -> {
				Mono<Void> stop = !updated.enabled() ? this.supervisor.stopServer(serverId) : Mono.empty();
				return stop.thenReturn(updated);
			})
			.doOnNext(updated -> {
				logger.info("MCP server {} enabled: {}", updated.name(), updated.enabled());
				serversChanged(updated.id());
			});
	}

	// ==================== Lifecycle ====================

	public Mono<ServerStatus> startServer(String serverId) {
		return this.supervisor.startServer(serverId);
	}

	public Mono<Void> stopServer(String serverId) {
		return this.supervisor.stopServer(serverId);
	}

	public Mono<ServerStatus> restartServer(String serverId) {
		return this.supervisor.restartServer(serverId);
	}

	public ServerStatus getServerStatus(String serverId) {
		return this.supervisor.getServerStatus(serverId);
	}

	public Map<String, ServerStatus> getAllServerStatus() {
		return this.supervisor.getAllServerStatus();
	}

	public int getRunningCount() {
		return this.supervisor.getRunningCount();
	}

	/**
	 * 自动启动服务器。失败只记录日志。
	 */
	public Mono<Void> initialize() {
		return this.supervisor.initialize().onErrorResume(error -> {
			logger.error("Failed to initialize MCP system", error);
			return Mono.empty();
		});
	}

	/**
	 * 停止全部服务器，在主机退出时调用。
	 */
	public Mono<Void> shutdown() {
		logger.info("Shutting down MCP system");
		return this.supervisor.stopAll();
	}

	// ==================== Tools & resources ====================

	public List<ServerTool> getAllTools() {
		return this.supervisor.getAllTools();
	}

	public List<ServerResource> getAllResources() {
		return this.supervisor.getAllResources();
	}

	public Mono<McpSchema.CallToolResult> callTool(String serverId, String toolName, Map<String, Object> arguments) {
		logger.debug("Calling tool {} on server {}", toolName, serverId);
		return this.supervisor.callTool(serverId, toolName, arguments);
	}

	public Mono<McpSchema.CallToolResult> callToolByName(String name, Map<String, Object> arguments) {
		logger.debug("Calling tool by name {}", name);
		return this.supervisor.callToolByName(name, arguments);
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String serverId, String uri) {
		return this.supervisor.readResource(serverId, uri);
	}

	public void cancelAllToolCalls() {
		this.supervisor.cancelAllToolCalls();
	}

	/**
	 * 试连接候选定义，不保存。从不以错误结束。
	 */
	public Mono<ServerTestResult> testServer(ServerDefinition candidate) {
		return this.supervisor.testServerConfig(candidate)
			.doOnNext(result -> logger.info("Test result for {}: {}", candidate != null ? candidate.name() : null,
					result.message()))
			.onErrorResume(error -> Mono.just(ServerTestResult.failure(error)));
	}

	// ==================== Internals ====================

	private ServerDefinition applyUpdate(String serverId, Consumer<ServerDefinition.Builder> updates) {
		ServerDefinition existing = this.store.getConfig(serverId)
			.orElseThrow(() -> new McpServerNotFoundException(serverId));
		ServerDefinition.Builder builder = existing.toBuilder();
		updates.accept(builder);
		ServerDefinition updated = builder.id(existing.id())
			.createdAt(existing.createdAt())
			.updatedAt(now())
			.build();
		return this.store.update(updated);
	}

	private Optional<ServerDefinition> findByName(String name) {
		return this.store.listConfigs().stream().filter(definition -> name.equals(definition.name())).findFirst();
	}

	private String now() {
		return Instant.now(this.clock).toString();
	}

	private void serversChanged(String serverId) {
		synchronized (this.eventSink) {
			this.eventSink.tryEmitNext(new McpHostEvent.ServersChanged(serverId));
		}
	}

	private static <T> Mono<T> blocking(Callable<T> call) {
		return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
	}

}
