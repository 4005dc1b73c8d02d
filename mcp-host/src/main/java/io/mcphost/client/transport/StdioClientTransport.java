/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcphost.spec.McpClientTransport;
import io.mcphost.spec.McpSchema;
import io.mcphost.spec.McpSchema.JSONRPCMessage;
import io.mcphost.spec.McpSpawnException;
import io.mcphost.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * MCP Stdio传输的实现，使用标准输入/输出流与服务器进程通信。
 * 消息以换行符分隔的JSON-RPC格式通过stdin/stdout交换，
 * stderr只作为诊断日志，从不当作协议数据解析。
 *
 * <p>
 * 传输层独占服务器进程及其三个流。无论是正常关闭、进程崩溃还是启动与关闭竞争，
 * 进程都只会在{@link #closeGracefully()}中被释放。
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public class StdioClientTransport implements McpClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioClientTransport.class);

	private static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);

	private final Sinks.Many<JSONRPCMessage> inboundSink;

	private final Sinks.Many<JSONRPCMessage> outboundSink;

	private final Sinks.Many<String> errorSink;

	/** 进程退出或stdout结束时发出的信号 */
	private final Sinks.Empty<Void> closeSink = Sinks.empty();

	/** 正在通信的服务器进程 */
	private volatile Process process;

	private final ObjectMapper objectMapper;

	/** 用于处理来自服务器进程的入站消息的调度器 */
	private final Scheduler inboundScheduler;

	/** 用于处理发送到服务器进程的出站消息的调度器 */
	private final Scheduler outboundScheduler;

	/** 用于处理来自服务器进程的错误消息的调度器 */
	private final Scheduler errorScheduler;

	/** 用于配置和启动服务器进程的参数 */
	private final ServerParameters params;

	/** 等待进程响应TERM信号的时间，超时后强制结束 */
	private final Duration closeTimeout;

	private volatile boolean isClosing = false;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private Consumer<String> stdErrorHandler = error -> logger.info("STDERR Message received: {}", error);

	/**
	 * 使用指定参数和默认ObjectMapper创建新的StdioClientTransport。
	 * @param params 用于配置服务器进程的参数
	 */
	public StdioClientTransport(ServerParameters params) {
		this(params, new ObjectMapper());
	}

	public StdioClientTransport(ServerParameters params, ObjectMapper objectMapper) {
		this(params, objectMapper, DEFAULT_CLOSE_TIMEOUT);
	}

	/**
	 * 使用指定参数和ObjectMapper创建新的StdioClientTransport。
	 * @param params 用于配置服务器进程的参数
	 * @param objectMapper 用于JSON序列化/反序列化的ObjectMapper
	 * @param closeTimeout 关闭时等待进程退出的时间
	 */
	public StdioClientTransport(ServerParameters params, ObjectMapper objectMapper, Duration closeTimeout) {
		Assert.notNull(params, "The params can not be null");
		Assert.notNull(objectMapper, "The ObjectMapper can not be null");
		Assert.notNull(closeTimeout, "The closeTimeout can not be null");

		this.inboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.outboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.errorSink = Sinks.many().unicast().onBackpressureBuffer();

		this.params = params;
		this.objectMapper = objectMapper;
		this.closeTimeout = closeTimeout;

		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "outbound");
		this.errorScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "error");
	}

	/**
	 * 启动服务器进程并初始化消息处理流。此方法使用配置的命令、参数和环境
	 * 设置进程，然后启动入站、出站和错误处理线程。
	 * @return 进程启动后完成的Mono；进程无法启动时以{@link McpSpawnException}结束
	 */
	@Override
	public Mono<Void> connect(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> handler) {
		return Mono.<Void>fromRunnable(() -> {
			handleIncomingMessages(handler);
			handleIncomingErrors();

			List<String> fullCommand = buildCommand();

			ProcessBuilder processBuilder = this.getProcessBuilder();
			processBuilder.command(fullCommand);
			processBuilder.environment().putAll(this.params.getEnv());

			logger.info("Starting server process: {}", String.join(" ", fullCommand));

			Process started;
			try {
				started = processBuilder.start();
			}
			catch (IOException | RuntimeException e) {
				throw new McpSpawnException("Failed to start process with command: " + fullCommand, e);
			}

			if (this.isClosing) {
				// close() won the race against start(); nothing else owns this process
				started.destroyForcibly();
				throw new McpSpawnException("Transport closed while starting process: " + fullCommand, null);
			}
			this.process = started;

			started.onExit().thenAccept(exited -> {
				if (!this.isClosing) {
					logger.info("Server process {} exited with code {}", exited.pid(), exited.exitValue());
				}
				this.closeSink.tryEmitEmpty();
			});

			startInboundProcessing();
			startOutboundProcessing();
			startErrorProcessing();
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private List<String> buildCommand() {
		List<String> fullCommand = new ArrayList<>();
		if (isWindows()) {
			// npx, uvx and friends are .cmd scripts on Windows and need the shell
			fullCommand.add("cmd.exe");
			fullCommand.add("/c");
		}
		fullCommand.add(this.params.getCommand());
		fullCommand.addAll(this.params.getArgs());
		return fullCommand;
	}

	private static boolean isWindows() {
		return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
	}

	/**
	 * 创建并返回一个新的ProcessBuilder实例。受保护以允许在测试中重写。
	 * @return 一个新的ProcessBuilder实例
	 */
	protected ProcessBuilder getProcessBuilder() {
		return new ProcessBuilder();
	}

	/**
	 * 设置处理服务器stderr输出的处理器。每一行调用一次。
	 * @param errorHandler 处理stderr行的消费者
	 */
	public void setStdErrorHandler(Consumer<String> errorHandler) {
		Assert.notNull(errorHandler, "The errorHandler can not be null");
		this.stdErrorHandler = errorHandler;
	}

	@Override
	public Mono<Void> onClose() {
		return this.closeSink.asMono();
	}

	/**
	 * 启动从进程错误流读取的错误处理线程。
	 */
	private void startErrorProcessing() {
		this.errorScheduler.schedule(() -> {
			try (BufferedReader processErrorReader = new BufferedReader(
					new InputStreamReader(this.process.getErrorStream(), StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = processErrorReader.readLine()) != null) {
					if (!this.errorSink.tryEmitNext(line).isSuccess()) {
						if (!this.isClosing) {
							logger.error("Failed to emit error message");
						}
						break;
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from error stream", e);
				}
			}
			finally {
				this.errorSink.tryEmitComplete();
			}
		});
	}

	private void handleIncomingMessages(Function<Mono<JSONRPCMessage>, Mono<JSONRPCMessage>> inboundMessageHandler) {
		this.inboundSink.asFlux()
			.concatMap(message -> Mono.just(message).transform(inboundMessageHandler))
			.onErrorContinue((error, message) -> logger.error("Error handling inbound message: {}", message, error))
			.subscribe();
	}

	private void handleIncomingErrors() {
		this.errorSink.asFlux().subscribe(line -> this.stdErrorHandler.accept(line));
	}

	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		Sinks.EmitResult result;
		// unicast sinks reject concurrent emitters with FAIL_NON_SERIALIZED
		synchronized (this.outboundSink) {
			result = this.outboundSink.tryEmitNext(message);
		}
		if (result.isSuccess()) {
			return Mono.empty();
		}
		else {
			return Mono.error(new RuntimeException("Failed to enqueue message: " + result));
		}
	}

	/**
	 * 启动从进程输入流读取JSON-RPC消息的入站处理线程。每一行是一条消息；
	 * 无法解析的行只记录日志并丢弃，读取继续进行。
	 */
	private void startInboundProcessing() {
		this.inboundScheduler.schedule(() -> {
			try (BufferedReader processReader = new BufferedReader(
					new InputStreamReader(this.process.getInputStream(), StandardCharsets.UTF_8))) {
				String line;
				while (!this.isClosing && (line = processReader.readLine()) != null) {
					String trimmed = line.trim();
					if (trimmed.isEmpty()) {
						continue;
					}
					JSONRPCMessage message;
					try {
						message = McpSchema.deserializeJsonRpcMessage(this.objectMapper, trimmed);
					}
					catch (Exception e) {
						logger.error("Failed to parse message, dropping line: {}", trimmed, e);
						continue;
					}
					if (!this.inboundSink.tryEmitNext(message).isSuccess()) {
						if (!this.isClosing) {
							logger.error("Failed to enqueue inbound message: {}", message);
						}
						break;
					}
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error reading from input stream", e);
				}
			}
			finally {
				this.inboundSink.tryEmitComplete();
				this.closeSink.tryEmitEmpty();
			}
		});
	}

	/**
	 * 启动将JSON-RPC消息写入进程输出流的出站处理线程。
	 * 消息被序列化为单行JSON并以换行符作为分隔符写入，按发出顺序写出。
	 */
	private void startOutboundProcessing() {
		this.handleOutbound(messages -> messages
			// writes come from caller threads; the actual writing happens on a dedicated thread
			.publishOn(this.outboundScheduler)
			.handle((message, s) -> {
				if (message != null && !this.isClosing) {
					try {
						String jsonMessage = this.objectMapper.writeValueAsString(message);
						var os = this.process.getOutputStream();
						synchronized (os) {
							os.write(jsonMessage.getBytes(StandardCharsets.UTF_8));
							os.write('\n');
							os.flush();
						}
						s.next(message);
					}
					catch (IOException e) {
						s.error(new RuntimeException(e));
					}
				}
			}));
	}

	private void completeOutbound() {
		synchronized (this.outboundSink) {
			this.outboundSink.tryEmitComplete();
		}
	}

	protected void handleOutbound(Function<Flux<JSONRPCMessage>, Flux<JSONRPCMessage>> outboundConsumer) {
		outboundConsumer.apply(this.outboundSink.asFlux()).doOnComplete(() -> {
			this.isClosing = true;
			completeOutbound();
		}).doOnError(e -> {
			if (!this.isClosing) {
				logger.error("Error in outbound processing", e);
				this.isClosing = true;
				completeOutbound();
			}
		}).subscribe();
	}

	/**
	 * 优雅地关闭传输层：停止接受新消息，向进程发送TERM信号并等待其退出，
	 * 超过关闭超时仍未退出则强制结束，最后释放调度器。重复调用是安全的。
	 * @return 传输层关闭后完成的Mono
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			if (!this.closed.compareAndSet(false, true)) {
				return Mono.empty();
			}
			this.isClosing = true;
			logger.debug("Initiating graceful shutdown");

			this.inboundSink.tryEmitComplete();
			completeOutbound();
			this.errorSink.tryEmitComplete();

			Process current = this.process;
			if (current == null) {
				logger.debug("Process not started");
				this.closeSink.tryEmitEmpty();
				return Mono.<Void>fromRunnable(this::disposeSchedulers);
			}

			logger.debug("Sending TERM to process {}", current.pid());
			current.destroy();
			return Mono.fromFuture(current.onExit())
				.timeout(this.closeTimeout, Mono.defer(() -> {
					logger.warn("Process {} did not exit within {} ms, killing it", current.pid(),
							this.closeTimeout.toMillis());
					current.destroyForcibly();
					return Mono.fromFuture(current.onExit());
				}))
				.doOnNext(exited -> logger.debug("Process {} terminated with code {}", exited.pid(),
						exited.exitValue()))
				.then(Mono.<Void>fromRunnable(() -> {
					this.closeSink.tryEmitEmpty();
					this.disposeSchedulers();
					logger.debug("Graceful shutdown completed");
				}));
		}).then().subscribeOn(Schedulers.boundedElastic());
	}

	private void disposeSchedulers() {
		// reader threads are blocked on readLine and only return once the streams close
		this.inboundScheduler.dispose();
		this.errorScheduler.dispose();
		this.outboundScheduler.dispose();
	}

	/**
	 * 服务器进程是否仍在运行。
	 * @return 进程已启动且尚未退出时返回true
	 */
	public boolean isProcessAlive() {
		Process current = this.process;
		return current != null && current.isAlive();
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
