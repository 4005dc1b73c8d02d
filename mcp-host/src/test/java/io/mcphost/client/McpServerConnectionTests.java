/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcphost.client.transport.ServerParameters;
import io.mcphost.config.ServerDefinition;
import io.mcphost.spec.McpClientTransport;
import io.mcphost.spec.McpConnectionClosedException;
import io.mcphost.spec.McpError;
import io.mcphost.spec.McpHandshakeException;
import io.mcphost.spec.McpRequestTimeoutException;
import io.mcphost.spec.McpSchema;
import io.mcphost.spec.McpSchema.JSONRPCMessage;
import io.mcphost.spec.McpSchema.JSONRPCRequest;
import io.mcphost.spec.McpSpawnException;
import io.mcphost.testing.MockMcpClientTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 使用内存传输层对{@link McpServerConnection}的握手、发现和生命周期进行测试。
 */
@Timeout(15)
class McpServerConnectionTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final ServerDefinition DEFINITION = ServerDefinition.builder()
		.id("srv")
		.name("fake")
		.command("fake-server")
		.build();

	/**
	 * 按{@code capabilities}应答握手和列表请求的假服务器。
	 */
	private static BiConsumer<MockMcpClientTransport, JSONRPCMessage> fakeServer(Map<String, Object> capabilities,
			List<String> toolNames) {
		return (transport, message) -> {
			if (!(message instanceof JSONRPCRequest request)) {
				return;
			}
			switch (request.method()) {
				case McpSchema.METHOD_INITIALIZE -> transport.respond(request, Map.of("protocolVersion",
						McpSchema.PROTOCOL_VERSION, "capabilities", capabilities, "serverInfo",
						Map.of("name", "fake", "version", "1.0")));
				case McpSchema.METHOD_TOOLS_LIST -> transport.respond(request,
						Map.of("tools", toolNames.stream().map(name -> Map.of("name", name)).toList()));
				case McpSchema.METHOD_RESOURCES_LIST -> transport.respond(request,
						Map.of("resources", List.of(Map.of("uri", "file:///a.txt", "name", "a.txt"))));
				case McpSchema.METHOD_TOOLS_CALL -> {
					Map<String, Object> params = transport.unmarshalFrom(request.params(),
							new TypeReference<Map<String, Object>>() {
							});
					if (!"silent".equals(params.get("name"))) {
						transport.respond(request,
								Map.of("content", List.of(Map.of("type", "text", "text", "called " + params.get("name")))));
					}
				}
				default -> {
				}
			}
		};
	}

	private static McpServerConnection connectionWith(MockMcpClientTransport transport) {
		return connectionWith(transport, McpConnectionSpec.defaults());
	}

	private static McpServerConnection connectionWith(MockMcpClientTransport transport, McpConnectionSpec spec) {
		return new McpServerConnection(DEFINITION, spec) {
			@Override
			protected McpClientTransport createTransport(ServerParameters params) {
				return transport;
			}
		};
	}

	@Test
	void handshakeThenDiscoveryOfAdvertisedCapabilities() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of(), "resources", Map.of()), List.of("echo", "sum")));
		McpServerConnection connection = connectionWith(transport);
		List<McpConnectionEvent> events = new CopyOnWriteArrayList<>();
		connection.events().subscribe(events::add);

		StepVerifier.create(connection.connect()).verifyComplete();

		assertThat(connection.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(connection.serverInfo().name()).isEqualTo("fake");
		assertThat(connection.tools()).extracting(McpSchema.Tool::name).containsExactly("echo", "sum");
		assertThat(connection.resources()).extracting(McpSchema.Resource::uri).containsExactly("file:///a.txt");
		assertThat(events).first().isInstanceOf(McpConnectionEvent.Connected.class);

		List<JSONRPCMessage> sent = transport.getSentMessages();
		JSONRPCRequest initialize = (JSONRPCRequest) sent.get(0);
		assertThat(initialize.method()).isEqualTo(McpSchema.METHOD_INITIALIZE);
		McpSchema.InitializeRequest params = transport.unmarshalFrom(initialize.params(),
				new TypeReference<McpSchema.InitializeRequest>() {
				});
		assertThat(params.protocolVersion()).isEqualTo("2024-11-05");
		assertThat(params.clientInfo()).isEqualTo(McpConnectionSpec.DEFAULT_CLIENT_INFO);
		assertThat(sent.get(1)).isInstanceOfSatisfying(McpSchema.JSONRPCNotification.class,
				n -> assertThat(n.method()).isEqualTo(McpSchema.METHOD_NOTIFICATION_INITIALIZED));
	}

	@Test
	void listsAreOnlyRequestedWhenAdvertised() {
		MockMcpClientTransport transport = new MockMcpClientTransport(fakeServer(Map.of(), List.of("echo")));
		McpServerConnection connection = connectionWith(transport);

		connection.connect().block(TIMEOUT);

		assertThat(connection.tools()).isEmpty();
		assertThat(transport.getSentRequests()).extracting(JSONRPCRequest::method)
			.containsExactly(McpSchema.METHOD_INITIALIZE);
	}

	@Test
	void concurrentConnectCallsShareOneHandshake() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of()), List.of("echo")));
		AtomicInteger transports = new AtomicInteger();
		McpServerConnection connection = new McpServerConnection(DEFINITION) {
			@Override
			protected McpClientTransport createTransport(ServerParameters params) {
				transports.incrementAndGet();
				return transport;
			}
		};

		Mono.when(connection.connect(), connection.connect(), connection.connect()).block(TIMEOUT);
		connection.connect().block(TIMEOUT);

		assertThat(transports).hasValue(1);
		assertThat(transport.getSentRequests()).filteredOn(r -> r.method().equals(McpSchema.METHOD_INITIALIZE))
			.hasSize(1);
	}

	@Test
	void missingInitializeResultIsHandshakeFailure() {
		MockMcpClientTransport transport = new MockMcpClientTransport((t, message) -> {
			if (message instanceof JSONRPCRequest request) {
				t.respond(request, null);
			}
		});
		McpServerConnection connection = connectionWith(transport);

		StepVerifier.create(connection.connect()).expectError(McpHandshakeException.class).verify(TIMEOUT);

		assertThat(connection.state()).isEqualTo(ConnectionState.FAILED);
		assertThat(transport.isClosed()).isTrue();
		StepVerifier.create(connection.connect()).expectError(McpConnectionClosedException.class).verify(TIMEOUT);
	}

	@Test
	void malformedInitializeResultIsHandshakeFailure() {
		MockMcpClientTransport transport = new MockMcpClientTransport((t, message) -> {
			if (message instanceof JSONRPCRequest request) {
				t.respond(request, List.of("not", "an", "object"));
			}
		});
		McpServerConnection connection = connectionWith(transport);

		StepVerifier.create(connection.connect()).expectError(McpHandshakeException.class).verify(TIMEOUT);
		assertThat(connection.state()).isEqualTo(ConnectionState.FAILED);
	}

	@Test
	void handshakeTimeoutFailsConnection() {
		MockMcpClientTransport transport = new MockMcpClientTransport();
		McpServerConnection connection = connectionWith(transport,
				McpConnectionSpec.builder().requestTimeout(Duration.ofMillis(200)).build());

		StepVerifier.create(connection.connect())
			.expectError(McpRequestTimeoutException.class)
			.verify(TIMEOUT);
		assertThat(connection.state()).isEqualTo(ConnectionState.FAILED);
		assertThat(connection.pendingRequestCount()).isZero();
	}

	@Test
	void processExitDuringHandshakeFailsImmediately() {
		MockMcpClientTransport transport = new MockMcpClientTransport((t, message) -> {
			if (message instanceof JSONRPCRequest) {
				t.simulateProcessExit();
			}
		});
		McpServerConnection connection = connectionWith(transport);

		StepVerifier.create(connection.connect()).expectError(McpConnectionClosedException.class).verify(TIMEOUT);
		assertThat(connection.state()).isEqualTo(ConnectionState.FAILED);
	}

	@Test
	void emptyCommandIsSpawnFailure() {
		McpServerConnection connection = new McpServerConnection(DEFINITION.toBuilder().command(" ").build());

		StepVerifier.create(connection.connect()).expectError(McpSpawnException.class).verify(TIMEOUT);
		assertThat(connection.state()).isEqualTo(ConnectionState.FAILED);
	}

	@Test
	void operationsRequireConnectedState() {
		McpServerConnection connection = connectionWith(new MockMcpClientTransport());

		StepVerifier.create(connection.callTool("echo", Map.of())).expectError(McpError.class).verify(TIMEOUT);
		StepVerifier.create(connection.readResource("file:///a.txt")).expectError(McpError.class).verify(TIMEOUT);
		StepVerifier.create(connection.sendNotification("notifications/x", null)).verifyComplete();
	}

	@Test
	void disconnectFailsPendingCallsAndIsIdempotent() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of()), List.of("silent")));
		McpServerConnection connection = connectionWith(transport);
		List<McpConnectionEvent> events = new CopyOnWriteArrayList<>();
		connection.events().subscribe(events::add);
		connection.connect().block(TIMEOUT);

		Mono<McpSchema.CallToolResult> call = connection.callTool("silent", Map.of()).cache();
		call.subscribe(r -> {
		}, e -> {
		});
		await().atMost(TIMEOUT).until(() -> connection.pendingRequestCount() == 1);

		connection.disconnect().block(TIMEOUT);
		connection.disconnect().block(TIMEOUT);

		StepVerifier.create(call).expectError(McpConnectionClosedException.class).verify(TIMEOUT);
		assertThat(connection.pendingRequestCount()).isZero();
		assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
		assertThat(connection.tools()).isEmpty();
		assertThat(transport.isClosed()).isTrue();
		assertThat(events).filteredOn(McpConnectionEvent.Disconnected.class::isInstance).hasSize(1);
	}

	@Test
	void processExitWhileConnectedEmitsDisconnected() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of()), List.of("echo")));
		McpServerConnection connection = connectionWith(transport);
		List<McpConnectionEvent> events = new CopyOnWriteArrayList<>();
		connection.events().subscribe(events::add);
		connection.connect().block(TIMEOUT);

		transport.simulateProcessExit();

		await().atMost(TIMEOUT).untilAsserted(() -> {
			assertThat(connection.state()).isEqualTo(ConnectionState.DISCONNECTED);
			assertThat(events).last().isInstanceOf(McpConnectionEvent.Disconnected.class);
		});
		assertThat(connection.status().connected()).isFalse();
	}

	@Test
	void toolsListChangedRefreshesCache() {
		List<String> toolNames = new CopyOnWriteArrayList<>(List.of("echo"));
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of("listChanged", true)), toolNames));
		McpServerConnection connection = connectionWith(transport);
		List<McpConnectionEvent> events = new CopyOnWriteArrayList<>();
		connection.events().subscribe(events::add);
		connection.connect().block(TIMEOUT);
		List<McpSchema.Tool> before = connection.tools();

		toolNames.add("extra");
		transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null));

		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(connection.tools()).extracting(McpSchema.Tool::name)
				.containsExactly("echo", "extra"));
		assertThat(before).extracting(McpSchema.Tool::name).containsExactly("echo");
		assertThat(events).anySatisfy(event -> assertThat(event).isInstanceOf(McpConnectionEvent.ToolsUpdated.class));
		assertThat(events).anySatisfy(event -> assertThat(event).isInstanceOfSatisfying(
				McpConnectionEvent.Notification.class,
				n -> assertThat(n.method()).isEqualTo(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED)));
	}

	@Test
	void resourceUpdatedIsForwardedAsEvent() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("resources", Map.of()), List.of()));
		McpServerConnection connection = connectionWith(transport);
		List<McpConnectionEvent> events = new CopyOnWriteArrayList<>();
		connection.events().subscribe(events::add);
		connection.connect().block(TIMEOUT);

		transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED, Map.of("uri", "file:///a.txt")));

		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(events).anySatisfy(event -> assertThat(event).isInstanceOfSatisfying(
					McpConnectionEvent.ResourceUpdated.class,
					updated -> assertThat(updated.uri()).isEqualTo("file:///a.txt"))));
	}

	@Test
	void callToolSendsNameAndArguments() {
		MockMcpClientTransport transport = new MockMcpClientTransport(
				fakeServer(Map.of("tools", Map.of()), List.of("echo")));
		McpServerConnection connection = connectionWith(transport);
		connection.connect().block(TIMEOUT);

		McpSchema.CallToolResult result = connection.callTool("echo", Map.of("text", "hi")).block(TIMEOUT);

		assertThat(result.content()).singleElement()
			.isInstanceOfSatisfying(McpSchema.TextContent.class, text -> assertThat(text.text()).isEqualTo("called echo"));
		JSONRPCRequest call = transport.getSentRequests().get(transport.getSentRequests().size() - 1);
		assertThat(call.method()).isEqualTo(McpSchema.METHOD_TOOLS_CALL);
		assertThat(transport.unmarshalFrom(call.params(), new TypeReference<McpSchema.CallToolRequest>() {
		}))
			.isEqualTo(new McpSchema.CallToolRequest("echo", Map.of("text", "hi")));
	}

}
