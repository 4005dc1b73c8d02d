/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.spec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcphost.spec.McpSchema.JSONRPCRequest;
import io.mcphost.spec.McpSchema.JSONRPCResponse;
import io.mcphost.testing.MockMcpClientTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * {@link McpClientSession}的请求关联、超时和关闭行为测试。
 *
 * @author Christian Tzolov
 */
@Timeout(10)
class McpClientSessionTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final TypeReference<String> STRING_TYPE = new TypeReference<>() {
	};

	private MockMcpClientTransport transport;

	private McpClientSession session;

	private final List<McpSchema.JSONRPCNotification> observed = new CopyOnWriteArrayList<>();

	private final List<Object> handledNotifications = new CopyOnWriteArrayList<>();

	@BeforeEach
	void setUp() {
		this.transport = new MockMcpClientTransport();
		this.session = newSession(TIMEOUT);
		this.session.connect().block();
	}

	@AfterEach
	void tearDown() {
		this.session.close();
	}

	private McpClientSession newSession(Duration timeout) {
		Map<String, McpClientSession.RequestHandler<?>> requestHandlers = Map.of(McpSchema.METHOD_PING,
				params -> Mono.just(Map.of()));
		Map<String, McpClientSession.NotificationHandler> notificationHandlers = Map.of(
				McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
				params -> Mono.fromRunnable(() -> this.handledNotifications.add(params == null ? "null" : params)));
		return new McpClientSession(timeout, this.transport, requestHandlers, notificationHandlers,
				this.observed::add);
	}

	private JSONRPCRequest awaitRequest(int index) {
		await().atMost(Duration.ofSeconds(2)).until(() -> this.transport.getSentRequests().size() > index);
		return this.transport.getSentRequests().get(index);
	}

	@Test
	void requestIdsAreIncreasingIntegers() {
		this.session.sendRequest("a", null, STRING_TYPE).subscribe();
		this.session.sendRequest("b", null, STRING_TYPE).subscribe();

		assertThat(awaitRequest(0).id()).isEqualTo(1L);
		assertThat(awaitRequest(1).id()).isEqualTo(2L);
		assertThat(awaitRequest(1).jsonrpc()).isEqualTo(McpSchema.JSONRPC_VERSION);
	}

	@Test
	void responsesArrivingOutOfOrderAreMatchedById() {
		List<Mono<String>> calls = new ArrayList<>();
		for (int i = 0; i < 5; i++) {
			calls.add(this.session.sendRequest("m" + i, Map.of("i", i), STRING_TYPE).cache());
		}
		calls.forEach(Mono::subscribe);

		for (int i = 4; i >= 0; i--) {
			JSONRPCRequest request = awaitRequest(i);
			this.transport.respond(request, "result-" + request.method());
		}

		for (int i = 0; i < 5; i++) {
			StepVerifier.create(calls.get(i)).expectNext("result-m" + i).verifyComplete();
		}
		assertThat(this.session.pendingRequestCount()).isZero();
	}

	@Test
	void responseIdAsStringIsMatched() {
		Mono<String> call = this.session.sendRequest("m", null, STRING_TYPE).cache();
		call.subscribe();
		JSONRPCRequest request = awaitRequest(0);

		this.transport.simulateIncomingMessage(
				new JSONRPCResponse(McpSchema.JSONRPC_VERSION, String.valueOf(request.id()), "ok", null));

		StepVerifier.create(call).expectNext("ok").verifyComplete();
	}

	@Test
	void errorResponseRejectsWithMcpError() {
		Mono<String> call = this.session.sendRequest("m", null, STRING_TYPE).cache();
		call.subscribe(v -> {
		}, e -> {
		});
		JSONRPCRequest request = awaitRequest(0);

		this.transport.simulateIncomingMessage(new JSONRPCResponse(McpSchema.JSONRPC_VERSION, request.id(), null,
				new JSONRPCResponse.JSONRPCError(-32000, "boom", null)));

		StepVerifier.create(call).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(McpError.class).hasMessage("boom");
			assertThat(((McpError) error).getJsonRpcError().code()).isEqualTo(-32000);
		}).verify(TIMEOUT);
	}

	@Test
	void requestWithoutResponseTimesOutAndIgnoresLateResponse() {
		this.session.close();
		this.transport = new MockMcpClientTransport();
		this.session = newSession(Duration.ofMillis(200));
		this.session.connect().block();

		StepVerifier.create(this.session.sendRequest("slow", null, STRING_TYPE))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpRequestTimeoutException.class);
				assertThat(((McpRequestTimeoutException) error).getMethod()).isEqualTo("slow");
			})
			.verify(TIMEOUT);
		assertThat(this.session.pendingRequestCount()).isZero();

		// a late response for the retired id is dropped without affecting later requests
		this.transport.respond(this.transport.getSentRequests().get(0), "late");

		Mono<String> next = this.session.sendRequest("fast", null, STRING_TYPE).cache();
		next.subscribe();
		this.transport.respond(awaitRequest(1), "on time");
		StepVerifier.create(next).expectNext("on time").verifyComplete();
	}

	@Test
	void closeFailsEveryPendingRequest() {
		Mono<String> first = this.session.sendRequest("a", null, STRING_TYPE).cache();
		Mono<String> second = this.session.sendRequest("b", null, STRING_TYPE).cache();
		first.subscribe(v -> {
		}, e -> {
		});
		second.subscribe(v -> {
		}, e -> {
		});
		awaitRequest(1);
		assertThat(this.session.pendingRequestCount()).isEqualTo(2);

		this.session.closeGracefully().block(TIMEOUT);

		StepVerifier.create(first).expectError(McpConnectionClosedException.class).verify(TIMEOUT);
		StepVerifier.create(second).expectError(McpConnectionClosedException.class).verify(TIMEOUT);
		assertThat(this.session.pendingRequestCount()).isZero();
		assertThat(this.transport.isClosed()).isTrue();

		// closing twice is harmless
		this.session.closeGracefully().block(TIMEOUT);
		assertThat(this.session.pendingRequestCount()).isZero();
	}

	@Test
	void requestAfterCloseFailsImmediately() {
		this.session.closeGracefully().block(TIMEOUT);

		StepVerifier.create(this.session.sendRequest("m", null, STRING_TYPE))
			.expectError(McpConnectionClosedException.class)
			.verify(TIMEOUT);
		assertThat(this.transport.getSentRequests()).isEmpty();
	}

	@Test
	void notificationsReachObserverAndHandler() {
		this.transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, Map.of()));
		this.transport.simulateIncomingMessage(
				new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, "notifications/unknown", null));

		await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
			assertThat(this.observed).extracting(McpSchema.JSONRPCNotification::method)
				.containsExactly(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, "notifications/unknown");
			assertThat(this.handledNotifications).hasSize(1);
		});
	}

	@Test
	void serverRequestsAreAnswered() {
		this.transport.simulateIncomingMessage(
				new JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_PING, "srv-1", null));
		this.transport.simulateIncomingMessage(
				new JSONRPCRequest(McpSchema.JSONRPC_VERSION, "sampling/createMessage", "srv-2", Map.of()));

		await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
			List<JSONRPCResponse> responses = this.transport.getSentMessages()
				.stream()
				.filter(JSONRPCResponse.class::isInstance)
				.map(JSONRPCResponse.class::cast)
				.toList();
			assertThat(responses).hasSize(2);
			JSONRPCResponse ping = responses.stream().filter(r -> "srv-1".equals(r.id())).findFirst().orElseThrow();
			assertThat(ping.error()).isNull();
			assertThat(ping.result()).isEqualTo(Map.of());
			JSONRPCResponse unknown = responses.stream()
				.filter(r -> "srv-2".equals(r.id()))
				.findFirst()
				.orElseThrow();
			assertThat(unknown.error().code()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
		});
	}

}
