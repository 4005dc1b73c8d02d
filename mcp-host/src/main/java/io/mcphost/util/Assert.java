/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.util;

import reactor.util.annotation.Nullable;

/**
 * 提供参数验证断言方法的工具类。
 *
 * @author Christian Tzolov
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * 断言对象不为 {@code null}。
	 *
	 * <pre class="code">
	 * Assert.notNull(definition, "The definition can not be null");
	 * </pre>
	 * @param object 要检查的对象
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果对象为 {@code null}
	 */
	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言给定的字符串包含有效的文本内容。
	 * <pre class="code">Assert.hasText(serverId, "'serverId' must not be empty");</pre>
	 * @param text 要检查的字符串
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果文本不包含有效的文本内容
	 */
	public static void hasText(@Nullable String text, String message) {
		if (!Utils.hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言布尔表达式为 {@code true}。
	 * @param expression 布尔表达式
	 * @param message 断言失败时使用的异常消息
	 * @throws IllegalArgumentException 如果表达式为 {@code false}
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
