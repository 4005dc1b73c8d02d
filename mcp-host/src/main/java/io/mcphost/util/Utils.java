/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.mcphost.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法。
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * 检查给定的{@code String}是否包含实际的<em>文本</em>。
	 * <p>
	 * 更具体地说，如果{@code String}不为{@code null}，其长度大于0，
	 * 并且至少包含一个非空白字符，则此方法返回{@code true}。
	 * @param str 要检查的{@code String}（可能为{@code null}）
	 * @return 如果{@code String}包含非空白字符则返回{@code true}
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 如果提供的Collection为{@code null}或为空，则返回{@code true}。
	 * @param collection 要检查的Collection
	 * @return 给定的Collection是否为空
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * 如果提供的Map为{@code null}或为空，则返回{@code true}。
	 * @param map 要检查的Map
	 * @return 给定的Map是否为空
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * 规范化进程参数。经过shell层或表单编辑后，一个参数可能是以逗号分隔的列表
	 * （例如 {@code "-y,@scope/server"}），此方法将其重新拆分为独立的参数，
	 * 去除空白并丢弃空项。不含逗号的参数保持原样。
	 * @param args 原始参数，可能为{@code null}
	 * @return 规范化后的新参数列表，绝不为{@code null}
	 */
	public static List<String> normalizeArgs(@Nullable List<String> args) {
		List<String> normalized = new ArrayList<>();
		if (isEmpty(args)) {
			return normalized;
		}
		for (String arg : args) {
			if (arg == null) {
				continue;
			}
			if (arg.indexOf(',') < 0) {
				normalized.add(arg);
				continue;
			}
			for (String part : arg.split(",")) {
				String trimmed = part.trim();
				if (!trimmed.isEmpty()) {
					normalized.add(trimmed);
				}
			}
		}
		return normalized;
	}

}
