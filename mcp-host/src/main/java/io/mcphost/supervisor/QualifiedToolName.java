/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import io.mcphost.util.Assert;

/**
 * 形如{@code serverName__toolName}的限定工具名。
 *
 * <p>
 * 名称在第一个{@code __}处拆分，因此工具名本身可以包含{@code __}，而服务器名不能。
 * 不含分隔符的名称是裸工具名，{@link #serverName()}为null。
 *
 * @param serverName 服务器名称，裸工具名时为null
 * @param toolName 工具名称
 */
public record QualifiedToolName(String serverName, String toolName) {

	public static final String SEPARATOR = "__";

	public QualifiedToolName {
		Assert.notNull(toolName, "Tool name must not be null");
	}

	/**
	 * 解析工具名。
	 * <pre>
	 * "A__echo"       -> (A, echo)
	 * "A__run__fast"  -> (A, run__fast)
	 * "echo"          -> (null, echo)
	 * "__echo"        -> ("", echo)
	 * </pre>
	 * @param name 调用方给出的工具名
	 * @return 解析结果
	 */
	public static QualifiedToolName parse(String name) {
		Assert.notNull(name, "Name must not be null");
		int index = name.indexOf(SEPARATOR);
		if (index < 0) {
			return new QualifiedToolName(null, name);
		}
		return new QualifiedToolName(name.substring(0, index), name.substring(index + SEPARATOR.length()));
	}

	public boolean isQualified() {
		return this.serverName != null;
	}

	@Override
	public String toString() {
		return isQualified() ? this.serverName + SEPARATOR + this.toolName : this.toolName;
	}

}
