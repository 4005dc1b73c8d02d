/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.supervisor;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mcphost.spec.McpSchema;

/**
 * 试连接一个候选服务器定义的结果。失败不会以异常形式出现，而是体现在
 * {@code success}和{@code error}字段中。
 *
 * @param success 是否连接成功
 * @param message 面向用户的说明，失败时为失败原因
 * @param serverInfo 服务器报告的实现信息，失败时为null
 * @param toolCount 发现的工具数量
 * @param resourceCount 发现的资源数量
 * @param tools 工具预览
 * @param error 失败异常的描述（类型和消息），成功时为null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerTestResult( // @formatter:off
	boolean success,
	String message,
	McpSchema.Implementation serverInfo,
	int toolCount,
	int resourceCount,
	List<ToolPreview> tools,
	String error) { // @formatter:on

	public record ToolPreview(String name, String description) {
	}

	public static ServerTestResult success(McpSchema.Implementation serverInfo, List<McpSchema.Tool> tools,
			int resourceCount) {
		List<ToolPreview> previews = tools.stream().map(tool -> new ToolPreview(tool.name(), tool.description())).toList();
		return new ServerTestResult(true, "Connection successful", serverInfo, tools.size(), resourceCount, previews,
				null);
	}

	public static ServerTestResult failure(Throwable error) {
		String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		return new ServerTestResult(false, reason, null, 0, 0, List.of(), error.toString());
	}

}
