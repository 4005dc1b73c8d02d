/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 一个MCP服务器的持久化定义：如何启动它以及在主机中如何展示它。
 *
 * <p>
 * {@code name}是调用方路由工具调用时使用的键（{@code name__tool}），在存储中唯一。
 * 缺失的{@code args}和{@code env}按空集合处理。
 *
 * @param id 唯一标识
 * @param name 唯一名称
 * @param command 可执行文件
 * @param args 有序的命令行参数
 * @param env 覆盖到主机环境之上的环境变量
 * @param enabled 是否允许启动
 * @param autoStart 主机启动时是否自动启动
 * @param description 说明
 * @param icon 图标
 * @param showInToolbar 是否显示在工具栏
 * @param toolbarOrder 工具栏中的顺序
 * @param createdAt 创建时间，ISO-8601
 * @param updatedAt 最后修改时间，ISO-8601
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerDefinition( // @formatter:off
	@JsonProperty("id") @JsonAlias("_id") String id,
	@JsonProperty("name") String name,
	@JsonProperty("command") String command,
	@JsonProperty("args") List<String> args,
	@JsonProperty("env") Map<String, String> env,
	@JsonProperty("enabled") boolean enabled,
	@JsonProperty("autoStart") boolean autoStart,
	@JsonProperty("description") String description,
	@JsonProperty("icon") String icon,
	@JsonProperty("showInToolbar") boolean showInToolbar,
	@JsonProperty("toolbarOrder") int toolbarOrder,
	@JsonProperty("createdAt") String createdAt,
	@JsonProperty("updatedAt") String updatedAt) { // @formatter:on

	public ServerDefinition {
		args = args != null ? List.copyOf(args) : List.of();
		env = env != null ? Map.copyOf(env) : Map.of();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 以当前定义为起点创建构建器，用于派生修改后的副本。
	 */
	public Builder toBuilder() {
		return new Builder().id(this.id)
			.name(this.name)
			.command(this.command)
			.args(this.args)
			.env(this.env)
			.enabled(this.enabled)
			.autoStart(this.autoStart)
			.description(this.description)
			.icon(this.icon)
			.showInToolbar(this.showInToolbar)
			.toolbarOrder(this.toolbarOrder)
			.createdAt(this.createdAt)
			.updatedAt(this.updatedAt);
	}

	public static final class Builder {

		private String id;

		private String name;

		private String command;

		private List<String> args = new ArrayList<>();

		private Map<String, String> env = new LinkedHashMap<>();

		private boolean enabled = true;

		private boolean autoStart;

		private String description;

		private String icon;

		private boolean showInToolbar;

		private int toolbarOrder;

		private String createdAt;

		private String updatedAt;

		private Builder() {
		}

		public Builder id(String id) {
			this.id = id;
			return this;
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder command(String command) {
			this.command = command;
			return this;
		}

		public Builder args(List<String> args) {
			this.args = args != null ? new ArrayList<>(args) : new ArrayList<>();
			return this;
		}

		public Builder args(String... args) {
			return args(List.of(args));
		}

		public Builder env(Map<String, String> env) {
			this.env = env != null ? new LinkedHashMap<>(env) : new LinkedHashMap<>();
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			this.env.put(key, value);
			return this;
		}

		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder autoStart(boolean autoStart) {
			this.autoStart = autoStart;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder icon(String icon) {
			this.icon = icon;
			return this;
		}

		public Builder showInToolbar(boolean showInToolbar) {
			this.showInToolbar = showInToolbar;
			return this;
		}

		public Builder toolbarOrder(int toolbarOrder) {
			this.toolbarOrder = toolbarOrder;
			return this;
		}

		public Builder createdAt(String createdAt) {
			this.createdAt = createdAt;
			return this;
		}

		public Builder updatedAt(String updatedAt) {
			this.updatedAt = updatedAt;
			return this;
		}

		public ServerDefinition build() {
			return new ServerDefinition(this.id, this.name, this.command, this.args, this.env, this.enabled,
					this.autoStart, this.description, this.icon, this.showInToolbar, this.toolbarOrder, this.createdAt,
					this.updatedAt);
		}

	}

}
