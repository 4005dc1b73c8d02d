/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.mcphost.util.Assert;
import io.mcphost.util.Utils;

/**
 * 启动stdio服务器进程所需的参数：命令、参数和附加的环境变量。参数在构建时规范化，
 * 以逗号拼接的参数会被重新拆分，见{@link Utils#normalizeArgs(List)}。
 *
 * @author Christian Tzolov
 */
public class ServerParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private ServerParameters(String command, List<String> args, Map<String, String> env) {
		Assert.hasText(command, "The command can not be empty");
		this.command = command;
		this.args = List.copyOf(Utils.normalizeArgs(args));
		this.env = Map.copyOf(env);
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	public Map<String, String> getEnv() {
		return this.env;
	}

	@Override
	public String toString() {
		return "ServerParameters{command='" + this.command + "', args=" + this.args + ", env=" + this.env.keySet()
				+ "}";
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private Builder(String command) {
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.notNull(key, "The key can not be null");
			Assert.notNull(value, "The value can not be null");
			this.env.put(key, value);
			return this;
		}

		public Builder env(Map<String, String> env) {
			if (!Utils.isEmpty(env)) {
				env.forEach((key, value) -> {
					if (key != null && value != null) {
						this.env.put(key, value);
					}
				});
			}
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env);
		}

	}

}
