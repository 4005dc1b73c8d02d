/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.mcphost.util.Assert;

/**
 * 保存在内存中的{@link ServerDefinitionStore}，用于嵌入式场景和测试。
 */
public class InMemoryServerDefinitionStore implements ServerDefinitionStore {

	private final Map<String, ServerDefinition> configs = new LinkedHashMap<>();

	public InMemoryServerDefinitionStore() {
	}

	public InMemoryServerDefinitionStore(List<ServerDefinition> initial) {
		Assert.notNull(initial, "Initial configs must not be null");
		initial.forEach(this::save);
	}

	@Override
	public synchronized List<ServerDefinition> listConfigs() {
		return List.copyOf(this.configs.values());
	}

	@Override
	public synchronized Optional<ServerDefinition> getConfig(String id) {
		return Optional.ofNullable(this.configs.get(id));
	}

	@Override
	public synchronized ServerDefinition save(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		Assert.hasText(config.id(), "Config id must not be empty");
		Assert.isTrue(!this.configs.containsKey(config.id()), "Config already exists: " + config.id());
		this.configs.put(config.id(), config);
		return config;
	}

	@Override
	public synchronized ServerDefinition update(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		Assert.isTrue(this.configs.containsKey(config.id()), "Config not found: " + config.id());
		this.configs.put(config.id(), config);
		return config;
	}

	@Override
	public synchronized boolean delete(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		return this.configs.remove(config.id()) != null;
	}

}
