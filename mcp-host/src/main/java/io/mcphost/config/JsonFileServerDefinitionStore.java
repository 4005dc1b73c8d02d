/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.mcphost.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把全部定义以JSON数组形式保存在单个文件中的{@link ServerDefinitionStore}。
 *
 * <p>
 * 文件不存在时视为空存储；每次修改都会重写整个文件，先写入临时文件再替换。
 * 读取时同时接受{@code id}和{@code _id}两种键名。
 */
public class JsonFileServerDefinitionStore implements ServerDefinitionStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileServerDefinitionStore.class);

	private static final TypeReference<List<ServerDefinition>> DEFINITIONS_TYPE_REF = new TypeReference<>() {
	};

	private final Path file;

	private final ObjectMapper objectMapper;

	public JsonFileServerDefinitionStore(Path file) {
		this(file, new ObjectMapper());
	}

	public JsonFileServerDefinitionStore(Path file, ObjectMapper objectMapper) {
		Assert.notNull(file, "File must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.file = file;
		this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
	}

	@Override
	public synchronized List<ServerDefinition> listConfigs() {
		return List.copyOf(readAll());
	}

	@Override
	public synchronized Optional<ServerDefinition> getConfig(String id) {
		return readAll().stream().filter(config -> config.id().equals(id)).findFirst();
	}

	@Override
	public synchronized ServerDefinition save(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		Assert.hasText(config.id(), "Config id must not be empty");
		List<ServerDefinition> configs = readAll();
		Assert.isTrue(configs.stream().noneMatch(existing -> existing.id().equals(config.id())),
				"Config already exists: " + config.id());
		configs.add(config);
		writeAll(configs);
		return config;
	}

	@Override
	public synchronized ServerDefinition update(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		List<ServerDefinition> configs = readAll();
		for (int i = 0; i < configs.size(); i++) {
			if (configs.get(i).id().equals(config.id())) {
				configs.set(i, config);
				writeAll(configs);
				return config;
			}
		}
		throw new IllegalArgumentException("Config not found: " + config.id());
	}

	@Override
	public synchronized boolean delete(ServerDefinition config) {
		Assert.notNull(config, "Config must not be null");
		List<ServerDefinition> configs = readAll();
		boolean removed = configs.removeIf(existing -> existing.id().equals(config.id()));
		if (removed) {
			writeAll(configs);
		}
		return removed;
	}

	private List<ServerDefinition> readAll() {
		if (!Files.exists(this.file)) {
			return new ArrayList<>();
		}
		try {
			List<ServerDefinition> configs = this.objectMapper.readValue(this.file.toFile(), DEFINITIONS_TYPE_REF);
			return configs != null ? new ArrayList<>(configs) : new ArrayList<>();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read server definitions from " + this.file, e);
		}
	}

	private void writeAll(List<ServerDefinition> configs) {
		try {
			Path parent = this.file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path tmp = this.file.resolveSibling(this.file.getFileName() + ".tmp");
			this.objectMapper.writeValue(tmp.toFile(), configs);
			Files.move(tmp, this.file, StandardCopyOption.REPLACE_EXISTING);
			logger.debug("Wrote {} server definitions to {}", configs.size(), this.file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write server definitions to " + this.file, e);
		}
	}

}
