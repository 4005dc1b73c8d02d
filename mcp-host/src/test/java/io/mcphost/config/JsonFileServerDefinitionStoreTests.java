/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcphost.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileServerDefinitionStoreTests {

	@TempDir
	Path tempDir;

	private static ServerDefinition weather() {
		return ServerDefinition.builder()
			.id("w1")
			.name("weather")
			.command("npx")
			.args("-y", "@demo/weather")
			.addEnvVar("API_KEY", "secret")
			.autoStart(true)
			.icon("☀")
			.createdAt("2024-01-01T00:00:00Z")
			.build();
	}

	@Test
	void missingFileReadsAsEmpty() {
		JsonFileServerDefinitionStore store = new JsonFileServerDefinitionStore(this.tempDir.resolve("absent.json"));

		assertThat(store.listConfigs()).isEmpty();
		assertThat(store.getConfig("w1")).isEmpty();
	}

	@Test
	void savedDefinitionsSurviveReopening() {
		Path file = this.tempDir.resolve("nested/dir/servers.json");
		new JsonFileServerDefinitionStore(file).save(weather());

		JsonFileServerDefinitionStore reopened = new JsonFileServerDefinitionStore(file);

		assertThat(reopened.listConfigs()).containsExactly(weather());
		assertThat(reopened.getConfig("w1")).hasValueSatisfying(definition -> {
			assertThat(definition.args()).containsExactly("-y", "@demo/weather");
			assertThat(definition.env()).containsEntry("API_KEY", "secret");
			assertThat(definition.enabled()).isTrue();
		});
		assertThat(file.resolveSibling("servers.json.tmp")).doesNotExist();
	}

	@Test
	void saveRejectsDuplicateId() {
		JsonFileServerDefinitionStore store = new JsonFileServerDefinitionStore(this.tempDir.resolve("servers.json"));
		store.save(weather());

		assertThatThrownBy(() -> store.save(weather())).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void updateReplacesInPlaceAndRejectsUnknownId() {
		JsonFileServerDefinitionStore store = new JsonFileServerDefinitionStore(this.tempDir.resolve("servers.json"));
		store.save(ServerDefinition.builder().id("first").name("first").command("a").build());
		store.save(weather());
		store.save(ServerDefinition.builder().id("last").name("last").command("b").build());

		store.update(weather().toBuilder().command("uvx").build());

		assertThat(store.listConfigs()).extracting(ServerDefinition::id).containsExactly("first", "w1", "last");
		assertThat(store.getConfig("w1")).get().extracting(ServerDefinition::command).isEqualTo("uvx");
		assertThatThrownBy(() -> store.update(weather().toBuilder().id("ghost").build()))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void deleteReportsWhetherAnythingWasRemoved() {
		JsonFileServerDefinitionStore store = new JsonFileServerDefinitionStore(this.tempDir.resolve("servers.json"));
		store.save(weather());

		assertThat(store.delete(weather())).isTrue();
		assertThat(store.delete(weather())).isFalse();
		assertThat(store.listConfigs()).isEmpty();
	}

	@Test
	void readsLegacyUnderscoreIdAndIgnoresUnknownKeys() throws IOException {
		Path file = this.tempDir.resolve("legacy.json");
		Files.writeString(file, """
				[
				  {
				    "_id": "legacy-1",
				    "name": "files",
				    "command": "node",
				    "args": ["server.js"],
				    "enabled": true,
				    "autoStart": false,
				    "color": "blue"
				  }
				]
				""", StandardCharsets.UTF_8);

		List<ServerDefinition> definitions = new JsonFileServerDefinitionStore(file).listConfigs();

		assertThat(definitions).singleElement().satisfies(definition -> {
			assertThat(definition.id()).isEqualTo("legacy-1");
			assertThat(definition.args()).containsExactly("server.js");
			assertThat(definition.env()).isEqualTo(Map.of());
		});
	}

}
