package io.ragent.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ragent.core.agent.AgentSettings;
import io.ragent.core.config.model.RagentConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");

        RagentConfig config = service.load(configPath);

        assertThat(config.agent().model()).isEqualTo("granite-4.0-h-tiny");
        assertThat(config.agent().maxIterations()).isEqualTo(3);
        assertThat(config.providers().lmstudio().configured()).isTrue();
        assertThat(config.providers().openrouter().configured()).isFalse();
        assertThat(config.retrieval().urls()).hasSize(3);
        assertThat(config.retrieval().toolName()).isEqualTo("retrieve_blog_posts");
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agent": {
                "model": "gpt-4.1-mini",
                "maxIterations": 5
              },
              "providers": {
                "openai": {
                  "apiKey": "sk-test"
                }
              },
              "retrieval": {
                "topK": 2
              }
            }
            """);

        RagentConfig config = service.load(configPath);

        assertThat(config.agent().model()).isEqualTo("gpt-4.1-mini");
        assertThat(config.agent().maxIterations()).isEqualTo(5);
        assertThat(config.agent().provider()).isEqualTo("lmstudio");
        assertThat(config.providers().openai().apiKey()).isEqualTo("sk-test");
        assertThat(config.providers().openai().configured()).isTrue();
        assertThat(config.providers().openrouter().apiKey()).isEqualTo("");
        assertThat(config.retrieval().topK()).isEqualTo(2);
        assertThat(config.retrieval().chunkSize()).isEqualTo(500);
    }

    @Test
    void onboardShouldCreateThenRefreshConfig() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".ragent/config.json");

        assertThat(service.onboard(configPath, false)).isTrue();
        assertThat(Files.exists(configPath)).isTrue();

        Files.writeString(configPath, "{\"agent\":{\"model\":\"custom\"}}");
        assertThat(service.onboard(configPath, false)).isFalse();
        assertThat(service.load(configPath).agent().model()).isEqualTo("custom");
        assertThat(Files.readString(configPath)).contains("\"chunkOverlap\"");

        service.onboard(configPath, true);
        assertThat(service.load(configPath).agent().model()).isEqualTo("granite-4.0-h-tiny");
    }

    @Test
    void shouldRejectConfigThatCannotDriveARun() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");

        Files.writeString(configPath, "{\"agent\":{\"maxIterations\":0}}");
        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxIterations");

        Files.writeString(configPath, "{\"retrieval\":{\"chunkSize\":100,\"chunkOverlap\":100}}");
        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("chunkOverlap");

        Files.writeString(configPath, "{\"agent\":{\"provider\":\"anthropic\"}}");
        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("anthropic");
    }

    @Test
    void nullValuesOnDiskShouldKeepDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"agent\":{\"model\":null,\"maxTokens\":256},\"retrieval\":null}");

        RagentConfig config = service.load(configPath);

        assertThat(config.agent().model()).isEqualTo("granite-4.0-h-tiny");
        assertThat(config.agent().maxTokens()).isEqualTo(256);
        assertThat(config.retrieval().topK()).isEqualTo(4);
    }

    @Test
    void agentDefaultsShouldMapToSettings() {
        AgentSettings settings = RagentConfig.defaults().agent().toSettings();

        assertThat(settings.maxIterations()).isEqualTo(3);
        assertThat(settings.runTimeout()).isEqualTo(Duration.ZERO);
        assertThat(settings.toolParallelism()).isEqualTo(4);
    }
}
