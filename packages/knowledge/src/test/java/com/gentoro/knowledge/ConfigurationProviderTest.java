package com.gentoro.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.chunk.ChunkConfig;
import com.gentoro.knowledge.coverage.CoverageConfig;
import com.gentoro.knowledge.exception.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("Default location loads application.yaml from the classpath")
  void defaults() {
    ConfigurationProvider provider = new ConfigurationProvider();

    assertEquals(ChunkConfig.defaults(), ChunkConfig.fromConfiguration(provider.config()));
    assertEquals(CoverageConfig.defaults(), CoverageConfig.fromConfiguration(provider.config()));
    assertEquals("cl100k", provider.config().getString("chunking.tokenizer"));
  }

  @Test
  @DisplayName("classpath: locations override defaults")
  void classpathLocation() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:test-config.yaml");

    assertEquals(new ChunkConfig(20, 60, 10), ChunkConfig.fromConfiguration(provider.config()));
    CoverageConfig coverage = CoverageConfig.fromConfiguration(provider.config());
    assertEquals(0.6, coverage.similarityThreshold());
    assertEquals(0.3, coverage.highConfidenceThreshold(), "unset keys keep defaults");
    assertEquals(5, coverage.nResults());
  }

  @Test
  @DisplayName("A missing classpath resource yields an empty configuration")
  void missingResource() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:nope.yaml");
    assertTrue(provider.config().isEmpty());
  }

  @Test
  @DisplayName("File paths and file: URIs are loaded; missing files fail")
  void files(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("knowledge.yaml");
    Files.writeString(file, "chunking:\n  overlap: 50\n");

    assertEquals(
        50, new ConfigurationProvider(file.toString()).config().getInt("chunking.overlap"));
    assertEquals(
        50, new ConfigurationProvider(file.toUri().toString()).config().getInt("chunking.overlap"));
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("missing.yaml").toString()));
  }

  @Test
  @DisplayName("Inconsistent chunk sizes are reported as configuration errors")
  void invalidChunking() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:invalid-chunking.yaml");
    assertThrows(ConfigException.class, () -> ChunkConfig.fromConfiguration(provider.config()));
  }
}
