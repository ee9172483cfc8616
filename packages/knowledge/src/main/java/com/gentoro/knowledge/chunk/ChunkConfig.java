package com.gentoro.knowledge.chunk;

import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.ValidationException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Token limits for {@link HierarchicalChunker}. {@code chunkSizeMin} is advisory: trailing content
 * of a section is emitted even when shorter.
 */
public record ChunkConfig(int chunkSizeMin, int chunkSizeMax, int chunkOverlap) {
  public static final int DEFAULT_MIN = 200;
  public static final int DEFAULT_MAX = 800;
  public static final int DEFAULT_OVERLAP = 100;

  public ChunkConfig {
    if (chunkSizeMin <= 0 || chunkSizeMax < chunkSizeMin) {
      throw new ValidationException(
          "Invalid chunk sizes: min=%d max=%d".formatted(chunkSizeMin, chunkSizeMax));
    }
    if (chunkOverlap < 0 || chunkOverlap >= chunkSizeMax) {
      throw new ValidationException(
          "Invalid chunk overlap %d for max %d".formatted(chunkOverlap, chunkSizeMax));
    }
  }

  public static ChunkConfig defaults() {
    return new ChunkConfig(DEFAULT_MIN, DEFAULT_MAX, DEFAULT_OVERLAP);
  }

  /** Reads {@code chunking.size.min}, {@code chunking.size.max} and {@code chunking.overlap}. */
  public static ChunkConfig fromConfiguration(Configuration cfg) {
    if (cfg == null) return defaults();
    try {
      return new ChunkConfig(
          cfg.getInt("chunking.size.min", DEFAULT_MIN),
          cfg.getInt("chunking.size.max", DEFAULT_MAX),
          cfg.getInt("chunking.overlap", DEFAULT_OVERLAP));
    } catch (ConversionException | ValidationException e) {
      throw new ConfigException("Invalid chunking configuration: " + e.getMessage(), e);
    }
  }
}
