package com.gentoro.knowledge.chunk;

public enum ChunkType {
  CONTENT,
  TABLE,
  HEADING
}
