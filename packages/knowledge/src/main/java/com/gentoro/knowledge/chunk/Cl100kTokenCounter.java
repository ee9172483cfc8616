package com.gentoro.knowledge.chunk;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * Exact token counts with the {@code cl100k_base} byte-pair encoding used by the OpenAI embedding
 * models. The encoding tables are loaded once per JVM.
 */
public class Cl100kTokenCounter implements TokenCounter {
  private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

  private final Encoding encoding = REGISTRY.getEncoding(EncodingType.CL100K_BASE);

  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) return 0;
    return encoding.countTokens(text);
  }

  @Override
  public String tail(String text, int tokens) {
    if (text == null || text.isEmpty() || tokens <= 0) return "";
    IntArrayList encoded = encoding.encode(text);
    if (tokens >= encoded.size()) return text.trim();
    IntArrayList last = new IntArrayList(tokens);
    for (int i = encoded.size() - tokens; i < encoded.size(); i++) {
      last.add(encoded.get(i));
    }
    String decoded = encoding.decode(last);
    // a cut inside a multi-byte character decodes to U+FFFD
    int start = 0;
    while (start < decoded.length() && decoded.charAt(start) == '\uFFFD') start++;
    return decoded.substring(start).trim();
  }
}
