package com.gentoro.knowledge.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void errorDetailsKeepCodeAndContext() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new CollaboratorException("semantic-search", "timed out"));

    assertEquals("CollaboratorException", details.type);
    assertEquals("timed out", details.message);
    assertEquals(KnowledgeErrorCode.COLLABORATOR_ERROR, details.code);
    assertEquals(Map.of("collaborator", "semantic-search"), details.context);
    assertNotNull(details.timestamp);

    ErrorDetails plain = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(KnowledgeErrorCode.UNKNOWN, plain.code);
    assertEquals("", plain.message);
  }

  @Test
  void unwrapStripsExecutorWrappers() {
    IllegalArgumentException root = new IllegalArgumentException("bad");
    assertSame(
        root,
        ExceptionUtil.unwrap(new ExecutionException(new CompletionException(root))));
    assertSame(root, ExceptionUtil.unwrap(root));
  }

  @Test
  void describeFallsBackToClassName() {
    assertEquals("bad", ExceptionUtil.describe(new IllegalArgumentException("bad")));
    assertEquals("NullPointerException", ExceptionUtil.describe(new NullPointerException()));
    assertEquals("", ExceptionUtil.describe(null));
  }

  @Test
  void compactStackTrace() {
    Exception e = new Exception("x");
    String trace = ExceptionUtil.formatCompactStackTrace(e, 2);

    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace ("));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void subclassesPickTheirCodes() {
    assertEquals(KnowledgeErrorCode.INVALID_ARGUMENT, new ValidationException("x").getCode());
    assertEquals(KnowledgeErrorCode.CONFIGURATION_ERROR, new ConfigException("x").getCode());
    assertEquals(KnowledgeErrorCode.INDEX_NOT_READY, new IndexNotReadyException("x").getCode());
    assertEquals(KnowledgeErrorCode.IO_ERROR, new IoException("x").getCode());
    assertTrue(new ValidationException("x").toString().contains("code=INVALID_ARGUMENT"));
  }
}
