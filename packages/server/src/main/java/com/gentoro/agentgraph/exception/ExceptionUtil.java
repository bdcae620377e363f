package com.gentoro.agentgraph.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is an {@link
   * AgentGraphException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof AgentGraphException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(), describe(ex), ex.getCode(), ex.getContext());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), describe(t), AgentGraphErrorCode.UNKNOWN, null);
  }

  /**
   * Message of the throwable followed by the messages of its causes, joined with {@code ": "}.
   * Causes without a message contribute their simple class name.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder(safeMessage(t));
    Throwable cause = t.getCause();
    int depth = 0;
    while (cause != null && cause != t && depth++ < 5) {
      String msg = safeMessage(cause);
      if (!msg.isEmpty() && sb.indexOf(msg) < 0) {
        if (sb.length() > 0) sb.append(": ");
        sb.append(msg);
      }
      cause = cause.getCause();
    }
    return sb.toString();
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, limited to the
   * first {@code maxFrames} frames (all frames when {@code maxFrames <= 0}).
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main
   * (App.java:10)}
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String safeMessage(Throwable t) {
    return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
  }

  public static AgentGraphException rethrowIfUnchecked(
      Throwable t, Function<Throwable, AgentGraphException> supplier) {
    if (t instanceof AgentGraphException) {
      return (AgentGraphException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
