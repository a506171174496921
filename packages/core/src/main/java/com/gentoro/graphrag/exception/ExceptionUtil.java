package com.gentoro.graphrag.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/** Helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. When the throwable is a {@link
   * GraphRagException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof GraphRagException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        GraphRagErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Strip executor wrappers so the failure that actually happened is reported. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof java.util.concurrent.ExecutionException
            || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Returns {@code t} unchanged when it already is a {@link GraphRagException}, otherwise wraps it
   * with the supplied factory.
   */
  public static GraphRagException rethrowIfUnchecked(
      Throwable t, Function<Throwable, GraphRagException> supplier) {
    if (t instanceof GraphRagException gre) {
      return gre;
    }
    return supplier.apply(t);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
