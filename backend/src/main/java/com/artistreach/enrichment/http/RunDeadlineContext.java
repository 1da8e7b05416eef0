package com.artistreach.enrichment.http;

import java.time.Duration;

public final class RunDeadlineContext {
  private static final ThreadLocal<RunDeadline> CURRENT = new ThreadLocal<>();

  private RunDeadlineContext() {}

  public static RunDeadline current() {
    return CURRENT.get();
  }

  public static Scope activate(RunDeadline deadline) {
    RunDeadline previous = CURRENT.get();
    CURRENT.set(deadline);
    return () -> {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    };
  }

  public static void checkDeadline() {
    RunDeadline deadline = CURRENT.get();
    if (deadline != null) {
      deadline.checkDeadline();
    }
  }

  public static Duration cap(Duration requested) {
    RunDeadline deadline = CURRENT.get();
    return deadline == null ? requested : deadline.cap(requested);
  }

  public interface Scope extends AutoCloseable {
    @Override
    void close();
  }
}
