package cafe.woden.bansync.util;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating app-owned executors with readable thread names. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return task -> {
      Thread t = new Thread(task, base + "-" + seq.getAndIncrement());
      t.setDaemon(true);
      return t;
    };
  }

  public static ExecutorService newFixedThreadPool(int poolSize, String baseName) {
    int size = Math.max(1, poolSize);
    return Executors.newFixedThreadPool(size, namedFactory(baseName));
  }

  private static String normalize(String baseName) {
    String base = Objects.toString(baseName, "").trim();
    return base.isEmpty() ? "bansync-worker" : base;
  }
}
