package tailcall.truffle.nodes;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * 执行计数器。
 *
 * 默认关闭；{@code -Dtailcall.profiler.enabled=true} 或 Runner 在 {@code TAILCALL_PROFILE} 下开启。
 * 蹦床相关的计数（弹跳、分派、恢复、入口）在报告末尾汇总为每次入口调用的平均弹跳次数。
 */
public final class Profiler {
  public static final String BOUNCE = "bounce";
  public static final String DISPATCH = "dispatch";
  public static final String RESUME = "resume";
  public static final String ENTRY = "entry";

  private static final Map<String, LongAdder> COUNTERS = new ConcurrentHashMap<>();
  private static volatile boolean enabled = Boolean.getBoolean("tailcall.profiler.enabled");

  private Profiler() {}

  public static void inc(String key) {
    if (!enabled) {
      return;
    }
    COUNTERS.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  public static void setEnabled(boolean value) {
    enabled = value;
  }

  /** 计数器当前值，从未计数时为 0 */
  public static long get(String key) {
    LongAdder adder = COUNTERS.get(key);
    return adder == null ? 0L : adder.sum();
  }

  public static void reset() {
    COUNTERS.clear();
  }

  /**
   * 按名字排序输出所有计数。
   */
  public static String dump() {
    Map<String, Long> sorted = new TreeMap<>();
    COUNTERS.forEach((k, v) -> sorted.put(k, v.sum()));
    StringBuilder sb = new StringBuilder("Tailcall profile (counts):\n");
    sorted.forEach((k, v) -> sb.append(k).append(": ").append(v).append('\n'));
    long entries = get(ENTRY);
    if (entries > 0) {
      sb.append(String.format(Locale.ROOT, "bounces per entry: %.2f%n", (double) get(BOUNCE) / entries));
    }
    return sb.toString();
  }
}
