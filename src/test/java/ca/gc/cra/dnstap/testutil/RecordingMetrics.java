package ca.gc.cra.dnstap.testutil;

import ca.gc.cra.dnstap.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/** Metrics sink that keeps counter totals and observation counts in memory. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
  private final Map<String, LongAdder> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new LongAdder()).increment();
  }

  public long count(String key) {
    LongAdder adder = counters.get(key);
    return adder == null ? 0 : adder.sum();
  }

  public long observations(String key) {
    LongAdder adder = observations.get(key);
    return adder == null ? 0 : adder.sum();
  }
}
