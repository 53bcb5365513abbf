/*
 * Copyright (C) 2022 Temporal Technologies, Inc. All Rights Reserved.
 *
 * Copyright (C) 2012-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Modifications copyright (C) 2017 Uber Technologies, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this material except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cloudrpc.serviceclient;

import static java.util.stream.Collectors.joining;
import static org.junit.Assert.*;

import com.uber.m3.tally.Capabilities;
import com.uber.m3.tally.StatsReporter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** Keeps reported counters in memory. Only counters are used by the retryers. */
public class RecordingStatsReporter implements StatsReporter {

  private final Map<String, AtomicLong> counters = new HashMap<>();

  public synchronized void assertCounter(String name, Map<String, String> tags, long expected) {
    String metricName = getMetricName(name, tags);
    AtomicLong accumulator = counters.get(metricName);
    if (accumulator == null) {
      fail(
          "No metric '"
              + metricName
              + "', reported metrics: \n "
              + String.join("\n ", counters.keySet()));
    }
    assertEquals(metricName, expected, accumulator.get());
  }

  public synchronized void assertNoMetric(String name, Map<String, String> tags) {
    String metricName = getMetricName(name, tags);
    assertFalse("Metric '" + metricName + "' was reported", counters.containsKey(metricName));
  }

  @Override
  public synchronized void reportCounter(String name, Map<String, String> tags, long value) {
    counters.computeIfAbsent(getMetricName(name, tags), k -> new AtomicLong()).addAndGet(value);
  }

  @Override
  public void reportGauge(String name, Map<String, String> tags, double value) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void reportTimer(
      String name, Map<String, String> tags, com.uber.m3.util.Duration interval) {
    throw new UnsupportedOperationException();
  }

  @SuppressWarnings("deprecation")
  @Override
  public void reportHistogramValueSamples(
      String name,
      Map<String, String> tags,
      com.uber.m3.tally.Buckets buckets,
      double bucketLowerBound,
      double bucketUpperBound,
      long samples) {
    throw new UnsupportedOperationException();
  }

  @SuppressWarnings("deprecation")
  @Override
  public void reportHistogramDurationSamples(
      String name,
      Map<String, String> tags,
      com.uber.m3.tally.Buckets buckets,
      com.uber.m3.util.Duration bucketLowerBound,
      com.uber.m3.util.Duration bucketUpperBound,
      long samples) {
    throw new UnsupportedOperationException();
  }

  @Override
  public Capabilities capabilities() {
    throw new UnsupportedOperationException();
  }

  @Override
  public void flush() {}

  @Override
  public void close() {}

  private static String getMetricName(String name, Map<String, String> tags) {
    return name
        + " "
        + tags.entrySet().stream()
            .map(Map.Entry::toString)
            .sorted()
            .collect(joining("|", "[", "]"));
  }
}
