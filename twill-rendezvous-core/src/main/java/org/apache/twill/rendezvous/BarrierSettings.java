/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.twill.rendezvous;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Timeout and warning interval of a {@link BroadcastBarrier}. Fixed for the lifetime of the barrier.
 */
public final class BarrierSettings {

  private final long timeoutNanos;
  private final long warnIntervalNanos;

  private BarrierSettings(long timeoutNanos, long warnIntervalNanos) {
    this.timeoutNanos = timeoutNanos;
    this.warnIntervalNanos = warnIntervalNanos;
  }

  /**
   * Creates settings with the default timeout and the warning interval taken from the process environment,
   * if {@link RendezvousConstants#WARN_INTERVAL_ENV} is set.
   */
  public static BarrierSettings defaults() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Creates settings with the default timeout and the warning interval taken from the given environment.
   *
   * @throws IllegalArgumentException if the warning interval in the environment is not a positive number
   */
  public static BarrierSettings fromEnvironment(Map<String, String> env) {
    return builder().setWarnIntervalFromEnvironment(env).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public long getTimeout(TimeUnit unit) {
    return unit.convert(timeoutNanos, TimeUnit.NANOSECONDS);
  }

  public long getWarnInterval(TimeUnit unit) {
    return unit.convert(warnIntervalNanos, TimeUnit.NANOSECONDS);
  }

  double getWarnIntervalSeconds() {
    return warnIntervalNanos / 1e9d;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("timeoutSeconds", timeoutNanos / 1e9d)
      .add("warnIntervalSeconds", getWarnIntervalSeconds())
      .toString();
  }

  /**
   * Builder for {@link BarrierSettings}.
   */
  public static final class Builder {

    private long timeoutNanos = TimeUnit.SECONDS.toNanos(RendezvousConstants.DEFAULT_TIMEOUT_SECONDS);
    private long warnIntervalNanos = TimeUnit.SECONDS.toNanos(RendezvousConstants.DEFAULT_WARN_INTERVAL_SECONDS);

    private Builder() {
    }

    /**
     * Sets the total time a participant waits at the barrier before failing with
     * {@link BroadcastTimeoutException}.
     */
    public Builder setTimeout(long timeout, TimeUnit unit) {
      Preconditions.checkArgument(timeout > 0, "Timeout must be > 0: %s", timeout);
      this.timeoutNanos = unit.toNanos(timeout);
      return this;
    }

    /**
     * Sets how often a stalled round is reported in the log.
     */
    public Builder setWarnInterval(long interval, TimeUnit unit) {
      Preconditions.checkArgument(interval > 0, "Warning interval must be > 0: %s", interval);
      this.warnIntervalNanos = unit.toNanos(interval);
      return this;
    }

    /**
     * Sets the warning interval from {@link RendezvousConstants#WARN_INTERVAL_ENV} if the environment has it.
     */
    public Builder setWarnIntervalFromEnvironment(Map<String, String> env) {
      String value = env.get(RendezvousConstants.WARN_INTERVAL_ENV);
      if (value == null || value.trim().isEmpty()) {
        return this;
      }
      double seconds;
      try {
        seconds = Double.parseDouble(value.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(String.format("Invalid value for %s: '%s'",
                                                         RendezvousConstants.WARN_INTERVAL_ENV, value), e);
      }
      Preconditions.checkArgument(seconds > 0 && !Double.isInfinite(seconds),
                                  "%s must be a positive number of seconds: '%s'",
                                  RendezvousConstants.WARN_INTERVAL_ENV, value);
      this.warnIntervalNanos = Math.max(1L, (long) (seconds * TimeUnit.SECONDS.toNanos(1)));
      return this;
    }

    public BarrierSettings build() {
      return new BarrierSettings(timeoutNanos, warnIntervalNanos);
    }
  }
}
