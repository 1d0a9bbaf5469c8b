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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;

/**
 * Waits for a round to be released, logging which ranks have arrived while the round is stalled, and turns an
 * expired wait into a {@link BroadcastTimeoutException}.
 */
final class StallReporter {

  private static final Logger LOG = LoggerFactory.getLogger(StallReporter.class);

  private static final String PERIODIC_WARNING =
    "broadcastFromRankZero has not been called by all {} workers of barrier {}. "
      + "Please ensure that all workers call it, whether or not they contribute data. "
      + "Here are the ranks that have arrived so far and how long they have been waiting in seconds: {}. "
      + "You can set the {} environment variable to change the frequency of this warning "
      + "from its current value: {} seconds.";

  private final String name;
  private final RoundState<?> state;
  private final BarrierSettings settings;
  private final AtomicLong warnings = new AtomicLong();

  StallReporter(String name, RoundState<?> state, BarrierSettings settings) {
    this.name = name;
    this.state = state;
    this.settings = settings;
  }

  /**
   * Blocks on the given condition until the round leaves the given generation. Must be called with the lock of
   * the condition held.
   *
   * @param released condition signalled when a round is released
   * @param generation generation of the round the caller entered
   * @param arrivalNanos {@link System#nanoTime()} at which the caller arrived
   * @throws BroadcastTimeoutException if the round is not released within the barrier timeout
   */
  void awaitRelease(Condition released, long generation, long arrivalNanos)
    throws InterruptedException, BroadcastTimeoutException {

    long timeoutNanos = settings.getTimeout(TimeUnit.NANOSECONDS);
    long intervalNanos = settings.getWarnInterval(TimeUnit.NANOSECONDS);
    long deadline = arrivalNanos + timeoutNanos;
    long nextWarning = arrivalNanos + intervalNanos;

    while (state.getGeneration() == generation) {
      long now = System.nanoTime();
      if (now - deadline >= 0) {
        throw newTimeoutException(now);
      }
      if (now - nextWarning >= 0) {
        if (state.claimWarning(now, intervalNanos)) {
          warn(now);
        }
        nextWarning = now + intervalNanos;
      }
      released.awaitNanos(Math.min(deadline - now, nextWarning - now));
    }
  }

  /**
   * @return number of stall warnings logged so far.
   */
  long getWarningCount() {
    return warnings.get();
  }

  private void warn(long now) {
    warnings.incrementAndGet();
    LOG.warn(PERIODIC_WARNING, state.getWorldSize(), name, state.snapshot(now),
             RendezvousConstants.WARN_INTERVAL_ENV, settings.getWarnIntervalSeconds());
  }

  private BroadcastTimeoutException newTimeoutException(long now) {
    ArrivalSnapshot snapshot = state.snapshot(now);
    LOG.debug("Timed out waiting on barrier {}. Missing ranks: {}", name, snapshot.getMissingRanks());
    return new BroadcastTimeoutException(snapshot, settings.getTimeout(TimeUnit.NANOSECONDS), TimeUnit.NANOSECONDS);
  }
}
