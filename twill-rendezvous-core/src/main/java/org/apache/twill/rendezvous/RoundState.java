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

import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Mutable state of the round of one {@link InMemoryBroadcastBarrier}. All mutation happens while the barrier lock
 * is held. The volatile fields may be read without it, for diagnostics.
 *
 * @param <T> type of the broadcast data
 */
final class RoundState<T> {

  private volatile int counter;
  private volatile int worldSize;
  private volatile T reducedData;

  // Bumped on every release. Never reset, so waiters can tell a release from a spurious wakeup.
  private long generation;
  private long[] arrivalNanos = new long[0];
  private boolean[] arrived = new boolean[0];
  private boolean warned;
  private long lastWarningNanos;

  int getCounter() {
    return counter;
  }

  int getWorldSize() {
    return worldSize;
  }

  @Nullable
  T getReducedData() {
    return reducedData;
  }

  boolean isActive() {
    return worldSize != 0;
  }

  void start(int worldSize) {
    this.worldSize = worldSize;
    this.arrivalNanos = new long[worldSize];
    this.arrived = new boolean[worldSize];
    this.warned = false;
  }

  void setReducedData(@Nullable T data) {
    this.reducedData = data;
  }

  boolean isFull() {
    return counter >= worldSize;
  }

  void increment() {
    counter++;
  }

  /**
   * @return the counter after decrementing
   */
  int decrement() {
    return --counter;
  }

  void reset() {
    reducedData = null;
    worldSize = 0;
    Arrays.fill(arrived, false);
  }

  long getGeneration() {
    return generation;
  }

  void advanceGeneration() {
    generation++;
  }

  void recordArrival(int rank, long nanos) {
    arrivalNanos[rank] = nanos;
    arrived[rank] = true;
  }

  void clearArrival(int rank) {
    if (rank < arrived.length) {
      arrived[rank] = false;
    }
  }

  boolean hasArrived(int rank) {
    return rank < arrived.length && arrived[rank];
  }

  /**
   * Claims the right to log the next stall warning of this round. At most one warning is granted per interval,
   * no matter how many participants are waiting.
   */
  boolean claimWarning(long nowNanos, long intervalNanos) {
    if (warned && nowNanos - lastWarningNanos < intervalNanos) {
      return false;
    }
    warned = true;
    lastWarningNanos = nowNanos;
    return true;
  }

  ArrivalSnapshot snapshot(long nowNanos) {
    Map<Integer, Double> elapsed = Maps.newHashMap();
    for (int rank = 0; rank < arrived.length; rank++) {
      if (arrived[rank]) {
        elapsed.put(rank, (nowNanos - arrivalNanos[rank]) / 1e9d);
      }
    }
    return new ArrivalSnapshot(worldSize, elapsed);
  }
}
