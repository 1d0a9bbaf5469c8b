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

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * A {@link BroadcastBarrier} living in the memory of the process that hosts it.
 * <p>
 *   All bookkeeping of a call (round setup, entering, release) runs under one lock. Waiting participants suspend
 *   on a condition of that lock, so other callers can enter while they wait. The last participant to arrive
 *   signals all waiters at once. The state of a round is cleared only after every participant has left, hence
 *   a new round cannot start while participants of the previous one are still returning.
 * </p>
 *
 * <blockquote>
 *   <pre>
 *     {@code
 *
 *     BroadcastBarrier<String> barrier = new InMemoryBroadcastBarrier<String>("checkpoint");
 *     ...
 *     // on every worker
 *     String checkpoint = barrier.broadcastFromRankZero(rank, worldSize, rank == 0 ? localCheckpoint : null);
 *     }
 *   </pre>
 * </blockquote>
 *
 * @param <T> type of the data being broadcast
 */
public final class InMemoryBroadcastBarrier<T> implements BroadcastBarrier<T> {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryBroadcastBarrier.class);

  private final String name;
  private final Lock lock = new ReentrantLock();
  private final Condition released = lock.newCondition();
  private final RoundState<T> state = new RoundState<T>();
  private final RoundManager<T> roundManager;
  private final StallReporter stallReporter;
  private boolean retired;

  public InMemoryBroadcastBarrier(String name) {
    this(name, BarrierSettings.defaults());
  }

  public InMemoryBroadcastBarrier(String name, BarrierSettings settings) {
    this.name = Preconditions.checkNotNull(name, "Barrier name cannot be null");
    this.roundManager = new RoundManager<T>(name, state);
    this.stallReporter = new StallReporter(name, state, settings);
  }

  public String getName() {
    return name;
  }

  @Override
  @Nullable
  public T broadcastFromRankZero(int worldRank, int worldSize, @Nullable T data)
    throws InterruptedException, BroadcastTimeoutException {

    Preconditions.checkArgument(worldSize > 0, "World size must be > 0: %s", worldSize);
    Preconditions.checkArgument(worldRank >= 0 && worldRank < worldSize,
                                "World rank %s out of range for world size %s", worldRank, worldSize);
    lock.lock();
    try {
      Preconditions.checkState(!retired, "Barrier %s was removed from its service", name);
      roundManager.setupOrValidate(worldSize);
      try (RoundManager<T>.Participation participation = roundManager.enter(worldRank, data)) {
        if (state.getCounter() == state.getWorldSize()) {
          // Last one in. Release everyone waiting on this round.
          state.advanceGeneration();
          released.signalAll();
          LOG.debug("Barrier {} released by rank {} with world size {}", name, worldRank, worldSize);
          return state.getReducedData();
        }

        if (state.hasArrived(worldRank)) {
          LOG.debug("Rank {} arrived more than once in the current round of barrier {}", worldRank, name);
        }
        long generation = state.getGeneration();
        long arrivalNanos = System.nanoTime();
        state.recordArrival(worldRank, arrivalNanos);
        stallReporter.awaitRelease(released, generation, arrivalNanos);
        return state.getReducedData();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getCounter() {
    return state.getCounter();
  }

  @Override
  public int getWorldSize() {
    return state.getWorldSize();
  }

  @Override
  @Nullable
  public T getReducedData() {
    return state.getReducedData();
  }

  /**
   * Marks this barrier as unusable if no round is active. Later calls to
   * {@link #broadcastFromRankZero(int, int, Object)} fail with {@link IllegalStateException}.
   *
   * @return {@code true} if the barrier is retired, {@code false} if a round is in progress
   */
  boolean retireIfIdle() {
    lock.lock();
    try {
      if (state.isActive()) {
        return false;
      }
      retired = true;
      return true;
    } finally {
      lock.unlock();
    }
  }

  long getStallWarningCount() {
    return stallReporter.getWarningCount();
  }
}
