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

import javax.annotation.Nullable;

/**
 * Bookkeeping of the rounds of one barrier: starts a round on the first arrival, checks that every participant
 * agrees on the world size, and ends the round once the last participant has left.
 * <p>
 *   Must only be used while holding the barrier lock.
 * </p>
 */
final class RoundManager<T> {

  private static final Logger LOG = LoggerFactory.getLogger(RoundManager.class);

  private final String name;
  private final RoundState<T> state;

  RoundManager(String name, RoundState<T> state) {
    this.name = name;
    this.state = state;
  }

  /**
   * Starts a round of the given size if none is active, otherwise validates the size against the active round.
   *
   * @throws WorldSizeMismatchException if the active round has a different world size
   */
  void setupOrValidate(int worldSize) {
    if (!state.isActive()) {
      state.start(worldSize);
      LOG.debug("Round started on barrier {} with world size {}", name, worldSize);
    } else if (worldSize != state.getWorldSize()) {
      throw new WorldSizeMismatchException(worldSize, state.getWorldSize());
    }
  }

  /**
   * Counts the caller into the active round. Rank 0 also stores its data as the data of the round.
   * <p>
   *   An entry into a round that already counts all its participants changes nothing. The returned
   *   {@link Participation} is then a no-op as well, so a repeated call cannot drain the round early.
   * </p>
   *
   * @return a {@link Participation} that must be closed when the caller leaves the barrier
   */
  Participation enter(int rank, @Nullable T data) {
    if (state.isFull()) {
      LOG.debug("Rank {} entered barrier {} with all {} participants already counted", rank, name,
                state.getWorldSize());
      return new Participation(rank, false);
    }
    if (rank == 0) {
      state.setReducedData(data);
    }
    state.increment();
    return new Participation(rank, true);
  }

  private void leave() {
    if (state.decrement() == 0) {
      state.reset();
      LOG.debug("Round drained on barrier {}", name);
    }
  }

  /**
   * Presence of one caller in the active round. Closing it leaves the round.
   */
  final class Participation implements AutoCloseable {

    private final int rank;
    private boolean counted;

    private Participation(int rank, boolean counted) {
      this.rank = rank;
      this.counted = counted;
    }

    @Override
    public void close() {
      if (counted) {
        counted = false;
        state.clearArrival(rank);
        leave();
      }
    }
  }
}
