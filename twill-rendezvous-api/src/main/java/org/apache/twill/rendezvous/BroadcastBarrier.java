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

import javax.annotation.Nullable;

/**
 * A reusable barrier that makes a group of {@code worldSize} participants agree on the data supplied by rank 0.
 *
 * <p>
 *   Every participant calls {@link #broadcastFromRankZero(int, int, Object)} once per round. The call blocks until
 *   all participants of the round have arrived and then returns the data that rank 0 passed in, to every participant
 *   including rank 0 itself. A round ends once the last participant has returned, after which the barrier can be
 *   used for the next round.
 * </p>
 *
 * @param <T> type of the data being broadcast
 */
public interface BroadcastBarrier<T> {

  /**
   * Enter the barrier and block until all {@code worldSize} participants have entered, or the configured timeout
   * of the barrier has expired.
   *
   * @param worldRank rank of the caller, between {@code 0} and {@code worldSize - 1}
   * @param worldSize number of participants expected in the round
   * @param data data to broadcast; only the value passed by rank 0 is used
   * @return the data passed in by rank 0
   * @throws WorldSizeMismatchException if a round is active with a different world size
   * @throws BroadcastTimeoutException if not all participants arrived before the timeout
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  @Nullable
  T broadcastFromRankZero(int worldRank, int worldSize, @Nullable T data)
    throws InterruptedException, BroadcastTimeoutException;

  /**
   * @return number of participants currently inside the active round. Diagnostics only.
   */
  int getCounter();

  /**
   * @return world size of the active round, or {@code 0} if no round is active. Diagnostics only.
   */
  int getWorldSize();

  /**
   * @return data supplied by rank 0 for the active round, or {@code null} if there is none. Diagnostics only.
   */
  @Nullable
  T getReducedData();
}
