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

import com.google.common.util.concurrent.ListenableFuture;

import javax.annotation.Nullable;

/**
 * Asynchronous access to the barriers of a {@link RendezvousService}.
 */
public interface RendezvousServiceClient {

  /**
   * Calls {@link BroadcastBarrier#broadcastFromRankZero(int, int, Object)} on the named barrier without blocking
   * the caller.
   *
   * @param barrierName The name of the barrier.
   * @param worldRank rank of the caller
   * @param worldSize number of participants expected in the round
   * @param data data to broadcast; only the value passed by rank 0 is used
   * @return A {@link ListenableFuture} that completes with the data of rank 0. It fails with
   *         {@link BroadcastTimeoutException} or {@link WorldSizeMismatchException} under the same conditions as
   *         the blocking call.
   */
  <T> ListenableFuture<T> broadcastFromRankZero(String barrierName, int worldRank, int worldSize, @Nullable T data);
}
