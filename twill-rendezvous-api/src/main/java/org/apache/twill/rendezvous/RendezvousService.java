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

/**
 * Hands out named {@link BroadcastBarrier} instances. All callers asking for the same name share one barrier.
 */
public interface RendezvousService {

  /**
   * Return an instance of {@link BroadcastBarrier}, creating it if it does not exist yet.
   * @param name The name of the barrier.
   * @param <T> Type of the data broadcast through the barrier. All users of one name must agree on it.
   * @return An instance of {@link BroadcastBarrier}.
   */
  <T> BroadcastBarrier<T> getBroadcastBarrier(String name);

  /**
   * Removes a barrier that has no active round. Instances of the removed barrier that callers still hold fail on
   * their next use with {@link IllegalStateException}; a later {@link #getBroadcastBarrier(String)} creates a new one.
   * @param name The name of the barrier.
   * @return {@code true} if the barrier was removed, {@code false} if it does not exist or a round is in progress.
   */
  boolean removeBroadcastBarrier(String name);
}
