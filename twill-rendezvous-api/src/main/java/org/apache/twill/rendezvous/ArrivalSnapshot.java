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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import javax.annotation.Nullable;

/**
 * Point in time view of how long each rank of a round has been waiting at a barrier. Ranks that have not arrived
 * yet are absent.
 */
public final class ArrivalSnapshot {

  private final int worldSize;
  private final SortedMap<Integer, Double> elapsedSeconds;

  public ArrivalSnapshot(int worldSize, Map<Integer, Double> elapsedSeconds) {
    Preconditions.checkArgument(worldSize >= 0, "World size must be >= 0: %s", worldSize);
    for (Integer rank : elapsedSeconds.keySet()) {
      Preconditions.checkArgument(rank >= 0 && rank < worldSize, "Rank %s out of range for world size %s",
                                  rank, worldSize);
    }
    this.worldSize = worldSize;
    this.elapsedSeconds = ImmutableSortedMap.copyOf(elapsedSeconds);
  }

  public int getWorldSize() {
    return worldSize;
  }

  /**
   * @return elapsed seconds keyed by rank, containing only the ranks that arrived.
   */
  public SortedMap<Integer, Double> getElapsedSeconds() {
    return elapsedSeconds;
  }

  /**
   * @return seconds the given rank has been waiting, or {@code null} if it has not arrived.
   */
  @Nullable
  public Double getElapsedSeconds(int rank) {
    return elapsedSeconds.get(rank);
  }

  public boolean hasArrived(int rank) {
    return elapsedSeconds.containsKey(rank);
  }

  public ImmutableList<Integer> getMissingRanks() {
    ImmutableList.Builder<Integer> missing = ImmutableList.builder();
    for (int rank = 0; rank < worldSize; rank++) {
      if (!elapsedSeconds.containsKey(rank)) {
        missing.add(rank);
      }
    }
    return missing.build();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    String separator = "";
    for (Map.Entry<Integer, Double> entry : elapsedSeconds.entrySet()) {
      builder.append(separator)
        .append(entry.getKey())
        .append('=')
        .append(String.format(Locale.ROOT, "%.2f", entry.getValue()));
      separator = ", ";
    }
    return builder.append('}').toString();
  }
}
