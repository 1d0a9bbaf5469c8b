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

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thrown when a participant waited longer than the barrier timeout for the others to arrive. It carries the
 * {@link ArrivalSnapshot} taken at the moment of the timeout, which tells which ranks never arrived.
 */
public class BroadcastTimeoutException extends TimeoutException {

  private final ArrivalSnapshot snapshot;
  private final long timeoutNanos;

  public BroadcastTimeoutException(ArrivalSnapshot snapshot, long timeout, TimeUnit unit) {
    super(createMessage(snapshot, unit.toNanos(timeout)));
    this.snapshot = snapshot;
    this.timeoutNanos = unit.toNanos(timeout);
  }

  /**
   * @return elapsed wait time of every rank that arrived, taken when the timeout fired.
   */
  public ArrivalSnapshot getSnapshot() {
    return snapshot;
  }

  public long getTimeout(TimeUnit unit) {
    return unit.convert(timeoutNanos, TimeUnit.NANOSECONDS);
  }

  private static String createMessage(ArrivalSnapshot snapshot, long timeoutNanos) {
    return String.format(Locale.ROOT,
                         "The broadcast operation timed out after %.2f seconds. Not all %d workers arrived. "
                           + "Ranks that arrived and how long they have been waiting in seconds: %s. "
                           + "Ranks that never arrived: %s.",
                         timeoutNanos / 1e9d, snapshot.getWorldSize(), snapshot, snapshot.getMissingRanks());
  }
}
