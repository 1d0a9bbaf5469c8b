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
 * Defaults and environment keys for the rendezvous barriers.
 */
public final class RendezvousConstants {

  /** Total time a participant waits for the others before failing. */
  public static final long DEFAULT_TIMEOUT_SECONDS = 30 * 60;

  /** How often a waiting participant logs which ranks have arrived. */
  public static final long DEFAULT_WARN_INTERVAL_SECONDS = 60;

  /** Environment variable overriding the warning interval, in seconds. Fractions are allowed. */
  public static final String WARN_INTERVAL_ENV = "TWILL_REPORT_BARRIER_WARN_INTERVAL_S";

  private RendezvousConstants() {
  }
}
