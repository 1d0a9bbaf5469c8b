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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

/**
 * Test the diagnostics carried by {@link BroadcastTimeoutException}.
 */
public class BroadcastTimeoutExceptionTest {

  @Test
  public void testSnapshotAndMessage() {
    ArrivalSnapshot snapshot = new ArrivalSnapshot(4, ImmutableMap.of(2, 0.5d, 0, 1.25d));
    BroadcastTimeoutException e = new BroadcastTimeoutException(snapshot, 1500, TimeUnit.MILLISECONDS);

    Assert.assertSame(snapshot, e.getSnapshot());
    Assert.assertEquals(1500, e.getTimeout(TimeUnit.MILLISECONDS));
    Assert.assertEquals(ImmutableList.of(1, 3), snapshot.getMissingRanks());
    Assert.assertEquals("{0=1.25, 2=0.50}", snapshot.toString());
    Assert.assertTrue(e.getMessage().contains("1.50 seconds"));
    Assert.assertTrue(e.getMessage().contains("{0=1.25, 2=0.50}"));
    Assert.assertTrue(e.getMessage().contains("[1, 3]"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRankOutOfRange() {
    new ArrivalSnapshot(2, ImmutableMap.of(2, 1.0d));
  }
}
