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
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * A simple in memory implementation of {@link RendezvousService} and {@link RendezvousServiceClient}.
 * <p>
 *   Barriers are created on first use and all share the {@link BarrierSettings} of the service. Blocking access
 *   through {@link #getBroadcastBarrier(String)} works at any time. The asynchronous calls of
 *   {@link RendezvousServiceClient} run on a thread pool that only exists while the service is running.
 * </p>
 */
public class InMemoryRendezvousService extends AbstractIdleService
                                       implements RendezvousService, RendezvousServiceClient {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryRendezvousService.class);

  private final Map<String, InMemoryBroadcastBarrier<?>> barriers = Maps.newHashMap();
  private final Lock lock = new ReentrantLock();
  private final BarrierSettings settings;
  private volatile ListeningExecutorService executor;

  public InMemoryRendezvousService() {
    this(BarrierSettings.defaults());
  }

  public InMemoryRendezvousService(BarrierSettings settings) {
    this.settings = settings;
  }

  @Override
  protected void startUp() throws Exception {
    executor = MoreExecutors.listeningDecorator(
      Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                      .setDaemon(true)
                                      .setNameFormat("rendezvous-%d")
                                      .build()));
    LOG.info("Rendezvous service started with {}", settings);
  }

  @Override
  protected void shutDown() throws Exception {
    // Interrupts callers still waiting at a barrier, they see an InterruptedException through their future.
    executor.shutdownNow();
    LOG.info("Rendezvous service stopped");
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> BroadcastBarrier<T> getBroadcastBarrier(String name) {
    Preconditions.checkNotNull(name, "Barrier name cannot be null");
    lock.lock();
    try {
      InMemoryBroadcastBarrier<?> barrier = barriers.get(name);
      if (barrier == null) {
        barrier = new InMemoryBroadcastBarrier<T>(name, settings);
        barriers.put(name, barrier);
        LOG.debug("Created barrier {}", name);
      }
      // All callers of one name must agree on T.
      return (BroadcastBarrier<T>) barrier;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean removeBroadcastBarrier(String name) {
    lock.lock();
    try {
      InMemoryBroadcastBarrier<?> barrier = barriers.get(name);
      if (barrier == null || !barrier.retireIfIdle()) {
        return false;
      }
      barriers.remove(name);
      LOG.debug("Removed barrier {}", name);
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> ListenableFuture<T> broadcastFromRankZero(final String barrierName, final int worldRank,
                                                       final int worldSize, @Nullable final T data) {
    Preconditions.checkState(isRunning(), "Rendezvous service is not running: %s", state());
    Preconditions.checkNotNull(barrierName, "Barrier name cannot be null");
    return executor.submit(new Callable<T>() {
      @Override
      public T call() throws Exception {
        BroadcastBarrier<T> barrier = getBroadcastBarrier(barrierName);
        return barrier.broadcastFromRankZero(worldRank, worldSize, data);
      }
    });
  }
}
