// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.physicianscheduler.solver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lets a caller stop a running solve from another thread.
 *
 * <p>Listeners registered by a backend are run once, on the thread calling {@link #cancel()}. A
 * listener registered after cancellation is run immediately.
 */
public final class CancellationToken {
  private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

  public CancellationToken() {
    listeners = new CopyOnWriteArrayList<>();
    cancelled = false;
  }

  /** Returns a token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /** Requests cancellation. Calling it again has no effect. */
  public void cancel() {
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
    }
    for (Runnable listener : listeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Cancellation listener failed", e);
      }
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public void addListener(Runnable listener) {
    listeners.add(listener);
    if (isCancelled()) {
      listener.run();
    }
  }

  public void removeListener(Runnable listener) {
    listeners.remove(listener);
  }

  private final List<Runnable> listeners;
  private boolean cancelled;
}
