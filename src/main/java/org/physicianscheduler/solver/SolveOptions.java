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

import java.time.Duration;
import java.util.Optional;

/** Parameters of one solve. Created with {@link #newBuilder()}. */
public final class SolveOptions {
  private SolveOptions(Builder builder) {
    this.timeLimit = builder.timeLimit;
    this.numWorkers = builder.numWorkers;
    this.logSearchProgress = builder.logSearchProgress;
    this.cancellationToken = builder.cancellationToken;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** No time limit, engine default parallelism, no search log, no cancellation. */
  public static SolveOptions getDefaultInstance() {
    return newBuilder().build();
  }

  public Optional<Duration> getTimeLimit() {
    return Optional.ofNullable(timeLimit);
  }

  /** Returns the number of parallel search workers, 0 for the engine default. */
  public int getNumWorkers() {
    return numWorkers;
  }

  /** Returns true if the engine's search log is forwarded to the logger. */
  public boolean getLogSearchProgress() {
    return logSearchProgress;
  }

  public CancellationToken getCancellationToken() {
    return cancellationToken;
  }

  /** Builder for {@link SolveOptions}. */
  public static final class Builder {
    private Builder() {
      timeLimit = null;
      numWorkers = 0;
      logSearchProgress = false;
      cancellationToken = CancellationToken.none();
    }

    public Builder setTimeLimit(Duration value) {
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException("Time limit must be positive, got " + value);
      }
      timeLimit = value;
      return this;
    }

    public Builder setNumWorkers(int value) {
      if (value < 0) {
        throw new IllegalArgumentException("Number of workers must not be negative: " + value);
      }
      numWorkers = value;
      return this;
    }

    public Builder setLogSearchProgress(boolean value) {
      logSearchProgress = value;
      return this;
    }

    public Builder setCancellationToken(CancellationToken value) {
      cancellationToken = value;
      return this;
    }

    public SolveOptions build() {
      return new SolveOptions(this);
    }

    private Duration timeLimit;
    private int numWorkers;
    private boolean logSearchProgress;
    private CancellationToken cancellationToken;
  }

  private final Duration timeLimit;
  private final int numWorkers;
  private final boolean logSearchProgress;
  private final CancellationToken cancellationToken;
}
