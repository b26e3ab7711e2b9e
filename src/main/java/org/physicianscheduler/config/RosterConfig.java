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

package org.physicianscheduler.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Properties;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable configuration of one scheduling run.
 *
 * <p>Instances are created with {@link #newBuilder()}, {@link #fromProperties(Properties)} or
 * {@link #load(String)}. All values are validated by {@link Builder#build()}, so a RosterConfig
 * always describes a structurally valid roster.
 */
public final class RosterConfig {
  public static final int DEFAULT_NUM_PHYSICIANS = 10;
  public static final int DEFAULT_NUM_SHIFTS = 3;
  public static final int DEFAULT_NUM_DAYS = 7;
  public static final int DEFAULT_MIN_PEAK_COVERAGE = 2;
  public static final int DEFAULT_MIN_BASELINE_COVERAGE = 1;
  public static final int DEFAULT_SATURDAY = 5;
  public static final int DEFAULT_SUNDAY = 6;

  // Property keys.
  public static final String PHYSICIANS_KEY = "roster.physicians";
  public static final String SHIFTS_KEY = "roster.shifts";
  public static final String DAYS_KEY = "roster.days";
  public static final String SENIORS_KEY = "roster.seniors";
  public static final String PEAK_SHIFTS_KEY = "roster.peakShifts";
  public static final String MIN_PEAK_COVERAGE_KEY = "roster.minPeakCoverage";
  public static final String MIN_BASELINE_COVERAGE_KEY = "roster.minBaselineCoverage";
  public static final String WEEKEND_KEY = "roster.weekend";
  public static final String REST_BOUNDARY_KEY = "roster.restBoundary";
  public static final String NIGHT_FAIRNESS_SCOPE_KEY = "roster.nightFairnessScope";
  public static final String NIGHT_FAIRNESS_ENCODING_KEY = "roster.nightFairnessEncoding";

  private RosterConfig(Builder builder) {
    this.numPhysicians = builder.numPhysicians;
    this.numShifts = builder.numShifts;
    this.numDays = builder.numDays;
    this.seniorPhysicians = Collections.unmodifiableSortedSet(builder.resolvedSeniors());
    this.peakShifts = Collections.unmodifiableSortedSet(builder.resolvedPeakShifts());
    this.minPeakCoverage = builder.minPeakCoverage;
    this.minBaselineCoverage = builder.minBaselineCoverage;
    this.weekendDays = builder.resolvedWeekendDays();
    this.restBoundary = builder.restBoundary;
    this.nightFairnessScope = builder.nightFairnessScope;
    this.nightFairnessEncoding = builder.nightFairnessEncoding;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns the default configuration: 10 physicians, 7 days, 3 shifts. */
  public static RosterConfig getDefaultInstance() {
    return newBuilder().build();
  }

  /**
   * Overlays the recognized {@code roster.*} keys of the given properties on the defaults. Missing
   * keys keep their default value; an empty list value means an empty list.
   */
  public static RosterConfig fromProperties(Properties properties) {
    Builder builder = newBuilder();
    String value = properties.getProperty(PHYSICIANS_KEY);
    if (value != null) {
      builder.setNumPhysicians(parseInt(PHYSICIANS_KEY, value));
    }
    value = properties.getProperty(SHIFTS_KEY);
    if (value != null) {
      builder.setNumShifts(parseInt(SHIFTS_KEY, value));
    }
    value = properties.getProperty(DAYS_KEY);
    if (value != null) {
      builder.setNumDays(parseInt(DAYS_KEY, value));
    }
    value = properties.getProperty(SENIORS_KEY);
    if (value != null) {
      builder.setSeniorPhysicians(parseIntList(SENIORS_KEY, value));
    }
    value = properties.getProperty(PEAK_SHIFTS_KEY);
    if (value != null) {
      builder.setPeakShifts(parseIntList(PEAK_SHIFTS_KEY, value));
    }
    value = properties.getProperty(MIN_PEAK_COVERAGE_KEY);
    if (value != null) {
      builder.setMinPeakCoverage(parseInt(MIN_PEAK_COVERAGE_KEY, value));
    }
    value = properties.getProperty(MIN_BASELINE_COVERAGE_KEY);
    if (value != null) {
      builder.setMinBaselineCoverage(parseInt(MIN_BASELINE_COVERAGE_KEY, value));
    }
    value = properties.getProperty(WEEKEND_KEY);
    if (value != null) {
      final int[] weekend = parseIntList(WEEKEND_KEY, value);
      if (weekend.length == 0) {
        builder.clearWeekendDays();
      } else if (weekend.length == 2) {
        builder.setWeekendDays(weekend[0], weekend[1]);
      } else {
        throw new RosterConfigurationException(
            WEEKEND_KEY + " must list exactly two days or none, got '" + value + "'");
      }
    }
    value = properties.getProperty(REST_BOUNDARY_KEY);
    if (value != null) {
      builder.setRestBoundary(parseEnum(REST_BOUNDARY_KEY, value, RestBoundary.class));
    }
    value = properties.getProperty(NIGHT_FAIRNESS_SCOPE_KEY);
    if (value != null) {
      builder.setNightFairnessScope(
          parseEnum(NIGHT_FAIRNESS_SCOPE_KEY, value, NightFairnessScope.class));
    }
    value = properties.getProperty(NIGHT_FAIRNESS_ENCODING_KEY);
    if (value != null) {
      builder.setNightFairnessEncoding(
          parseEnum(NIGHT_FAIRNESS_ENCODING_KEY, value, NightFairnessEncoding.class));
    }
    return builder.build();
  }

  /** Reads a properties file from the classpath and passes it to {@link #fromProperties}. */
  public static RosterConfig load(String resourceName) {
    Properties properties = new Properties();
    try (InputStream in = RosterConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (in == null) {
        throw new RosterConfigurationException("Resource not found: " + resourceName);
      }
      properties.load(in);
    } catch (IOException e) {
      throw new RosterConfigurationException("Cannot read " + resourceName, e);
    }
    return fromProperties(properties);
  }

  public int getNumPhysicians() {
    return numPhysicians;
  }

  public int getNumShifts() {
    return numShifts;
  }

  public int getNumDays() {
    return numDays;
  }

  /** Returns the indices of the physicians who never work nights, in ascending order. */
  public SortedSet<Integer> getSeniorPhysicians() {
    return seniorPhysicians;
  }

  public boolean isNightShiftEligible(int physician) {
    return !seniorPhysicians.contains(physician);
  }

  public SortedSet<Integer> getPeakShifts() {
    return peakShifts;
  }

  public int getMinPeakCoverage() {
    return minPeakCoverage;
  }

  public int getMinBaselineCoverage() {
    return minBaselineCoverage;
  }

  /** Returns true if the horizon holds a weekend pair. */
  public boolean hasWeekend() {
    return weekendDays.length == 2;
  }

  /** Returns the first weekend day. Only valid if {@link #hasWeekend()}. */
  public int getSaturday() {
    checkWeekend();
    return weekendDays[0];
  }

  /** Returns the second weekend day. Only valid if {@link #hasWeekend()}. */
  public int getSunday() {
    checkWeekend();
    return weekendDays[1];
  }

  public RestBoundary getRestBoundary() {
    return restBoundary;
  }

  public NightFairnessScope getNightFairnessScope() {
    return nightFairnessScope;
  }

  public NightFairnessEncoding getNightFairnessEncoding() {
    return nightFairnessEncoding;
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "RosterConfig{physicians=%d, days=%d, shifts=%d, seniors=%s, peakShifts=%s,"
            + " minPeakCoverage=%d, minBaselineCoverage=%d, weekend=%s, restBoundary=%s,"
            + " nightFairness=%s/%s}",
        numPhysicians,
        numDays,
        numShifts,
        seniorPhysicians,
        peakShifts,
        minPeakCoverage,
        minBaselineCoverage,
        hasWeekend() ? weekendDays[0] + "," + weekendDays[1] : "none",
        restBoundary,
        nightFairnessScope,
        nightFairnessEncoding);
  }

  private void checkWeekend() {
    if (!hasWeekend()) {
      throw new IllegalStateException("No weekend pair in a " + numDays + " day horizon");
    }
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new RosterConfigurationException(key + " is not an integer: '" + value + "'", e);
    }
  }

  private static int[] parseIntList(String key, String value) {
    final String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return new int[0];
    }
    final String[] parts = trimmed.split(",");
    final int[] result = new int[parts.length];
    for (int i = 0; i < parts.length; ++i) {
      result[i] = parseInt(key, parts[i]);
    }
    return result;
  }

  private static <E extends Enum<E>> E parseEnum(String key, String value, Class<E> type) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new RosterConfigurationException(
          key + " must be one of " + Arrays.toString(type.getEnumConstants())
              + ", got '" + value + "'",
          e);
    }
  }

  /** Builder for {@link RosterConfig}. */
  public static final class Builder {
    private Builder() {
      numPhysicians = DEFAULT_NUM_PHYSICIANS;
      numShifts = DEFAULT_NUM_SHIFTS;
      numDays = DEFAULT_NUM_DAYS;
      seniorPhysicians = null;
      peakShifts = null;
      minPeakCoverage = DEFAULT_MIN_PEAK_COVERAGE;
      minBaselineCoverage = DEFAULT_MIN_BASELINE_COVERAGE;
      weekendDays = null;
      restBoundary = RestBoundary.REFERENCE;
      nightFairnessScope = NightFairnessScope.ALL_PHYSICIANS;
      nightFairnessEncoding = NightFairnessEncoding.PAIRWISE;
    }

    public Builder setNumPhysicians(int value) {
      numPhysicians = value;
      return this;
    }

    public Builder setNumShifts(int value) {
      numShifts = value;
      return this;
    }

    public Builder setNumDays(int value) {
      numDays = value;
      return this;
    }

    /** Sets the physicians excluded from night shifts. Replaces the default of the last two. */
    public Builder setSeniorPhysicians(int... physicians) {
      seniorPhysicians = physicians.clone();
      return this;
    }

    public Builder clearSeniorPhysicians() {
      seniorPhysicians = new int[0];
      return this;
    }

    public Builder setPeakShifts(int... shifts) {
      peakShifts = shifts.clone();
      return this;
    }

    public Builder clearPeakShifts() {
      peakShifts = new int[0];
      return this;
    }

    public Builder setMinPeakCoverage(int value) {
      minPeakCoverage = value;
      return this;
    }

    public Builder setMinBaselineCoverage(int value) {
      minBaselineCoverage = value;
      return this;
    }

    /** Sets the two days whose assignments must be identical. */
    public Builder setWeekendDays(int saturday, int sunday) {
      weekendDays = new int[] {saturday, sunday};
      return this;
    }

    /** Removes the weekend pair, so no mirroring constraint is posted. */
    public Builder clearWeekendDays() {
      weekendDays = new int[0];
      return this;
    }

    public Builder setRestBoundary(RestBoundary value) {
      restBoundary = value;
      return this;
    }

    public Builder setNightFairnessScope(NightFairnessScope value) {
      nightFairnessScope = value;
      return this;
    }

    public Builder setNightFairnessEncoding(NightFairnessEncoding value) {
      nightFairnessEncoding = value;
      return this;
    }

    /** Validates the values and builds the configuration. */
    public RosterConfig build() {
      checkPositive(PHYSICIANS_KEY, numPhysicians);
      checkPositive(SHIFTS_KEY, numShifts);
      checkPositive(DAYS_KEY, numDays);
      checkNonNegative(MIN_PEAK_COVERAGE_KEY, minPeakCoverage);
      checkNonNegative(MIN_BASELINE_COVERAGE_KEY, minBaselineCoverage);
      if (restBoundary == null || nightFairnessScope == null || nightFairnessEncoding == null) {
        throw new RosterConfigurationException("Policy options must not be null");
      }
      if (seniorPhysicians != null) {
        checkIndices(SENIORS_KEY, seniorPhysicians, numPhysicians);
      }
      if (peakShifts != null) {
        checkIndices(PEAK_SHIFTS_KEY, peakShifts, numShifts);
      }
      if (weekendDays != null && weekendDays.length == 2) {
        checkIndices(WEEKEND_KEY, weekendDays, numDays);
        if (weekendDays[0] == weekendDays[1]) {
          throw new RosterConfigurationException(
              WEEKEND_KEY + " must name two distinct days, got " + weekendDays[0] + " twice");
        }
      }
      return new RosterConfig(this);
    }

    private SortedSet<Integer> resolvedSeniors() {
      SortedSet<Integer> result = new TreeSet<>();
      if (seniorPhysicians == null) {
        for (int p = Math.max(0, numPhysicians - 2); p < numPhysicians; ++p) {
          result.add(p);
        }
      } else {
        for (int p : seniorPhysicians) {
          result.add(p);
        }
      }
      return result;
    }

    private SortedSet<Integer> resolvedPeakShifts() {
      SortedSet<Integer> result = new TreeSet<>();
      if (peakShifts == null) {
        for (int s = 0; s < Math.min(2, numShifts); ++s) {
          result.add(s);
        }
      } else {
        for (int s : peakShifts) {
          result.add(s);
        }
      }
      return result;
    }

    private int[] resolvedWeekendDays() {
      if (weekendDays == null) {
        return DEFAULT_SUNDAY < numDays ? new int[] {DEFAULT_SATURDAY, DEFAULT_SUNDAY} : new int[0];
      }
      return weekendDays.clone();
    }

    private static void checkPositive(String key, int value) {
      if (value <= 0) {
        throw new RosterConfigurationException(key + " must be positive, got " + value);
      }
    }

    private static void checkNonNegative(String key, int value) {
      if (value < 0) {
        throw new RosterConfigurationException(key + " must not be negative, got " + value);
      }
    }

    private static void checkIndices(String key, int[] indices, int count) {
      for (int index : indices) {
        if (index < 0 || index >= count) {
          throw new RosterConfigurationException(
              key + " index " + index + " is outside [0, " + count + ")");
        }
      }
    }

    private int numPhysicians;
    private int numShifts;
    private int numDays;
    private int[] seniorPhysicians;
    private int[] peakShifts;
    private int minPeakCoverage;
    private int minBaselineCoverage;
    private int[] weekendDays;
    private RestBoundary restBoundary;
    private NightFairnessScope nightFairnessScope;
    private NightFairnessEncoding nightFairnessEncoding;
  }

  private final int numPhysicians;
  private final int numShifts;
  private final int numDays;
  private final SortedSet<Integer> seniorPhysicians;
  private final SortedSet<Integer> peakShifts;
  private final int minPeakCoverage;
  private final int minBaselineCoverage;
  private final int[] weekendDays;
  private final RestBoundary restBoundary;
  private final NightFairnessScope nightFairnessScope;
  private final NightFairnessEncoding nightFairnessEncoding;
}
