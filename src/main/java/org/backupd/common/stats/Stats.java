/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.backupd.common.stats;

import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide registry of exported stats.
 */
public final class Stats {
  private static final Logger LOG = LoggerFactory.getLogger(Stats.class);
  private static final Pattern NOT_NAME_CHAR = Pattern.compile("[^A-Za-z0-9_/.-]");

  private static final ConcurrentMap<String, Stat<? extends Number>> VAR_MAP =
      Maps.newConcurrentMap();

  private Stats() {
    // Utility class.
  }

  /**
   * Replaces any characters that are not allowed in a stat name with underscores.
   *
   * @param name Name to normalize.
   * @return The normalized name.
   */
  public static String normalizeName(String name) {
    return NOT_NAME_CHAR.matcher(name).replaceAll("_");
  }

  public static final StatsProvider STATS_PROVIDER = new StatsProvider() {
    @Override
    public AtomicLong makeCounter(String name) {
      return exportLong(name);
    }

    @Override
    public <T extends Number> Stat<T> makeGauge(String name, Supplier<T> gauge) {
      String normalized = normalizeName(name);
      Stat<T> stat = new Stat<T>() {
        @Override
        public String getName() {
          return normalized;
        }

        @Override
        public T read() {
          return gauge.get();
        }
      };
      export(stat);
      return stat;
    }
  };

  /**
   * Exports an {@link AtomicLong}, which will be included in time series tracking.
   *
   * @param name The name to export the stat with.
   * @return A reference to the {@link AtomicLong} provided.
   */
  public static AtomicLong exportLong(String name) {
    AtomicLong var = new AtomicLong();
    String normalized = normalizeName(name);
    export(new Stat<Long>() {
      @Override
      public String getName() {
        return normalized;
      }

      @Override
      public Long read() {
        return var.get();
      }
    });
    return var;
  }

  private static void export(Stat<? extends Number> stat) {
    Stat<? extends Number> previous = VAR_MAP.put(stat.getName(), stat);
    if (previous != null) {
      LOG.debug("Re-exported stat {}", stat.getName());
    }
  }

  /**
   * Retrieves a snapshot of all exported variables.
   *
   * @return Exported stat values keyed by name.
   */
  public static ImmutableMap<String, Number> getVariables() {
    ImmutableMap.Builder<String, Number> values = ImmutableMap.builder();
    for (Stat<? extends Number> stat : VAR_MAP.values()) {
      values.put(stat.getName(), stat.read());
    }
    return values.build();
  }

  /**
   * Fetches a stat by name.
   *
   * @param name Name of the stat to fetch.
   * @return The stat, if one was exported under the name.
   */
  public static Optional<Stat<? extends Number>> getVariable(String name) {
    return Optional.ofNullable(VAR_MAP.get(normalizeName(name)));
  }

  /**
   * Drops all exported stats.
   */
  public static void flush() {
    VAR_MAP.clear();
  }
}
