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

import java.util.concurrent.atomic.AtomicLong;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class StatsTest {
  @After
  public void tearDown() {
    Stats.flush();
  }

  @Test
  public void testNormalizeName() {
    assertEquals("backup_runs", Stats.normalizeName("backup runs"));
    assertEquals("a.b-c/d_e", Stats.normalizeName("a.b-c/d_e"));
    assertEquals("x_y_", Stats.normalizeName("x{y}"));
  }

  @Test
  public void testCounter() {
    AtomicLong counter = Stats.STATS_PROVIDER.makeCounter("backup runs");
    counter.addAndGet(3);

    assertEquals(3L, Stats.getVariables().get("backup_runs"));
    assertEquals(3L, Stats.getVariable("backup runs").get().read());
  }

  @Test
  public void testGauge() {
    AtomicLong value = new AtomicLong(5);
    Stats.STATS_PROVIDER.makeGauge("queue_size", value::get);
    value.set(7);

    assertEquals(7L, Stats.getVariable("queue_size").get().read());
  }

  @Test
  public void testFlush() {
    Stats.exportLong("transient");
    Stats.flush();

    assertFalse(Stats.getVariable("transient").isPresent());
  }
}
