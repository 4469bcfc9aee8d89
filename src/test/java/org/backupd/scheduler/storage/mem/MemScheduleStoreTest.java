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
package org.backupd.scheduler.storage.mem;

import java.time.Instant;
import java.util.Optional;

import com.google.common.collect.ImmutableSet;

import org.backupd.common.stats.testing.FakeStatsProvider;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class MemScheduleStoreTest {
  private static final BackupSchedule SCHEDULE_A = BackupSchedule.builder()
      .setId("a")
      .setConnectionId("connection-a")
      .setEnabled(true)
      .setCronSchedule("0 0 * * * *")
      .setRetentionDays(7)
      .setCreatedAt(Instant.EPOCH)
      .setUpdatedAt(Instant.EPOCH)
      .build();
  private static final BackupSchedule SCHEDULE_B = SCHEDULE_A.toBuilder()
      .setId("b")
      .setConnectionId("connection-b")
      .build();

  private FakeStatsProvider statsProvider;
  private ScheduleStore.Mutable store;

  @Before
  public void setUp() {
    statsProvider = new FakeStatsProvider();
    store = new MemScheduleStore(statsProvider);
  }

  @Test
  public void testCreateAndFetch() {
    assertEquals(Optional.empty(), store.fetchSchedule(SCHEDULE_A.getConnectionId()));

    store.createSchedule(SCHEDULE_A);
    store.createSchedule(SCHEDULE_B);

    assertEquals(Optional.of(SCHEDULE_A), store.fetchSchedule(SCHEDULE_A.getConnectionId()));
    assertEquals(
        ImmutableSet.of(SCHEDULE_A, SCHEDULE_B),
        ImmutableSet.copyOf(store.fetchSchedules()));
    assertEquals(2, statsProvider.getValue(MemScheduleStore.SCHEDULES_SIZE));
  }

  @Test
  public void testOneSchedulePerConnection() {
    store.createSchedule(SCHEDULE_A);
    try {
      store.createSchedule(SCHEDULE_A.toBuilder().setId("a2").build());
      fail();
    } catch (StorageException e) {
      // Expected.
    }
    assertEquals(Optional.of(SCHEDULE_A), store.fetchSchedule(SCHEDULE_A.getConnectionId()));
  }

  @Test
  public void testUpdate() {
    store.createSchedule(SCHEDULE_A);
    BackupSchedule disabled = SCHEDULE_A.toBuilder().setEnabled(false).build();

    store.updateSchedule(disabled);

    assertEquals(Optional.of(disabled), store.fetchSchedule(SCHEDULE_A.getConnectionId()));
  }

  @Test
  public void testUpdateMissing() {
    try {
      store.updateSchedule(SCHEDULE_A);
      fail();
    } catch (StorageException e) {
      // Expected.
    }
    assertEquals(Optional.empty(), store.fetchSchedule(SCHEDULE_A.getConnectionId()));
  }

  @Test
  public void testUpdateDoesNotReplaceOtherSchedule() {
    store.createSchedule(SCHEDULE_A);
    try {
      store.updateSchedule(SCHEDULE_A.toBuilder().setId("stale").setEnabled(false).build());
      fail();
    } catch (StorageException e) {
      // Expected.
    }
    assertEquals(Optional.of(SCHEDULE_A), store.fetchSchedule(SCHEDULE_A.getConnectionId()));
  }
}
