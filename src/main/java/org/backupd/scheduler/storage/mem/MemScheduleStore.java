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

import java.util.Map;
import java.util.Optional;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import org.backupd.common.stats.StatsProvider;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupSchedule;

/**
 * An in-memory schedule store, keyed by connection.
 */
class MemScheduleStore implements ScheduleStore.Mutable {
  @VisibleForTesting
  static final String SCHEDULES_SIZE = "mem_storage_schedules_size";

  private final Map<String, BackupSchedule> schedules = Maps.newConcurrentMap();

  @Inject
  MemScheduleStore(StatsProvider statsProvider) {
    statsProvider.makeGauge(SCHEDULES_SIZE, () -> schedules.size());
  }

  @Override
  public Optional<BackupSchedule> fetchSchedule(String connectionId) {
    return Optional.ofNullable(schedules.get(connectionId));
  }

  @Override
  public Iterable<BackupSchedule> fetchSchedules() {
    return ImmutableSet.copyOf(schedules.values());
  }

  @Override
  public void createSchedule(BackupSchedule schedule) {
    BackupSchedule existing = schedules.putIfAbsent(schedule.getConnectionId(), schedule);
    if (existing != null) {
      throw new StorageException(String.format(
          "Connection %s already has schedule %s",
          schedule.getConnectionId(),
          existing.getId()));
    }
  }

  @Override
  public void updateSchedule(BackupSchedule schedule) {
    BackupSchedule replaced = schedules.computeIfPresent(
        schedule.getConnectionId(),
        (connectionId, existing) ->
            existing.getId().equals(schedule.getId()) ? schedule : existing);
    if (replaced != schedule) {
      throw new StorageException(String.format(
          "No schedule %s found for connection %s",
          schedule.getId(),
          schedule.getConnectionId()));
    }
  }
}
