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
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.Maps;

import org.backupd.common.stats.StatsProvider;
import org.backupd.scheduler.storage.BackupStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupRecord;
import org.backupd.scheduler.storage.entities.BackupStatus;

/**
 * An in-memory backup history store.
 */
class MemBackupStore implements BackupStore.Mutable {
  @VisibleForTesting
  static final String BACKUPS_SIZE = "mem_storage_backups_size";

  private static final Comparator<BackupRecord> OLDEST_FIRST =
      Comparator.comparing(BackupRecord::getCreatedAt).thenComparing(BackupRecord::getId);

  private final Map<String, BackupRecord> backups = Maps.newConcurrentMap();

  @Inject
  MemBackupStore(StatsProvider statsProvider) {
    statsProvider.makeGauge(BACKUPS_SIZE, () -> backups.size());
  }

  @Override
  public Optional<BackupRecord> fetchBackup(String backupId) {
    return Optional.ofNullable(backups.get(backupId));
  }

  @Override
  public Iterable<BackupRecord> fetchBackups(String connectionId) {
    return FluentIterable.from(backups.values())
        .filter(backup -> backup.getConnectionId().equals(connectionId))
        .toSortedList(OLDEST_FIRST);
  }

  @Override
  public Iterable<BackupRecord> fetchBackupsOlderThan(String connectionId, Instant cutoff) {
    return FluentIterable.from(fetchBackups(connectionId))
        .filter(backup -> backup.getCreatedAt().isBefore(cutoff))
        .toList();
  }

  @Override
  public void saveBackup(BackupRecord backup) {
    backups.put(backup.getId(), backup);
  }

  @Override
  public void deleteBackup(String backupId) {
    backups.remove(backupId);
  }

  @Override
  public void updateBackupStatusAndSchedule(
      String backupId,
      BackupStatus status,
      String scheduleId) {

    BackupRecord updated = backups.computeIfPresent(
        backupId,
        (id, backup) -> backup.toBuilder().setStatus(status).setScheduleId(scheduleId).build());
    if (updated == null) {
      throw new StorageException("No backup found with id " + backupId);
    }
  }
}
