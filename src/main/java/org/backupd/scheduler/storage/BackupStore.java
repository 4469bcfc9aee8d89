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
package org.backupd.scheduler.storage;

import java.time.Instant;
import java.util.Optional;

import org.backupd.scheduler.storage.entities.BackupRecord;
import org.backupd.scheduler.storage.entities.BackupStatus;

/**
 * Stores the history of backups taken for connections.
 */
public interface BackupStore {

  Optional<BackupRecord> fetchBackup(String backupId);

  /**
   * Fetches all backups of a connection.
   *
   * @param connectionId Connection to fetch backups for.
   * @return The connection's backups, oldest first.
   */
  Iterable<BackupRecord> fetchBackups(String connectionId);

  /**
   * Fetches the backups of a connection created strictly before {@code cutoff}.
   *
   * @param connectionId Connection to fetch backups for.
   * @param cutoff Exclusive upper bound on the creation time.
   * @return Matching backups, oldest first.
   */
  Iterable<BackupRecord> fetchBackupsOlderThan(String connectionId, Instant cutoff);

  interface Mutable extends BackupStore {

    void saveBackup(BackupRecord backup) throws StorageException;

    /**
     * Removes a backup record. Removing an unknown backup is a no-op.
     *
     * @param backupId Backup to remove.
     * @throws StorageException If the write failed.
     */
    void deleteBackup(String backupId) throws StorageException;

    /**
     * Records the outcome of a scheduled backup and links it to the schedule that produced it.
     *
     * @param backupId Backup to update.
     * @param status New status of the backup.
     * @param scheduleId Schedule that triggered the backup.
     * @throws StorageException If the backup does not exist or the write failed.
     */
    void updateBackupStatusAndSchedule(String backupId, BackupStatus status, String scheduleId)
        throws StorageException;
  }
}
