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
package org.backupd.scheduler.backup;

import org.backupd.scheduler.storage.entities.BackupRecord;

/**
 * Takes a backup of a connection.
 */
public interface BackupCreator {

  /**
   * Creates a backup of a connection, blocking until it completes. The returned record is already
   * stored.
   *
   * @param connectionId Connection to back up.
   * @return The stored record of the new backup.
   * @throws BackupException If the backup failed.
   */
  BackupRecord createBackup(String connectionId) throws BackupException;
}
