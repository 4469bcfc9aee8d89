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

import java.util.Optional;

import org.backupd.scheduler.storage.entities.BackupSchedule;

/**
 * Stores backup schedules, at most one per connection.
 */
public interface ScheduleStore {

  /**
   * Fetches the schedule owned by a connection.
   *
   * @param connectionId Connection to fetch the schedule for.
   * @return The connection's schedule, if it has one.
   */
  Optional<BackupSchedule> fetchSchedule(String connectionId);

  /**
   * Fetches all stored schedules, enabled or not.
   *
   * @return All schedules.
   */
  Iterable<BackupSchedule> fetchSchedules();

  interface Mutable extends ScheduleStore {

    /**
     * Inserts a schedule for a connection that does not have one yet.
     *
     * @param schedule Schedule to insert.
     * @throws StorageException If the connection already owns a schedule or the write failed.
     */
    void createSchedule(BackupSchedule schedule) throws StorageException;

    /**
     * Replaces the stored schedule sharing the id and connection of {@code schedule}.
     *
     * @param schedule New state of the schedule.
     * @throws StorageException If no such schedule exists or the write failed.
     */
    void updateSchedule(BackupSchedule schedule) throws StorageException;
  }
}
