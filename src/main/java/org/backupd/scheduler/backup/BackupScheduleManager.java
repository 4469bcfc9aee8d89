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

import java.util.Optional;

import org.backupd.scheduler.storage.entities.BackupSchedule;

/**
 * Manages the persisted backup schedules of connections together with their live timers.
 * <p>
 * Mutations for the same connection are serialized. After any successful mutation, an enabled
 * schedule has exactly one live timer and a disabled schedule has none.
 */
public interface BackupScheduleManager {

  /**
   * Enables automatic backups of a connection, creating its schedule or overwriting the existing
   * one. Repeated calls converge to a single stored schedule with a single timer.
   *
   * @param connectionId Connection to back up.
   * @param cronSchedule Six-field cron expression.
   * @param retentionDays Days to keep backups for, 0 to keep them forever.
   * @return The stored schedule.
   * @throws InvalidScheduleExpressionException If the expression is invalid; nothing was changed.
   * @throws SchedulePersistenceException If storage could not be read or written.
   * @throws SchedulingException If the timer could not be replaced after the schedule was stored.
   */
  BackupSchedule scheduleBackup(String connectionId, String cronSchedule, int retentionDays)
      throws ScheduleException;

  /**
   * Changes the expression and retention of an existing schedule without changing whether it is
   * enabled.
   *
   * @param connectionId Connection owning the schedule.
   * @param cronSchedule Six-field cron expression.
   * @param retentionDays Days to keep backups for, 0 to keep them forever.
   * @return The stored schedule.
   * @throws ScheduleNotFoundException If the connection has no schedule.
   * @throws InvalidScheduleExpressionException If the expression is invalid; nothing was changed.
   * @throws SchedulePersistenceException If storage could not be read or written.
   * @throws SchedulingException If the timer could not be replaced after the schedule was stored.
   */
  BackupSchedule updateBackupSchedule(String connectionId, String cronSchedule, int retentionDays)
      throws ScheduleException;

  /**
   * Stops automatic backups of a connection. The schedule is kept, disabled. Disabling a disabled
   * schedule succeeds. A backup already running is not interrupted.
   *
   * @param connectionId Connection owning the schedule.
   * @throws ScheduleNotFoundException If the connection has no schedule.
   * @throws SchedulingException If the timer could not be removed; nothing was changed.
   * @throws SchedulePersistenceException If storage could not be read or written.
   */
  void disableBackupSchedule(String connectionId) throws ScheduleException;

  /**
   * Fetches the schedule of a connection.
   *
   * @param connectionId Connection owning the schedule.
   * @return The stored schedule, if any.
   * @throws SchedulePersistenceException If storage could not be read.
   */
  Optional<BackupSchedule> getSchedule(String connectionId) throws ScheduleException;

  /**
   * Runs the scheduled backup of a connection once, now, in addition to its regular firings.
   *
   * @param connectionId Connection owning the schedule.
   * @throws ScheduleNotFoundException If the connection has no schedule.
   * @throws SchedulingException If the schedule is disabled or could not be fired.
   * @throws SchedulePersistenceException If storage could not be read.
   */
  void startBackupNow(String connectionId) throws ScheduleException;

  /**
   * Brings timers in line with storage: registers every enabled schedule and refreshes its next
   * run time, and removes timers of disabled ones. Safe to call repeatedly. Schedules that cannot
   * be restored are logged and skipped.
   *
   * @return The number of schedules with a live timer afterwards.
   */
  int restoreSchedules();
}
