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
package org.backupd.scheduler.cron;

import com.google.common.collect.ImmutableMap;

import org.backupd.scheduler.storage.entities.BackupSchedule;

/**
 * Owns the live timer registrations of backup schedules, keyed by schedule id.
 * <p>
 * Operations against different schedule ids may run concurrently. Operations against the same
 * schedule id must be serialized by the caller.
 */
public interface TimerRegistry {

  /**
   * Starts firing scheduled backups for {@code snapshot} on every trigger of {@code schedule}.
   * Any registration already held for the snapshot's id is replaced.
   *
   * @param snapshot Schedule state handed to every execution triggered by this registration.
   * @param schedule Parsed form of the snapshot's cron expression.
   * @throws CronException If the timer subsystem rejected the registration.
   */
  void register(BackupSchedule snapshot, CronSchedule schedule) throws CronException;

  /**
   * Stops future firings for a schedule. Executions already running are not interrupted.
   *
   * @param scheduleId Id of the schedule to stop.
   * @throws CronException If the timer subsystem failed to remove a live registration.
   */
  void unregister(String scheduleId) throws CronException;

  /**
   * Fires a registered schedule once, immediately.
   *
   * @param scheduleId Id of the schedule to fire.
   * @throws CronException If the schedule is not registered or could not be triggered.
   */
  void trigger(String scheduleId) throws CronException;

  boolean isRegistered(String scheduleId);

  /**
   * A dump of the live registrations for debugging.
   *
   * @return A map from schedule id to the cron schedule it fires on.
   */
  ImmutableMap<String, CronSchedule> getRegistrations();
}
