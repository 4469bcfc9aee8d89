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
package org.backupd.scheduler.cron.quartz;

import java.util.Date;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;

import javax.inject.Inject;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.backupd.scheduler.cron.CronException;
import org.backupd.scheduler.cron.CronSchedule;
import org.backupd.scheduler.cron.TimerRegistry;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * A timer registry backed by a Quartz {@link Scheduler}. Every registered schedule is a Quartz job
 * whose job data carries the schedule snapshot handed to {@link BackupCronJob}.
 * <p>
 * NOTE: The registration map is the source of truth for which schedules are live. Quartz job keys
 * never leave this class.
 */
class QuartzTimerRegistry implements TimerRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(QuartzTimerRegistry.class);

  private final Scheduler scheduler;
  private final TimeZone timeZone;
  private final Map<String, CronSchedule> registrations = Maps.newConcurrentMap();

  @Inject
  QuartzTimerRegistry(Scheduler scheduler, TimeZone timeZone) {
    this.scheduler = requireNonNull(scheduler);
    this.timeZone = requireNonNull(timeZone);
  }

  @Override
  public void register(BackupSchedule snapshot, CronSchedule schedule) throws CronException {
    requireNonNull(snapshot);
    requireNonNull(schedule);

    String scheduleId = snapshot.getId();
    JobKey jobKey = Quartz.jobKey(scheduleId);
    // Quartz measures trigger start times against the wall clock.
    Set<Trigger> triggers = Quartz.cronTriggers(jobKey, schedule, timeZone, new Date());
    if (triggers.isEmpty()) {
      throw new CronException(
          String.format("Schedule %s for %s will never fire.", schedule, scheduleId));
    }

    if (registrations.containsKey(scheduleId)) {
      // Replacing the job alone would leave the previous triggers firing it.
      unregister(scheduleId);
    }

    try {
      scheduler.scheduleJob(
          Quartz.jobDetail(jobKey, BackupCronJob.class, snapshot),
          triggers,
          false);
    } catch (SchedulerException e) {
      throw new CronException(
          String.format("Failed to schedule %s with schedule %s.", scheduleId, schedule), e);
    }
    registrations.put(scheduleId, schedule);
    LOG.info("Scheduled backups of connection {} ({}) with schedule {}.",
        snapshot.getConnectionId(),
        scheduleId,
        schedule);
  }

  @Override
  public void unregister(String scheduleId) throws CronException {
    requireNonNull(scheduleId);

    if (!registrations.containsKey(scheduleId)) {
      LOG.debug("No registration to remove for {}.", scheduleId);
      return;
    }

    try {
      // Executions that already started are left to run to completion.
      scheduler.deleteJob(Quartz.jobKey(scheduleId));
    } catch (SchedulerException e) {
      throw new CronException("Error descheduling " + scheduleId, e);
    }
    registrations.remove(scheduleId);
    LOG.info("Successfully descheduled {}.", scheduleId);
  }

  @Override
  public void trigger(String scheduleId) throws CronException {
    requireNonNull(scheduleId);

    if (!registrations.containsKey(scheduleId)) {
      throw new CronException("No registration found for " + scheduleId);
    }

    try {
      scheduler.triggerJob(Quartz.jobKey(scheduleId));
    } catch (SchedulerException e) {
      throw new CronException("Failed to trigger " + scheduleId, e);
    }
    LOG.info("Triggered backup for {}.", scheduleId);
  }

  @Override
  public boolean isRegistered(String scheduleId) {
    return registrations.containsKey(scheduleId);
  }

  @Override
  public ImmutableMap<String, CronSchedule> getRegistrations() {
    return ImmutableMap.copyOf(registrations);
  }
}
