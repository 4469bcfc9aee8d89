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

import java.util.concurrent.atomic.AtomicInteger;

import javax.inject.Inject;

import com.google.common.util.concurrent.AbstractIdleService;

import org.backupd.common.stats.StatsProvider;
import org.backupd.scheduler.backup.BackupScheduleManager;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Starts the quartz scheduler and rebuilds timer registrations from stored schedules.
 */
class CronLifecycle extends AbstractIdleService {
  private static final Logger LOG = LoggerFactory.getLogger(CronLifecycle.class);

  private final Scheduler scheduler;
  private final BackupScheduleManager scheduleManager;
  private final AtomicInteger runningFlag;
  private final AtomicInteger loadedSchedules;

  @Inject
  CronLifecycle(
      Scheduler scheduler,
      BackupScheduleManager scheduleManager,
      StatsProvider statsProvider) {

    this.scheduler = requireNonNull(scheduler);
    this.scheduleManager = requireNonNull(scheduleManager);
    this.runningFlag = new AtomicInteger();
    this.loadedSchedules = new AtomicInteger();
    statsProvider.makeGauge("quartz_scheduler_running", runningFlag::get);
    statsProvider.makeGauge("backup_schedules_loaded", loadedSchedules::get);
  }

  @Override
  protected void startUp() throws SchedulerException {
    LOG.info("Starting quartz cron scheduler " + scheduler.getSchedulerName() + ".");
    scheduler.start();
    runningFlag.set(1);

    int restored = scheduleManager.restoreSchedules();
    loadedSchedules.set(restored);
    LOG.info("Restored {} backup schedules.", restored);
  }

  @Override
  protected void shutDown() throws SchedulerException {
    LOG.info("Shutting down quartz cron scheduler.");
    scheduler.shutdown();
    runningFlag.set(0);
  }
}
