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

import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;

import org.backupd.common.stats.StatsProvider;
import org.backupd.scheduler.cron.FiringHandler;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkState;

/**
 * Encapsulates a single trigger of a single backup schedule. Executions of different schedules
 * run concurrently on the quartz thread pool, but only a single execution is active at a time per
 * schedule.
 */
@DisallowConcurrentExecution
class BackupCronJob implements Job {
  private static final Logger LOG = LoggerFactory.getLogger(BackupCronJob.class);

  @VisibleForTesting
  static final String TRIGGERS = "backup_cron_triggers";
  @VisibleForTesting
  static final String MISFIRES = "backup_cron_misfires";

  private final FiringHandler firingHandler;
  private final AtomicLong triggers;
  private final AtomicLong misfires;

  @Inject
  BackupCronJob(FiringHandler firingHandler, StatsProvider statsProvider) {
    this.firingHandler = requireNonNull(firingHandler);
    this.triggers = statsProvider.makeCounter(TRIGGERS);
    this.misfires = statsProvider.makeCounter(MISFIRES);
  }

  @Override
  public void execute(JobExecutionContext context) {
    // We assume quartz prevents concurrent runs of this job for a given schedule.
    checkState(context.getJobDetail().isConcurrentExectionDisallowed());

    doExecute(context);
  }

  @VisibleForTesting
  void doExecute(JobExecutionContext context) {
    Object snapshot = context.getJobDetail().getJobDataMap().get(Quartz.SNAPSHOT_KEY);
    if (!(snapshot instanceof BackupSchedule)) {
      LOG.warn("Cron was triggered for {} but it carries no schedule.",
          context.getJobDetail().getKey());
      misfires.incrementAndGet();
      return;
    }

    triggers.incrementAndGet();
    firingHandler.onFire((BackupSchedule) snapshot);
  }
}
