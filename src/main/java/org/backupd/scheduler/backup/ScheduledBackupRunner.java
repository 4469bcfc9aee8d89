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

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import org.backupd.common.stats.StatsProvider;
import org.backupd.common.util.Clock;
import org.backupd.scheduler.cron.CronPredictor;
import org.backupd.scheduler.cron.CronSchedule;
import org.backupd.scheduler.cron.FiringHandler;
import org.backupd.scheduler.storage.BackupStore;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupRecord;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Runs a scheduled backup each time a schedule fires: takes the backup, records when the schedule
 * ran and when it runs next, and prunes backups outside the retention window.
 * <p>
 * Every step runs regardless of the outcome of the previous ones. Failures are logged and counted
 * per step, never thrown, so that the schedule keeps firing.
 */
class ScheduledBackupRunner implements FiringHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ScheduledBackupRunner.class);

  @VisibleForTesting
  enum Step {
    CREATE_BACKUP,
    NOTIFY_FAILURE,
    LINK_BACKUP,
    ADVANCE_SCHEDULE,
    PRUNE_BACKUPS;

    String statName() {
      return "scheduled_backup_" + name().toLowerCase(Locale.ENGLISH) + "_failures";
    }
  }

  @VisibleForTesting
  static final String RUNS = "scheduled_backup_runs";

  private final BackupCreator backupCreator;
  private final FailureNotifier failureNotifier;
  private final RetentionPruner retentionPruner;
  private final ScheduleStore.Mutable scheduleStore;
  private final BackupStore.Mutable backupStore;
  private final CronPredictor cronPredictor;
  private final ConnectionLocks locks;
  private final Clock clock;
  private final AtomicLong runs;
  private final Map<Step, AtomicLong> stepFailures;

  @Inject
  ScheduledBackupRunner(
      BackupCreator backupCreator,
      FailureNotifier failureNotifier,
      RetentionPruner retentionPruner,
      ScheduleStore.Mutable scheduleStore,
      BackupStore.Mutable backupStore,
      CronPredictor cronPredictor,
      ConnectionLocks locks,
      Clock clock,
      StatsProvider statsProvider) {

    this.backupCreator = requireNonNull(backupCreator);
    this.failureNotifier = requireNonNull(failureNotifier);
    this.retentionPruner = requireNonNull(retentionPruner);
    this.scheduleStore = requireNonNull(scheduleStore);
    this.backupStore = requireNonNull(backupStore);
    this.cronPredictor = requireNonNull(cronPredictor);
    this.locks = requireNonNull(locks);
    this.clock = requireNonNull(clock);
    this.runs = statsProvider.makeCounter(RUNS);
    this.stepFailures = Maps.toMap(
        ImmutableSet.copyOf(Step.values()),
        step -> statsProvider.makeCounter(step.statName()));
  }

  @Override
  public void onFire(BackupSchedule snapshot) {
    runs.incrementAndGet();
    String connectionId = snapshot.getConnectionId();
    LOG.info("Cron triggered backup of connection {} for schedule {} at {}",
        connectionId,
        snapshot.getId(),
        clock.nowInstant());

    createBackup(snapshot);

    try {
      advanceSchedule(snapshot);
    } catch (RuntimeException e) {
      stepFailed(Step.ADVANCE_SCHEDULE, snapshot, e);
    }

    if (snapshot.getRetentionDays() > 0) {
      try {
        PruneResult result = retentionPruner.pruneBackups(
            connectionId,
            snapshot.getRetentionDays());
        if (!result.isClean()) {
          stepFailures.get(Step.PRUNE_BACKUPS).incrementAndGet();
          LOG.warn("Retention pass for connection {} was incomplete: {}", connectionId, result);
        }
      } catch (RuntimeException e) {
        stepFailed(Step.PRUNE_BACKUPS, snapshot, e);
      }
    }
  }

  private void createBackup(BackupSchedule snapshot) {
    String connectionId = snapshot.getConnectionId();
    BackupRecord backup;
    try {
      backup = backupCreator.createBackup(connectionId);
    } catch (BackupException | RuntimeException e) {
      stepFailed(Step.CREATE_BACKUP, snapshot, e);
      notifyFailure(snapshot, e);
      return;
    }

    try {
      backupStore.updateBackupStatusAndSchedule(
          backup.getId(),
          backup.getStatus(),
          snapshot.getId());
      LOG.info("Scheduled backup {} of connection {} finished with status {}",
          backup.getId(),
          connectionId,
          backup.getStatus());
    } catch (StorageException e) {
      stepFailed(Step.LINK_BACKUP, snapshot, e);
    }
  }

  private void notifyFailure(BackupSchedule snapshot, Exception cause) {
    try {
      failureNotifier.notifyFailure(snapshot.getConnectionId(), cause);
    } catch (RuntimeException e) {
      stepFailed(Step.NOTIFY_FAILURE, snapshot, e);
    }
  }

  private void advanceSchedule(BackupSchedule snapshot) {
    Lock lock = locks.forConnection(snapshot.getConnectionId());
    lock.lock();
    try {
      // Only the bookkeeping fields are written, on top of the current state. Writing back the
      // snapshot would undo any disable or update that happened since it was taken.
      Optional<BackupSchedule> current = scheduleStore.fetchSchedule(snapshot.getConnectionId());
      if (!current.isPresent() || !current.get().getId().equals(snapshot.getId())) {
        stepFailures.get(Step.ADVANCE_SCHEDULE).incrementAndGet();
        LOG.warn("Schedule {} of connection {} is no longer stored, not recording the run.",
            snapshot.getId(),
            snapshot.getConnectionId());
        return;
      }

      BackupSchedule stored = current.get();
      Optional<Instant> nextRun = CronSchedule.tryParse(stored.getCronSchedule())
          .flatMap(cronPredictor::predictNextRun);
      if (!nextRun.isPresent()) {
        LOG.warn("Unable to compute the next run of schedule {} from {}",
            stored.getId(),
            stored.getCronSchedule());
      }

      Instant now = clock.nowInstant();
      scheduleStore.updateSchedule(stored.toBuilder()
          .setNextRunTime(nextRun.orElse(null))
          .setLastBackupTime(now)
          .setUpdatedAt(now)
          .build());
    } finally {
      lock.unlock();
    }
  }

  private void stepFailed(Step step, BackupSchedule snapshot, Exception e) {
    stepFailures.get(step).incrementAndGet();
    LOG.error(String.format(
        "Scheduled backup step %s failed for connection %s (schedule %s): %s",
        step,
        snapshot.getConnectionId(),
        snapshot.getId(),
        e), e);
  }
}
