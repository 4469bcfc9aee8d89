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
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

import org.backupd.common.stats.StatsProvider;
import org.backupd.common.util.Clock;
import org.backupd.scheduler.cron.CronException;
import org.backupd.scheduler.cron.CronPredictor;
import org.backupd.scheduler.cron.CronSchedule;
import org.backupd.scheduler.cron.TimerRegistry;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * NOTE: The schedule store is the source of truth. A schedule is always written before its timer
 * is registered, so a timer never exists for a schedule that was not stored.
 */
class BackupScheduleManagerImpl implements BackupScheduleManager {
  private static final Logger LOG = LoggerFactory.getLogger(BackupScheduleManagerImpl.class);

  @VisibleForTesting
  static final String SCHEDULES_CREATED = "backup_schedules_created";
  @VisibleForTesting
  static final String SCHEDULES_UPDATED = "backup_schedules_updated";
  @VisibleForTesting
  static final String SCHEDULES_DISABLED = "backup_schedules_disabled";
  @VisibleForTesting
  static final String RESTORE_FAILURES = "backup_schedule_restore_failures";

  private final ScheduleStore.Mutable scheduleStore;
  private final TimerRegistry timerRegistry;
  private final CronPredictor cronPredictor;
  private final ConnectionLocks locks;
  private final Clock clock;

  private final AtomicLong schedulesCreated;
  private final AtomicLong schedulesUpdated;
  private final AtomicLong schedulesDisabled;
  private final AtomicLong restoreFailures;

  @Inject
  BackupScheduleManagerImpl(
      ScheduleStore.Mutable scheduleStore,
      TimerRegistry timerRegistry,
      CronPredictor cronPredictor,
      ConnectionLocks locks,
      Clock clock,
      StatsProvider statsProvider) {

    this.scheduleStore = requireNonNull(scheduleStore);
    this.timerRegistry = requireNonNull(timerRegistry);
    this.cronPredictor = requireNonNull(cronPredictor);
    this.locks = requireNonNull(locks);
    this.clock = requireNonNull(clock);
    this.schedulesCreated = statsProvider.makeCounter(SCHEDULES_CREATED);
    this.schedulesUpdated = statsProvider.makeCounter(SCHEDULES_UPDATED);
    this.schedulesDisabled = statsProvider.makeCounter(SCHEDULES_DISABLED);
    this.restoreFailures = statsProvider.makeCounter(RESTORE_FAILURES);
  }

  @Override
  public BackupSchedule scheduleBackup(
      String connectionId,
      String cronSchedule,
      int retentionDays) throws ScheduleException {

    requireNonNull(connectionId);
    requireNonNull(cronSchedule);
    checkArgument(retentionDays >= 0, "Retention days must be non-negative: %s", retentionDays);

    Lock lock = locks.forConnection(connectionId);
    lock.lock();
    try {
      Optional<BackupSchedule> existing = fetchSchedule(connectionId);
      CronSchedule parsed = parseSchedule(cronSchedule);
      Instant nextRun = predictNextRun(parsed, cronSchedule);
      Instant now = clock.nowInstant();

      BackupSchedule schedule;
      if (existing.isPresent()) {
        schedule = existing.get().toBuilder()
            .setEnabled(true)
            .setCronSchedule(cronSchedule)
            .setRetentionDays(retentionDays)
            .setNextRunTime(nextRun)
            .setUpdatedAt(now)
            .build();
        write(() -> scheduleStore.updateSchedule(schedule), schedule);
        replaceTimer(schedule, parsed);
        schedulesUpdated.incrementAndGet();
      } else {
        schedule = BackupSchedule.builder()
            .setId(UUID.randomUUID().toString())
            .setConnectionId(connectionId)
            .setEnabled(true)
            .setCronSchedule(cronSchedule)
            .setRetentionDays(retentionDays)
            .setNextRunTime(nextRun)
            .setCreatedAt(now)
            .setUpdatedAt(now)
            .build();
        write(() -> scheduleStore.createSchedule(schedule), schedule);
        registerTimer(schedule, parsed);
        schedulesCreated.incrementAndGet();
      }

      LOG.info("Backups of connection {} scheduled with {}, next run at {}.",
          connectionId,
          cronSchedule,
          nextRun);
      return schedule;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public BackupSchedule updateBackupSchedule(
      String connectionId,
      String cronSchedule,
      int retentionDays) throws ScheduleException {

    requireNonNull(connectionId);
    requireNonNull(cronSchedule);
    checkArgument(retentionDays >= 0, "Retention days must be non-negative: %s", retentionDays);

    Lock lock = locks.forConnection(connectionId);
    lock.lock();
    try {
      BackupSchedule existing = requireSchedule(connectionId);
      CronSchedule parsed = parseSchedule(cronSchedule);
      Instant nextRun = predictNextRun(parsed, cronSchedule);

      BackupSchedule schedule = existing.toBuilder()
          .setCronSchedule(cronSchedule)
          .setRetentionDays(retentionDays)
          .setNextRunTime(nextRun)
          .setUpdatedAt(clock.nowInstant())
          .build();
      write(() -> scheduleStore.updateSchedule(schedule), schedule);

      if (schedule.isEnabled()) {
        replaceTimer(schedule, parsed);
      } else {
        // A disabled schedule keeps no timer, even one left behind by an earlier failure.
        removeTimer(schedule);
      }
      schedulesUpdated.incrementAndGet();

      LOG.info("Backup schedule of connection {} updated to {}.", connectionId, cronSchedule);
      return schedule;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void disableBackupSchedule(String connectionId) throws ScheduleException {
    requireNonNull(connectionId);

    Lock lock = locks.forConnection(connectionId);
    lock.lock();
    try {
      BackupSchedule existing = requireSchedule(connectionId);
      removeTimer(existing);

      BackupSchedule schedule = existing.toBuilder()
          .setEnabled(false)
          .setUpdatedAt(clock.nowInstant())
          .build();
      write(() -> scheduleStore.updateSchedule(schedule), schedule);
      schedulesDisabled.incrementAndGet();

      LOG.info("Backup schedule of connection {} disabled.", connectionId);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<BackupSchedule> getSchedule(String connectionId) throws ScheduleException {
    return fetchSchedule(requireNonNull(connectionId));
  }

  @Override
  public void startBackupNow(String connectionId) throws ScheduleException {
    requireNonNull(connectionId);

    Lock lock = locks.forConnection(connectionId);
    lock.lock();
    try {
      BackupSchedule schedule = requireSchedule(connectionId);
      if (!schedule.isEnabled()) {
        throw new SchedulingException(
            "Backup schedule of connection " + connectionId + " is disabled");
      }

      try {
        timerRegistry.trigger(schedule.getId());
      } catch (CronException e) {
        throw new SchedulingException(
            "Failed to start backup of connection " + connectionId + ": " + e.getMessage(), e);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int restoreSchedules() {
    int registered = 0;
    for (BackupSchedule schedule : ImmutableList.copyOf(scheduleStore.fetchSchedules())) {
      Lock lock = locks.forConnection(schedule.getConnectionId());
      lock.lock();
      try {
        if (restoreSchedule(schedule)) {
          registered++;
        }
      } finally {
        lock.unlock();
      }
    }
    return registered;
  }

  private boolean restoreSchedule(BackupSchedule schedule) {
    if (!schedule.isEnabled()) {
      try {
        removeTimer(schedule);
      } catch (SchedulingException e) {
        restoreFailures.incrementAndGet();
        LOG.error("Failed to remove timer of disabled schedule " + schedule.getId(), e);
      }
      return false;
    }

    Optional<CronSchedule> parsed = CronSchedule.tryParse(schedule.getCronSchedule());
    if (!parsed.isPresent()) {
      restoreFailures.incrementAndGet();
      LOG.error("Invalid cron schedule {} stored for {}, not restoring it.",
          schedule.getCronSchedule(),
          schedule.getId());
      return false;
    }

    BackupSchedule refreshed = schedule.toBuilder()
        .setNextRunTime(cronPredictor.predictNextRun(parsed.get()).orElse(null))
        .build();
    try {
      scheduleStore.updateSchedule(refreshed);
    } catch (StorageException e) {
      // The timer is still registered; a stale next run time only affects reporting.
      LOG.warn("Failed to refresh next run time of schedule " + schedule.getId(), e);
    }

    try {
      timerRegistry.register(refreshed, parsed.get());
      return true;
    } catch (CronException e) {
      restoreFailures.incrementAndGet();
      LOG.error("Scheduling failed for recovered schedule " + schedule, e);
      return false;
    }
  }

  private Optional<BackupSchedule> fetchSchedule(String connectionId)
      throws SchedulePersistenceException {

    try {
      return scheduleStore.fetchSchedule(connectionId);
    } catch (StorageException e) {
      throw new SchedulePersistenceException(
          "Failed to check existing schedule of connection " + connectionId, e);
    }
  }

  private BackupSchedule requireSchedule(String connectionId) throws ScheduleException {
    Optional<BackupSchedule> schedule = fetchSchedule(connectionId);
    if (!schedule.isPresent()) {
      throw new ScheduleNotFoundException(connectionId);
    }
    return schedule.get();
  }

  private static CronSchedule parseSchedule(String cronSchedule)
      throws InvalidScheduleExpressionException {

    try {
      return CronSchedule.parse(cronSchedule);
    } catch (IllegalArgumentException e) {
      throw new InvalidScheduleExpressionException(
          "Invalid cron schedule " + cronSchedule + ": " + e.getMessage(), e);
    }
  }

  private Instant predictNextRun(CronSchedule parsed, String cronSchedule)
      throws InvalidScheduleExpressionException {

    Optional<Instant> nextRun = cronPredictor.predictNextRun(parsed);
    if (!nextRun.isPresent()) {
      throw new InvalidScheduleExpressionException(
          "Cron schedule " + cronSchedule + " never fires");
    }
    return nextRun.get();
  }

  private interface StoreWrite {
    void apply() throws StorageException;
  }

  private static void write(StoreWrite write, BackupSchedule schedule)
      throws SchedulePersistenceException {

    try {
      write.apply();
    } catch (StorageException e) {
      throw new SchedulePersistenceException(
          "Failed to save backup schedule of connection " + schedule.getConnectionId(), e);
    }
  }

  private void replaceTimer(BackupSchedule schedule, CronSchedule parsed)
      throws SchedulingException {

    removeTimer(schedule);
    registerTimer(schedule, parsed);
  }

  private void registerTimer(BackupSchedule schedule, CronSchedule parsed)
      throws SchedulingException {

    try {
      timerRegistry.register(schedule, parsed);
    } catch (CronException e) {
      LOG.error("Schedule {} is stored but has no timer.", schedule.getId());
      throw new SchedulingException(
          "Failed to schedule backups of connection " + schedule.getConnectionId(), e);
    }
  }

  private void removeTimer(BackupSchedule schedule) throws SchedulingException {
    try {
      timerRegistry.unregister(schedule.getId());
    } catch (CronException e) {
      throw new SchedulingException(
          "Failed to deschedule backups of connection " + schedule.getConnectionId(), e);
    }
  }
}
