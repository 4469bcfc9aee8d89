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

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.util.concurrent.ServiceManager;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;

import org.backupd.common.stats.StatsProvider;
import org.backupd.common.stats.testing.FakeStatsProvider;
import org.backupd.common.testing.TearDownTestCase;
import org.backupd.common.util.Clock;
import org.backupd.scheduler.app.BackupSchedulerModule;
import org.backupd.scheduler.backup.BackupCreator;
import org.backupd.scheduler.backup.BackupScheduleManager;
import org.backupd.scheduler.config.CliOptions;
import org.backupd.scheduler.cron.TimerRegistry;
import org.backupd.scheduler.storage.BackupStore;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.entities.BackupRecord;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.backupd.scheduler.storage.entities.BackupStatus;
import org.junit.Before;
import org.junit.Test;
import org.quartz.Scheduler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CronIT extends TearDownTestCase {
  private static final String CONNECTION_ID = "connection-1";
  private static final String EVERY_SECOND = "* * * * * *";
  private static final String YEARLY = "0 0 0 1 1 *";
  // The 30th of February never comes, but Mondays in February do.
  private static final String FEBRUARY_MONDAYS = "0 0 0 30 2 MON";

  @Singleton
  static class CountingBackupCreator implements BackupCreator {
    private final BackupStore.Mutable backupStore;
    private final Clock clock;
    private final AtomicInteger backups = new AtomicInteger();
    private volatile CountDownLatch latch = new CountDownLatch(1);

    @Inject
    CountingBackupCreator(BackupStore.Mutable backupStore, Clock clock) {
      this.backupStore = backupStore;
      this.clock = clock;
    }

    void expectBackups(int count) {
      latch = new CountDownLatch(count);
    }

    boolean awaitBackups() throws InterruptedException {
      return latch.await(10, TimeUnit.SECONDS);
    }

    int getBackups() {
      return backups.get();
    }

    @Override
    public BackupRecord createBackup(String connectionId) {
      String id = UUID.randomUUID().toString();
      BackupRecord backup = BackupRecord.builder()
          .setId(id)
          .setConnectionId(connectionId)
          .setStatus(BackupStatus.SUCCESS)
          .setPath("/backups/" + id + ".dump")
          .setCreatedAt(clock.nowInstant())
          .build();
      backupStore.saveBackup(backup);
      backups.incrementAndGet();
      latch.countDown();
      return backup;
    }
  }

  private Injector injector;
  private CountingBackupCreator backupCreator;
  private BackupScheduleManager scheduleManager;

  @Before
  public void setUp() {
    injector = Guice.createInjector(
        Modules.override(new BackupSchedulerModule(new CliOptions())).with(new AbstractModule() {
          @Override
          protected void configure() {
            bind(StatsProvider.class).toInstance(new FakeStatsProvider());
            bind(BackupCreator.class).to(CountingBackupCreator.class);
          }
        }));
    backupCreator = injector.getInstance(CountingBackupCreator.class);
    scheduleManager = injector.getInstance(BackupScheduleManager.class);
  }

  private ServiceManager boot() {
    ServiceManager services = injector.getInstance(ServiceManager.class);
    services.startAsync().awaitHealthy();
    addTearDown(() -> services.stopAsync().awaitStopped(10, TimeUnit.SECONDS));
    return services;
  }

  @Test
  public void testCronSchedulerLifecycle() throws Exception {
    Scheduler scheduler = injector.getInstance(Scheduler.class);
    assertFalse(scheduler.isStarted());

    ServiceManager services = injector.getInstance(ServiceManager.class);
    services.startAsync().awaitHealthy();
    assertTrue(scheduler.isStarted());

    services.stopAsync().awaitStopped();
    assertTrue(scheduler.isShutdown());
  }

  @Test
  public void testScheduledBackupsRunUntilDisabled() throws Exception {
    boot();
    backupCreator.expectBackups(2);

    scheduleManager.scheduleBackup(CONNECTION_ID, EVERY_SECOND, 7);
    assertTrue(backupCreator.awaitBackups());

    BackupSchedule schedule = scheduleManager.getSchedule(CONNECTION_ID).get();
    assertTrue(schedule.getLastBackupTime().isPresent());
    assertTrue(schedule.getNextRunTime().isPresent());

    scheduleManager.disableBackupSchedule(CONNECTION_ID);
    // Let a run that started before the schedule was disabled finish.
    Thread.sleep(1500);
    int backups = backupCreator.getBackups();
    Thread.sleep(2000);
    assertEquals(backups, backupCreator.getBackups());
    assertFalse(scheduleManager.getSchedule(CONNECTION_ID).get().isEnabled());
  }

  @Test
  public void testSchedulesAreRestoredOnStartup() throws Exception {
    injector.getInstance(ScheduleStore.Mutable.class).createSchedule(BackupSchedule.builder()
        .setId("restored")
        .setConnectionId(CONNECTION_ID)
        .setEnabled(true)
        .setCronSchedule(EVERY_SECOND)
        .setRetentionDays(0)
        .setCreatedAt(Instant.EPOCH)
        .setUpdatedAt(Instant.EPOCH)
        .build());

    boot();

    assertTrue(backupCreator.awaitBackups());
  }

  @Test
  public void testStartBackupNow() throws Exception {
    boot();

    scheduleManager.scheduleBackup(CONNECTION_ID, YEARLY, 7);
    scheduleManager.startBackupNow(CONNECTION_ID);

    assertTrue(backupCreator.awaitBackups());
    assertEquals(1, backupCreator.getBackups());
  }

  @Test
  public void testDeadDayOfMonthHalfStillRegisters() throws Exception {
    boot();

    BackupSchedule schedule = scheduleManager.scheduleBackup(CONNECTION_ID, FEBRUARY_MONDAYS, 7);

    assertTrue(schedule.isEnabled());
    assertTrue(schedule.getNextRunTime().isPresent());
    assertTrue(injector.getInstance(TimerRegistry.class).isRegistered(schedule.getId()));
  }
}
