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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;

import org.backupd.common.stats.StatsProvider;
import org.backupd.common.stats.testing.FakeStatsProvider;
import org.backupd.common.testing.easymock.EasyMockTest;
import org.backupd.common.util.Clock;
import org.backupd.common.util.testing.FakeClock;
import org.backupd.scheduler.app.BackupSchedulerModule;
import org.backupd.scheduler.config.CliOptions;
import org.backupd.scheduler.cron.CronException;
import org.backupd.scheduler.cron.CronPredictor;
import org.backupd.scheduler.cron.CronSchedule;
import org.backupd.scheduler.cron.TimerRegistry;
import org.backupd.scheduler.storage.ScheduleStore;
import org.backupd.scheduler.storage.StorageException;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.easymock.Capture;
import org.junit.Before;
import org.junit.Test;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BackupScheduleManagerImplTest extends EasyMockTest {
  private static final String CONNECTION_ID = "connection-1";
  private static final String HOURLY = "0 0 * * * *";
  private static final String DAILY = "0 30 2 * * *";
  private static final Instant NOW = Instant.parse("2024-03-05T10:15:42Z");

  private FakeClock clock;
  private FakeStatsProvider statsProvider;
  private TimerRegistry timerRegistry;
  private ScheduleStore.Mutable scheduleStore;
  private BackupScheduleManager scheduleManager;

  @Before
  public void setUp() {
    clock = new FakeClock();
    clock.setNow(NOW);
    statsProvider = new FakeStatsProvider();
    timerRegistry = createMock(TimerRegistry.class);
    BackupCreator backupCreator = createMock(BackupCreator.class);

    Injector injector = Guice.createInjector(
        Modules.override(new BackupSchedulerModule(new CliOptions())).with(new AbstractModule() {
          @Override
          protected void configure() {
            bind(Clock.class).toInstance(clock);
            bind(StatsProvider.class).toInstance(statsProvider);
            bind(TimerRegistry.class).toInstance(timerRegistry);
            bind(BackupCreator.class).toInstance(backupCreator);
          }
        }));
    scheduleStore = injector.getInstance(ScheduleStore.Mutable.class);
    scheduleManager = injector.getInstance(BackupScheduleManager.class);
  }

  private Capture<BackupSchedule> expectRegister(String cronSchedule) throws Exception {
    Capture<BackupSchedule> snapshot = createCapture();
    timerRegistry.register(capture(snapshot), eq(CronSchedule.parse(cronSchedule)));
    return snapshot;
  }

  private void expectUnregister() throws Exception {
    timerRegistry.unregister(anyObject());
  }

  private BackupSchedule stored() {
    return scheduleStore.fetchSchedule(CONNECTION_ID).get();
  }

  @Test
  public void testScheduleBackup() throws Exception {
    Capture<BackupSchedule> snapshot = expectRegister(HOURLY);

    control.replay();

    BackupSchedule schedule = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);

    assertTrue(schedule.isEnabled());
    assertEquals(CONNECTION_ID, schedule.getConnectionId());
    assertEquals(HOURLY, schedule.getCronSchedule());
    assertEquals(7, schedule.getRetentionDays());
    assertEquals(Optional.of(Instant.parse("2024-03-05T11:00:00Z")), schedule.getNextRunTime());
    assertEquals(Optional.empty(), schedule.getLastBackupTime());
    assertEquals(NOW, schedule.getCreatedAt());
    assertEquals(NOW, schedule.getUpdatedAt());
    assertEquals(schedule, stored());
    assertEquals(schedule, snapshot.getValue());
    assertEquals(1L, statsProvider.getLongValue(BackupScheduleManagerImpl.SCHEDULES_CREATED));
  }

  @Test
  public void testScheduleBackupTwiceConverges() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();
    Capture<BackupSchedule> replacement = expectRegister(DAILY);

    control.replay();

    BackupSchedule first = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    clock.advance(Duration.ofMinutes(5));
    BackupSchedule second = scheduleManager.scheduleBackup(CONNECTION_ID, DAILY, 3);

    assertEquals(first.getId(), second.getId());
    assertEquals(first.getCreatedAt(), second.getCreatedAt());
    assertEquals(DAILY, second.getCronSchedule());
    assertEquals(3, second.getRetentionDays());
    assertEquals(Optional.of(Instant.parse("2024-03-06T02:30:00Z")), second.getNextRunTime());
    assertEquals(second, stored());
    assertEquals(second, replacement.getValue());
    assertEquals(1, Iterables.size(scheduleStore.fetchSchedules()));
  }

  @Test
  public void testScheduleBackupReenables() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();
    expectLastCall().times(2);
    expectRegister(HOURLY);

    control.replay();

    scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    scheduleManager.disableBackupSchedule(CONNECTION_ID);
    BackupSchedule schedule = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);

    assertTrue(schedule.isEnabled());
    assertTrue(stored().isEnabled());
  }

  @Test
  public void testScheduleBackupInvalidExpression() throws Exception {
    control.replay();

    for (String invalid : ImmutableList.of("0 0 * * *", "0 0 * * * * *", "61 * * * * *", "x")) {
      try {
        scheduleManager.scheduleBackup(CONNECTION_ID, invalid, 7);
        fail();
      } catch (InvalidScheduleExpressionException e) {
        // Expected.
      }
    }
    assertEquals(Optional.empty(), scheduleStore.fetchSchedule(CONNECTION_ID));
  }

  @Test
  public void testScheduleBackupTimerFailure() throws Exception {
    expectRegister(HOURLY);
    expectLastCall().andThrow(new CronException("rejected"));

    control.replay();

    try {
      scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
      fail();
    } catch (SchedulingException e) {
      // Expected.
    }
    // The schedule is stored, and the next restore registers its timer.
    assertTrue(stored().isEnabled());
  }

  @Test
  public void testUpdateBackupSchedule() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();
    Capture<BackupSchedule> snapshot = expectRegister(DAILY);

    control.replay();

    BackupSchedule original = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    clock.advance(Duration.ofMinutes(1));
    BackupSchedule updated = scheduleManager.updateBackupSchedule(CONNECTION_ID, DAILY, 30);

    assertEquals(original.getId(), updated.getId());
    assertEquals(DAILY, updated.getCronSchedule());
    assertEquals(30, updated.getRetentionDays());
    assertEquals(Optional.of(Instant.parse("2024-03-06T02:30:00Z")), updated.getNextRunTime());
    assertEquals(NOW.plusSeconds(60), updated.getUpdatedAt());
    assertEquals(original.getCreatedAt(), updated.getCreatedAt());
    assertEquals(updated, stored());
    assertEquals(updated, snapshot.getValue());
  }

  @Test
  public void testUpdateInvalidExpressionLeavesScheduleUnchanged() throws Exception {
    expectRegister(HOURLY);

    control.replay();

    BackupSchedule original = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    try {
      scheduleManager.updateBackupSchedule(CONNECTION_ID, "0 0 * * *", 3);
      fail();
    } catch (InvalidScheduleExpressionException e) {
      // Expected.
    }
    assertEquals(original, stored());
  }

  @Test(expected = ScheduleNotFoundException.class)
  public void testUpdateNotFound() throws Exception {
    control.replay();

    scheduleManager.updateBackupSchedule(CONNECTION_ID, HOURLY, 7);
  }

  @Test
  public void testUpdateDisabledScheduleKeepsNoTimer() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();
    expectLastCall().times(2);

    control.replay();

    scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    scheduleManager.disableBackupSchedule(CONNECTION_ID);
    BackupSchedule updated = scheduleManager.updateBackupSchedule(CONNECTION_ID, DAILY, 7);

    assertFalse(updated.isEnabled());
    assertEquals(DAILY, stored().getCronSchedule());
    assertFalse(stored().isEnabled());
  }

  @Test
  public void testDisableBackupSchedule() throws Exception {
    Capture<BackupSchedule> snapshot = expectRegister(HOURLY);
    timerRegistry.unregister(anyObject());
    expectLastCall().times(2);

    control.replay();

    BackupSchedule original = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    scheduleManager.disableBackupSchedule(CONNECTION_ID);
    BackupSchedule disabled = stored();
    scheduleManager.disableBackupSchedule(CONNECTION_ID);

    assertFalse(stored().isEnabled());
    assertEquals(original.getId(), disabled.getId());
    assertEquals(HOURLY, disabled.getCronSchedule());
    assertEquals(snapshot.getValue().getId(), disabled.getId());
    assertEquals(2L, statsProvider.getLongValue(BackupScheduleManagerImpl.SCHEDULES_DISABLED));
  }

  @Test(expected = ScheduleNotFoundException.class)
  public void testDisableNotFound() throws Exception {
    control.replay();

    scheduleManager.disableBackupSchedule(CONNECTION_ID);
  }

  @Test
  public void testDisableTimerFailureKeepsScheduleEnabled() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();
    expectLastCall().andThrow(new CronException("busy"));

    control.replay();

    scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    try {
      scheduleManager.disableBackupSchedule(CONNECTION_ID);
      fail();
    } catch (SchedulingException e) {
      // Expected.
    }
    assertTrue(stored().isEnabled());
  }

  @Test
  public void testGetSchedule() throws Exception {
    expectRegister(HOURLY);

    control.replay();

    assertEquals(Optional.empty(), scheduleManager.getSchedule(CONNECTION_ID));
    BackupSchedule schedule = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    assertEquals(Optional.of(schedule), scheduleManager.getSchedule(CONNECTION_ID));
  }

  @Test
  public void testStartBackupNow() throws Exception {
    expectRegister(HOURLY);
    Capture<String> triggered = createCapture();
    timerRegistry.trigger(capture(triggered));

    control.replay();

    BackupSchedule schedule = scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    scheduleManager.startBackupNow(CONNECTION_ID);
    assertEquals(schedule.getId(), triggered.getValue());
  }

  @Test
  public void testStartBackupNowDisabled() throws Exception {
    expectRegister(HOURLY);
    expectUnregister();

    control.replay();

    scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
    scheduleManager.disableBackupSchedule(CONNECTION_ID);
    try {
      scheduleManager.startBackupNow(CONNECTION_ID);
      fail();
    } catch (SchedulingException e) {
      // Expected.
    }
  }

  @Test(expected = ScheduleNotFoundException.class)
  public void testStartBackupNowNotFound() throws Exception {
    control.replay();

    scheduleManager.startBackupNow(CONNECTION_ID);
  }

  @Test
  public void testRestoreSchedules() throws Exception {
    BackupSchedule enabled = BackupSchedule.builder()
        .setId("enabled")
        .setConnectionId("a")
        .setEnabled(true)
        .setCronSchedule(HOURLY)
        .setRetentionDays(7)
        .setCreatedAt(Instant.EPOCH)
        .setUpdatedAt(Instant.EPOCH)
        .build();
    BackupSchedule disabled = enabled.toBuilder()
        .setId("disabled")
        .setConnectionId("b")
        .setEnabled(false)
        .build();
    BackupSchedule corrupt = enabled.toBuilder()
        .setId("corrupt")
        .setConnectionId("c")
        .setCronSchedule("every hour")
        .build();
    scheduleStore.createSchedule(enabled);
    scheduleStore.createSchedule(disabled);
    scheduleStore.createSchedule(corrupt);

    Capture<BackupSchedule> snapshot = expectRegister(HOURLY);
    timerRegistry.unregister("disabled");

    control.replay();

    assertEquals(1, scheduleManager.restoreSchedules());

    BackupSchedule restored = scheduleStore.fetchSchedule("a").get();
    assertEquals(Optional.of(Instant.parse("2024-03-05T11:00:00Z")), restored.getNextRunTime());
    assertEquals(restored, snapshot.getValue());
    assertEquals(disabled, scheduleStore.fetchSchedule("b").get());
    assertEquals(1L, statsProvider.getLongValue(BackupScheduleManagerImpl.RESTORE_FAILURES));
  }

  @Test
  public void testConcurrentScheduleBackupConverges() throws Exception {
    int callers = 8;
    timerRegistry.register(anyObject(), anyObject());
    expectLastCall().times(callers);
    expectUnregister();
    expectLastCall().times(callers - 1);

    control.replay();

    ExecutorService executor = Executors.newFixedThreadPool(callers);
    addTearDown(executor::shutdownNow);
    List<Callable<BackupSchedule>> calls = Lists.newArrayList();
    for (int i = 0; i < callers; i++) {
      int retentionDays = i;
      calls.add(() -> scheduleManager.scheduleBackup(CONNECTION_ID, HOURLY, retentionDays));
    }
    List<String> ids = Lists.newArrayList();
    for (Future<BackupSchedule> result : executor.invokeAll(calls)) {
      ids.add(result.get().getId());
    }

    assertEquals(1, Iterables.size(scheduleStore.fetchSchedules()));
    for (String id : ids) {
      assertEquals(stored().getId(), id);
    }
  }

  @Test
  public void testPersistenceFailure() throws Exception {
    ScheduleStore.Mutable failingStore = createMock(ScheduleStore.Mutable.class);
    CronPredictor cronPredictor = createMock(CronPredictor.class);
    expect(cronPredictor.predictNextRun(anyObject()))
        .andReturn(Optional.of(NOW.plusSeconds(60)))
        .anyTimes();
    expect(failingStore.fetchSchedule(CONNECTION_ID)).andReturn(Optional.empty());
    failingStore.createSchedule(anyObject());
    expectLastCall().andThrow(new StorageException("disk full"));
    expect(failingStore.fetchSchedule("other")).andThrow(new StorageException("disk full"));

    control.replay();

    BackupScheduleManager manager = new BackupScheduleManagerImpl(
        failingStore,
        timerRegistry,
        cronPredictor,
        new ConnectionLocks(4),
        clock,
        statsProvider);
    try {
      manager.scheduleBackup(CONNECTION_ID, HOURLY, 7);
      fail();
    } catch (SchedulePersistenceException e) {
      // Expected, and no timer was registered.
    }
    try {
      manager.disableBackupSchedule("other");
      fail();
    } catch (SchedulePersistenceException e) {
      // Expected.
    }
  }

  @Test
  public void testScheduleThatNeverFiresIsInvalid() throws Exception {
    CronPredictor cronPredictor = createMock(CronPredictor.class);
    expect(cronPredictor.predictNextRun(anyObject())).andReturn(Optional.empty());

    control.replay();

    BackupScheduleManager manager = new BackupScheduleManagerImpl(
        scheduleStore,
        timerRegistry,
        cronPredictor,
        new ConnectionLocks(4),
        clock,
        statsProvider);
    try {
      manager.scheduleBackup(CONNECTION_ID, "0 0 0 31 FEB *", 7);
      fail();
    } catch (InvalidScheduleExpressionException e) {
      // Expected.
    }
    assertEquals(Optional.empty(), scheduleStore.fetchSchedule(CONNECTION_ID));
  }
}
