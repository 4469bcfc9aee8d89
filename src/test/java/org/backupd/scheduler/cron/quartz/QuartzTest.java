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
import java.util.List;
import java.util.TimeZone;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

import org.backupd.scheduler.cron.CronSchedule;
import org.junit.Test;
import org.quartz.CronExpression;
import org.quartz.CronTrigger;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;

import static org.backupd.scheduler.cron.quartz.QuartzTestUtil.HOURLY;
import static org.backupd.scheduler.cron.quartz.QuartzTestUtil.SCHEDULE_ID;
import static org.backupd.scheduler.cron.quartz.QuartzTestUtil.SNAPSHOT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class QuartzTest {
  private static final TimeZone TIME_ZONE = TimeZone.getTimeZone("GMT");
  private static final Date NOW = new Date(1709633742000L); // 2024-03-05T10:15:42Z

  private static List<String> expressions(String schedule) {
    return Quartz.cronExpressions(CronSchedule.parse(schedule), TIME_ZONE)
        .stream()
        .map(CronExpression::getCronExpression)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void testDayOfMonthWildcard() {
    assertEquals(ImmutableList.of("0 0 * ? * *"), expressions("0 0 * * * *"));
    assertEquals(ImmutableList.of("* * * ? * *"), expressions("* * * * * *"));
  }

  @Test
  public void testDaysOfWeekCountFromSunday() {
    assertEquals(ImmutableList.of("0 30 2 ? * 2,3,4,5,6"), expressions("0 30 2 * * MON-FRI"));
    assertEquals(ImmutableList.of("0 0 0 ? * 1,7"), expressions("0 0 0 * * 0,6"));
  }

  @Test
  public void testDayOfWeekWildcard() {
    assertEquals(ImmutableList.of("0 0 0 1,15 * ?"), expressions("0 0 0 1,15 * *"));
  }

  @Test
  public void testBothDayFieldsRestricted() {
    assertEquals(
        ImmutableList.of("0 0 0 15 * ?", "0 0 0 ? * 7"),
        expressions("0 0 0 15 * SAT"));
  }

  @Test
  public void testExpressionsUseTimeZone() {
    TimeZone timeZone = TimeZone.getTimeZone("America/Los_Angeles");
    for (CronExpression expression : Quartz.cronExpressions(HOURLY, timeZone)) {
      assertEquals(timeZone, expression.getTimeZone());
    }
  }

  @Test
  public void testJobKey() {
    assertEquals(new JobKey(SCHEDULE_ID, Quartz.JOB_GROUP), Quartz.jobKey(SCHEDULE_ID));
  }

  @Test
  public void testCronTriggers() {
    JobKey jobKey = Quartz.jobKey(SCHEDULE_ID);
    CronSchedule schedule = CronSchedule.parse("0 0 0 15 * SAT");

    ImmutableSet<Trigger> triggers = Quartz.cronTriggers(jobKey, schedule, TIME_ZONE, NOW);

    assertEquals(2, triggers.size());
    for (Trigger trigger : triggers) {
      assertEquals(jobKey, trigger.getJobKey());
      assertEquals(schedule.toString(), trigger.getDescription());
      assertTrue(trigger instanceof CronTrigger);
      assertEquals(TIME_ZONE, ((CronTrigger) trigger).getTimeZone());
      assertEquals(NOW, trigger.getStartTime());
    }
  }

  @Test
  public void testCronTriggersSkipDayOfMonthThatNeverComes() {
    JobKey jobKey = Quartz.jobKey(SCHEDULE_ID);
    CronSchedule schedule = CronSchedule.parse("0 0 0 30 2 MON");

    ImmutableSet<Trigger> triggers = Quartz.cronTriggers(jobKey, schedule, TIME_ZONE, NOW);

    assertEquals(1, triggers.size());
    CronTrigger trigger = (CronTrigger) Iterables.getOnlyElement(triggers);
    assertEquals("0 0 0 ? 2 2", trigger.getCronExpression());
    assertNotNull(trigger.getFireTimeAfter(NOW));
  }

  @Test
  public void testCronTriggersEmptyWhenNeverFiring() {
    ImmutableSet<Trigger> triggers = Quartz.cronTriggers(
        Quartz.jobKey(SCHEDULE_ID),
        CronSchedule.parse("0 0 0 30 2 *"),
        TIME_ZONE,
        NOW);

    assertTrue(triggers.isEmpty());
  }

  @Test
  public void testJobDetailCarriesSnapshot() {
    JobKey jobKey = Quartz.jobKey(SCHEDULE_ID);

    JobDetail jobDetail = Quartz.jobDetail(jobKey, BackupCronJob.class, SNAPSHOT);

    assertEquals(jobKey, jobDetail.getKey());
    assertEquals(BackupCronJob.class, jobDetail.getJobClass());
    assertSame(SNAPSHOT, jobDetail.getJobDataMap().get(Quartz.SNAPSHOT_KEY));
    assertTrue(jobDetail.isConcurrentExectionDisallowed());
  }
}
