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

import java.text.ParseException;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

import com.google.common.base.Joiner;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;

import org.backupd.scheduler.cron.CronSchedule;
import org.backupd.scheduler.storage.entities.BackupSchedule;
import org.quartz.CronExpression;
import org.quartz.CronScheduleBuilder;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Conversions between backup schedules and their Quartz counterparts.
 */
final class Quartz {
  static final String JOB_GROUP = "backup-schedules";
  static final String SNAPSHOT_KEY = "schedule";

  private static final String ANY_DAY = "?"; // special quartz token meaning "don't care"

  private Quartz() {
    // Utility class.
  }

  /**
   * Convert a CronSchedule to the Quartz CronExpressions that together fire on exactly its
   * instants. Two expressions are needed when both day fields are restricted, since Quartz can only
   * constrain one of them at a time.
   */
  static ImmutableList<CronExpression> cronExpressions(CronSchedule schedule, TimeZone timeZone) {
    String dayOfWeek = quartzDayOfWeek(schedule);
    if (schedule.hasWildcardDayOfMonth()) {
      return ImmutableList.of(cronExpression(schedule, ANY_DAY, dayOfWeek, timeZone));
    } else if (schedule.hasWildcardDayOfWeek()) {
      return ImmutableList.of(
          cronExpression(schedule, schedule.getDayOfMonthAsString(), ANY_DAY, timeZone));
    } else {
      return ImmutableList.of(
          cronExpression(schedule, schedule.getDayOfMonthAsString(), ANY_DAY, timeZone),
          cronExpression(schedule, ANY_DAY, dayOfWeek, timeZone));
    }
  }

  private static String quartzDayOfWeek(CronSchedule schedule) {
    if (schedule.hasWildcardDayOfWeek()) {
      return "*";
    }
    List<Integer> daysOfWeek = Lists.newArrayList();
    for (Range<Integer> range : schedule.getDayOfWeek().asRanges()) {
      for (int i : ContiguousSet.create(range, DiscreteDomain.integers())) {
        daysOfWeek.add(i + 1); // Quartz counts days of the week from SUN=1.
      }
    }
    return Joiner.on(",").join(daysOfWeek);
  }

  private static CronExpression cronExpression(
      CronSchedule schedule,
      String dayOfMonth,
      String dayOfWeek,
      TimeZone timeZone) {

    String rawCronExpression = Joiner.on(" ").join(
        schedule.getSecondAsString(),
        schedule.getMinuteAsString(),
        schedule.getHourAsString(),
        dayOfMonth,
        schedule.getMonthAsString(),
        dayOfWeek);
    CronExpression cronExpression;
    try {
      cronExpression = new CronExpression(rawCronExpression);
    } catch (ParseException e) {
      throw new IllegalStateException(
          "Canonical schedule " + rawCronExpression + " was rejected by quartz", e);
    }
    cronExpression.setTimeZone(timeZone);
    return cronExpression;
  }

  /**
   * Convert a schedule id to a Quartz JobKey.
   */
  static JobKey jobKey(String scheduleId) {
    return JobKey.jobKey(scheduleId, JOB_GROUP);
  }

  /**
   * Builds one trigger per expression that can still fire after {@code now}. Quartz refuses to
   * schedule a trigger that never fires, and a schedule restricting both day fields may have one
   * half that never matches (the 30th of February, say) while the other does.
   *
   * @return The live triggers, empty if the schedule never fires after {@code now}.
   */
  static ImmutableSet<Trigger> cronTriggers(
      JobKey jobKey,
      CronSchedule schedule,
      TimeZone timeZone,
      Date now) {

    ImmutableSet.Builder<Trigger> triggers = ImmutableSet.builder();
    for (CronExpression expression : cronExpressions(schedule, timeZone)) {
      if (expression.getNextValidTimeAfter(now) == null) {
        continue;
      }
      triggers.add(TriggerBuilder.newTrigger()
          .forJob(jobKey)
          .withSchedule(CronScheduleBuilder.cronSchedule(expression))
          .withDescription(schedule.toString())
          .startAt(now)
          .build());
    }
    return triggers.build();
  }

  static JobDetail jobDetail(
      JobKey jobKey,
      Class<? extends Job> jobClass,
      BackupSchedule snapshot) {

    checkNotNull(jobKey);
    checkNotNull(jobClass);
    checkNotNull(snapshot);

    JobDataMap data = new JobDataMap();
    data.put(SNAPSHOT_KEY, snapshot);
    return JobBuilder.newJob(jobClass)
        .withIdentity(jobKey)
        .usingJobData(data)
        .build();
  }
}
