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
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;

import javax.inject.Inject;

import org.backupd.common.util.Clock;
import org.backupd.scheduler.cron.CronPredictor;
import org.backupd.scheduler.cron.CronSchedule;
import org.quartz.CronExpression;

import static java.util.Objects.requireNonNull;

class CronPredictorImpl implements CronPredictor {
  private final Clock clock;
  private final TimeZone timeZone;

  @Inject
  CronPredictorImpl(Clock clock, TimeZone timeZone) {
    this.clock = requireNonNull(clock);
    this.timeZone = requireNonNull(timeZone);
  }

  @Override
  public Optional<Instant> predictNextRun(CronSchedule schedule) {
    Date now = new Date(clock.nowMillis());
    Optional<Date> next = Optional.empty();
    for (CronExpression cronExpression : Quartz.cronExpressions(schedule, timeZone)) {
      // The getNextValidTimeAfter call may return null; eg: if the date is too far in the future.
      Date candidate = cronExpression.getNextValidTimeAfter(now);
      if (candidate != null && (!next.isPresent() || candidate.before(next.get()))) {
        next = Optional.of(candidate);
      }
    }
    return next.map(Date::toInstant);
  }
}
