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
package org.backupd.scheduler.cron;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A parsed six-field cron schedule with second granularity. Create with {@link #parse(String)} or
 * {@link #tryParse(String)}.
 */
public final class CronSchedule {
  private static final Range<Integer> SECOND =
      Range.closed(0, 59).canonical(DiscreteDomain.integers());
  private static final Range<Integer> MINUTE =
      Range.closed(0, 59).canonical(DiscreteDomain.integers());
  private static final Range<Integer> HOUR =
      Range.closed(0, 23).canonical(DiscreteDomain.integers());
  private static final Range<Integer> DAY_OF_MONTH =
      Range.closed(1, 31).canonical(DiscreteDomain.integers());
  private static final Range<Integer> MONTH =
      Range.closed(1, 12).canonical(DiscreteDomain.integers());
  // NOTE: 0 is Sunday, "7" is not accepted.
  private static final Range<Integer> DAY_OF_WEEK =
      Range.closed(0, 6).canonical(DiscreteDomain.integers());

  private final RangeSet<Integer> second;
  private final RangeSet<Integer> minute;
  private final RangeSet<Integer> hour;
  private final RangeSet<Integer> dayOfMonth;
  private final RangeSet<Integer> month;
  private final RangeSet<Integer> dayOfWeek;

  private CronSchedule(
      RangeSet<Integer> second,
      RangeSet<Integer> minute,
      RangeSet<Integer> hour,
      RangeSet<Integer> dayOfMonth,
      RangeSet<Integer> month,
      RangeSet<Integer> dayOfWeek) {

    checkEnclosed("second", SECOND, second);
    checkEnclosed("minute", MINUTE, minute);
    checkEnclosed("hour", HOUR, hour);
    checkEnclosed("dayOfMonth", DAY_OF_MONTH, dayOfMonth);
    checkEnclosed("month", MONTH, month);
    checkEnclosed("dayOfWeek", DAY_OF_WEEK, dayOfWeek);

    this.second = ImmutableRangeSet.copyOf(second);
    this.minute = ImmutableRangeSet.copyOf(minute);
    this.hour = ImmutableRangeSet.copyOf(hour);
    this.dayOfMonth = ImmutableRangeSet.copyOf(dayOfMonth);
    this.month = ImmutableRangeSet.copyOf(month);
    this.dayOfWeek = ImmutableRangeSet.copyOf(dayOfWeek);
  }

  private static void checkEnclosed(
      String fieldName,
      Range<Integer> fieldEnclosure,
      RangeSet<Integer> field) {

    checkArgument(!field.isEmpty(), "Empty specification for field %s.", fieldName);
    checkArgument(fieldEnclosure.encloses(field.span()),
        String.format(
            "Bad specification for field %s: span(%s) = %s is not enclosed by boundary %s.",
            fieldName,
            field,
            field.span(),
            fieldEnclosure));
  }

  /**
   * Create a new {@link CronSchedule} from a six-field cron expression.
   * <p>
   * The fields are, in order: second, minute, hour, dayOfMonth, month and dayOfWeek. Every field
   * is a comma separated list of singletons ("50"), wildcards ("*" or "?"), ranges ("1-50",
   * "MON-SAT"), and "skips" ("1-50/2", "&#42;/2", "5/15"). Months may be given as JAN-DEC and days
   * of the week as SUN-SAT, where SUN is 0.
   * <p>
   * When either day field is a wildcard, the other day field alone selects days. When both are
   * restricted, a day matches if it satisfies either of them.
   *
   * @param schedule The cron expression to parse.
   * @return A new schedule if parsing was successful.
   * @throws IllegalArgumentException if parsing failed for any reason.
   */
  public static CronSchedule parse(String schedule) throws IllegalArgumentException {
    return new Parser(schedule).get();
  }

  /**
   * Create a new {@link CronSchedule} from a six-field cron expression.
   *
   * @see #parse(String)
   * @param schedule The cron expression to parse.
   * @return A new schedule if parsing was successful, absent otherwise.
   */
  public static Optional<CronSchedule> tryParse(String schedule) {
    try {
      return Optional.of(parse(schedule));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * The days of the week this schedule matches. 0 is Sun and 6 is Sat.
   *
   * @return An immutable view of the days of the week this schedule matches within [0,7).
   */
  public RangeSet<Integer> getDayOfWeek() {
    return dayOfWeek;
  }

  @VisibleForTesting
  boolean hasWildcardSecond() {
    return second.encloses(SECOND);
  }

  /**
   * True if this schedule covers all possible days of the month.
   */
  public boolean hasWildcardDayOfMonth() {
    return dayOfMonth.encloses(DAY_OF_MONTH);
  }

  /**
   * True if this schedule covers all possible days of the week.
   */
  public boolean hasWildcardDayOfWeek() {
    return dayOfWeek.encloses(DAY_OF_WEEK);
  }

  private static String fieldToString(RangeSet<Integer> rangeSet, Range<Integer> coveringRange) {
    if (rangeSet.asRanges().size() == 1 && rangeSet.encloses(coveringRange)) {
      return "*";
    }
    List<String> components = Lists.newArrayList();
    for (Range<Integer> range : rangeSet.asRanges()) {
      ContiguousSet<Integer> set = ContiguousSet.create(range, DiscreteDomain.integers());
      if (set.size() == 1) {
        components.add(set.first().toString());
      } else {
        components.add(set.first() + "-" + set.last());
      }
    }
    return String.join(",", components);
  }

  public String getSecondAsString() {
    return fieldToString(second, SECOND);
  }

  public String getMinuteAsString() {
    return fieldToString(minute, MINUTE);
  }

  public String getHourAsString() {
    return fieldToString(hour, HOUR);
  }

  public String getDayOfMonthAsString() {
    return fieldToString(dayOfMonth, DAY_OF_MONTH);
  }

  public String getMonthAsString() {
    return fieldToString(month, MONTH);
  }

  public String getDayOfWeekAsString() {
    return fieldToString(dayOfWeek, DAY_OF_WEEK);
  }

  /**
   * Returns a parsable string representation schedule such that
   * {@code c.equals(CronSchedule.parse(c.toString())}.
   */
  @Override
  public String toString() {
    return String.join(
        " ",
        getSecondAsString(),
        getMinuteAsString(),
        getHourAsString(),
        getDayOfMonthAsString(),
        getMonthAsString(),
        getDayOfWeekAsString());
  }

  /**
   * True when both sides would match the same set of instants.
   */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CronSchedule)) {
      return false;
    }
    CronSchedule that = (CronSchedule) o;
    return Objects.equals(second, that.second)
        && Objects.equals(minute, that.minute)
        && Objects.equals(hour, that.hour)
        && Objects.equals(dayOfMonth, that.dayOfMonth)
        && Objects.equals(month, that.month)
        && Objects.equals(dayOfWeek, that.dayOfWeek);
  }

  @Override
  public int hashCode() {
    return Objects.hash(second, minute, hour, dayOfMonth, month, dayOfWeek);
  }

  private static class Parser {
    private static final Splitter FIELDS =
        Splitter.onPattern("\\s+").omitEmptyStrings().trimResults();

    // A single time like "5", "10", "50".
    private static final Pattern NUMBER = Pattern.compile("^(?<number>\\d+)$");
    // A wildcard ("*" or "?").
    private static final Pattern WILDCARD = Pattern.compile("^[*?]$");
    // A range like "1-2", "5-10", "14-50".
    private static final Pattern RANGE = Pattern.compile("^(?<lower>\\d+)-(?<upper>\\d+)$");
    // A wildcard with a "skip" like "*/5", "*/10"
    private static final Pattern WILDCARD_WITH_SKIP = Pattern.compile("^[*?]/(?<skip>\\d+)$");
    // A start with a "skip" running to the end of the field like "5/15"
    private static final Pattern NUMBER_WITH_SKIP =
        Pattern.compile("^(?<lower>\\d+)/(?<skip>\\d+)$");
    // A range with a "skip" like "1-2/2", "0-59/5"
    private static final Pattern RANGE_WITH_SKIP =
        Pattern.compile("^(?<lower>\\d+)-(?<upper>\\d+)/(?<skip>\\d+)$");

    private static final Map<String, Integer> MONTH_NAMES = ImmutableMap
        .<String, Integer>builder()
        .put("JAN", 1)
        .put("FEB", 2)
        .put("MAR", 3)
        .put("APR", 4)
        .put("MAY", 5)
        .put("JUN", 6)
        .put("JUL", 7)
        .put("AUG", 8)
        .put("SEP", 9)
        .put("OCT", 10)
        .put("NOV", 11)
        .put("DEC", 12)
        .build();

    private static final Map<String, Integer> DAY_NAMES = ImmutableMap
        .<String, Integer>builder()
        .put("SUN", 0)
        .put("MON", 1)
        .put("TUE", 2)
        .put("WED", 3)
        .put("THU", 4)
        .put("FRI", 5)
        .put("SAT", 6)
        .build();

    private final String rawSecond;
    private final String rawMinute;
    private final String rawHour;
    private final String rawDayOfMonth;
    private final String rawMonth;
    private final String rawDayOfWeek;

    Parser(String schedule) throws IllegalArgumentException {
      requireNonNull(schedule);
      List<String> fields = FIELDS.splitToList(schedule);
      checkArgument(fields.size() == 6,
          "Invalid cron schedule %s: expected 6 fields but found %s", schedule, fields.size());

      rawSecond = fields.get(0);
      rawMinute = fields.get(1);
      rawHour = fields.get(2);
      rawDayOfMonth = fields.get(3);
      rawMonth = fields.get(4);
      rawDayOfWeek = fields.get(5);
    }

    CronSchedule get() throws IllegalArgumentException {
      return new CronSchedule(
          parseField(SECOND, rawSecond, ImmutableMap.of()),
          parseField(MINUTE, rawMinute, ImmutableMap.of()),
          parseField(HOUR, rawHour, ImmutableMap.of()),
          parseField(DAY_OF_MONTH, rawDayOfMonth, ImmutableMap.of()),
          parseField(MONTH, rawMonth, MONTH_NAMES),
          parseField(DAY_OF_WEEK, rawDayOfWeek, DAY_NAMES));
    }

    private static RangeSet<Integer> parseField(
        Range<Integer> enclosure,
        String rawField,
        Map<String, Integer> names) {

      RangeSet<Integer> values = TreeRangeSet.create();
      for (String component : Splitter.on(",").splitToList(rawField)) {
        values.addAll(parseComponent(enclosure, replaceNameAliases(component, names)));
      }
      return ImmutableRangeSet.copyOf(values);
    }

    private static String replaceNameAliases(String rawComponent, Map<String, Integer> names) {
      String component = rawComponent.toUpperCase(Locale.ENGLISH);
      for (Map.Entry<String, Integer> entry : names.entrySet()) {
        if (component.contains(entry.getKey())) {
          component = component.replace(entry.getKey(), entry.getValue().toString());
        }
      }
      return component;
    }

    private static RangeSet<Integer> parseComponent(
        final Range<Integer> enclosure,
        String rawComponent) throws IllegalArgumentException {

      if (WILDCARD.matcher(rawComponent).matches()) {
        return ImmutableRangeSet.of(enclosure);
      }

      Matcher matcher = NUMBER.matcher(rawComponent);
      if (matcher.matches()) {
        int number = parseNumber(matcher.group("number"));
        Range<Integer> range = Range.singleton(number).canonical(DiscreteDomain.integers());

        checkArgument(enclosure.encloses(range), "%s does not enclose %s", enclosure, range);

        return ImmutableRangeSet.of(range);
      }

      matcher = RANGE.matcher(rawComponent);
      if (matcher.matches()) {
        return ImmutableRangeSet.of(
            closedRange(enclosure, matcher.group("lower"), matcher.group("upper")));
      }

      matcher = WILDCARD_WITH_SKIP.matcher(rawComponent);
      if (matcher.matches()) {
        return skipping(enclosure, parseNumber(matcher.group("skip")));
      }

      matcher = NUMBER_WITH_SKIP.matcher(rawComponent);
      if (matcher.matches()) {
        int lower = parseNumber(matcher.group("lower"));
        checkArgument(enclosure.contains(lower), "%s does not contain %s", enclosure, lower);
        return skipping(
            Range.closed(lower, enclosure.upperEndpoint() - 1).canonical(DiscreteDomain.integers()),
            parseNumber(matcher.group("skip")));
      }

      matcher = RANGE_WITH_SKIP.matcher(rawComponent);
      if (matcher.matches()) {
        return skipping(
            closedRange(enclosure, matcher.group("lower"), matcher.group("upper")),
            parseNumber(matcher.group("skip")));
      }

      throw new IllegalArgumentException(
          "Cron schedule component " + rawComponent + " does not match any known patterns.");
    }

    private static int parseNumber(String digits) {
      try {
        return Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Number out of range: " + digits, e);
      }
    }

    private static Range<Integer> closedRange(
        Range<Integer> enclosure,
        String lower,
        String upper) {

      int low = parseNumber(lower);
      int high = parseNumber(upper);
      checkArgument(low <= high, "Range %s-%s is reversed", low, high);

      Range<Integer> range = Range.closed(low, high).canonical(DiscreteDomain.integers());
      checkArgument(enclosure.encloses(range), "%s does not enclose %s", enclosure, range);
      return range;
    }

    private static RangeSet<Integer> skipping(Range<Integer> range, int skip) {
      checkArgument(skip > 0, "skip value %s must be >0", skip);

      ImmutableRangeSet.Builder<Integer> rangeSet = ImmutableRangeSet.builder();
      for (int i = range.lowerEndpoint(); range.contains(i); i += skip) {
        rangeSet.add(Range.singleton(i).canonical(DiscreteDomain.integers()));
      }
      return rangeSet.build();
    }
  }
}
