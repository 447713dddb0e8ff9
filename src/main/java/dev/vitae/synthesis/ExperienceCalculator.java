package dev.vitae.synthesis;

import dev.vitae.extraction.DateNormalizer;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Computes total experience from dated positions.
 *
 * <p>Months are counted inclusively ({@code 2020-01} to {@code 2020-12} is twelve months), months
 * covered by overlapping positions are counted once, {@code PRESENT} stands for the as-of month,
 * and a position without an end date counts as its start month only.
 */
public final class ExperienceCalculator {

  private ExperienceCalculator() {
    // static utility
  }

  /**
   * Summarizes experience.
   *
   * @param experience positions, in any order
   * @param asOf the month open-ended positions run to
   * @return the summary, or null when no position has a start date
   */
  public static @Nullable ExperienceSummary summarize(
      List<ExperienceEntry> experience, YearMonth asOf) {
    List<YearMonth[]> ranges = new ArrayList<>();
    for (ExperienceEntry entry : experience) {
      if (entry.start() == null) {
        continue;
      }
      Optional<YearMonth> start = DateNormalizer.toYearMonth(entry.start().value(), asOf);
      if (start.isEmpty()) {
        continue;
      }
      YearMonth end =
          entry.end() == null
              ? start.get()
              : DateNormalizer.toYearMonth(entry.end().value(), asOf).orElse(start.get());
      if (!end.isBefore(start.get())) {
        ranges.add(new YearMonth[] {start.get(), end});
      }
    }
    if (ranges.isEmpty()) {
      return null;
    }

    ranges.sort(Comparator.comparing((YearMonth[] range) -> range[0]));
    long total = 0;
    YearMonth currentStart = ranges.get(0)[0];
    YearMonth currentEnd = ranges.get(0)[1];
    for (YearMonth[] range : ranges.subList(1, ranges.size())) {
      if (!range[0].isAfter(currentEnd)) {
        if (range[1].isAfter(currentEnd)) {
          currentEnd = range[1];
        }
      } else {
        total += inclusiveMonths(currentStart, currentEnd);
        currentStart = range[0];
        currentEnd = range[1];
      }
    }
    total += inclusiveMonths(currentStart, currentEnd);
    return ExperienceSummary.ofMonths((int) total, asOf);
  }

  static long inclusiveMonths(YearMonth start, YearMonth end) {
    return ChronoUnit.MONTHS.between(start, end) + 1;
  }
}
