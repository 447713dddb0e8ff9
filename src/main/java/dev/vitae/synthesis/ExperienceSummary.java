package dev.vitae.synthesis;

import java.time.YearMonth;

/**
 * Total professional experience.
 *
 * @param totalMonths months covered by at least one dated position, counted inclusively
 * @param years whole years in {@code totalMonths}
 * @param remainingMonths months left over after the whole years
 * @param asOf the month open-ended positions were counted up to
 */
public record ExperienceSummary(int totalMonths, int years, int remainingMonths, YearMonth asOf) {

  public static ExperienceSummary ofMonths(int totalMonths, YearMonth asOf) {
    return new ExperienceSummary(totalMonths, totalMonths / 12, totalMonths % 12, asOf);
  }

  /** Fractional years, as scored by rubrics. */
  public double totalYears() {
    return totalMonths / 12.0;
  }
}
