package dev.vitae.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class DateNormalizerTest {

  @ParameterizedTest
  @CsvSource({
    "Jan 2020, 2020-01",
    "September 2019, 2019-09",
    "Sept. 2019, 2019-09",
    "'Mar, 2018', 2018-03",
    "01/2020, 2020-01",
    "3-2017, 2017-03",
    "2020-1, 2020-01",
    "2020.03, 2020-03",
    "2021-11, 2021-11"
  })
  void normalizesMonthPrecisionDates(String raw, String expected) {
    assertThat(DateNormalizer.normalize(raw, false)).contains(expected);
    assertThat(DateNormalizer.normalize(raw, true)).contains(expected);
  }

  @Test
  void bareYearStartsInJanuaryAndEndsInDecember() {
    assertThat(DateNormalizer.normalize("2019", false)).contains("2019-01");
    assertThat(DateNormalizer.normalize("2019", true)).contains("2019-12");
  }

  @ParameterizedTest
  @ValueSource(strings = {"Present", "current", "Currently", "till date", "To Date", "ongoing"})
  void openEndedMarkersNormalizeToPresent(String raw) {
    assertThat(DateNormalizer.normalize(raw, true)).contains(DateNormalizer.PRESENT);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "Marketing 2019", "13/2020", "1890", "2150", "next year"})
  void rejectsTextThatIsNotADate(String raw) {
    assertThat(DateNormalizer.normalize(raw, false)).isEmpty();
  }

  @Test
  void nullIsNotADate() {
    assertThat(DateNormalizer.normalize(null, false)).isEmpty();
  }

  @Test
  void monthPrecisionDistinguishesYearsAndOpenEnds() {
    assertThat(DateNormalizer.hasMonthPrecision("Jan 2019")).isTrue();
    assertThat(DateNormalizer.hasMonthPrecision("04/2019")).isTrue();
    assertThat(DateNormalizer.hasMonthPrecision("2019")).isFalse();
    assertThat(DateNormalizer.hasMonthPrecision("Present")).isFalse();
  }

  @Test
  void chronologicalOrderPutsPresentLast() {
    List<String> values = new ArrayList<>(List.of("PRESENT", "2020-05", "2019-12", "2099-12"));

    values.sort(DateNormalizer.CHRONOLOGICAL);

    assertThat(values).containsExactly("2019-12", "2020-05", "2099-12", "PRESENT");
  }

  @Test
  void presentResolvesToTheGivenMonth() {
    YearMonth asOf = YearMonth.of(2024, 6);

    assertThat(DateNormalizer.toYearMonth("PRESENT", asOf)).contains(asOf);
    assertThat(DateNormalizer.toYearMonth("2021-02", asOf)).contains(YearMonth.of(2021, 2));
    assertThat(DateNormalizer.toYearMonth("Feb 2021", asOf)).isEmpty();
  }

  @Test
  void recognizesCanonicalValues() {
    assertThat(DateNormalizer.isCanonical("2020-01")).isTrue();
    assertThat(DateNormalizer.isCanonical("PRESENT")).isTrue();
    assertThat(DateNormalizer.isCanonical("Jan 2020")).isFalse();
  }
}
