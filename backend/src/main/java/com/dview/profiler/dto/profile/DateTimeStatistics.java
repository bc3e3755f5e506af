package com.dview.profiler.dto.profile;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateTimeStatistics implements ColumnStatistics {

  @JsonProperty("min_date")
  private String minDate;

  @JsonProperty("max_date")
  private String maxDate;

  @JsonProperty("date_range_days")
  private Long dateRangeDays;

  @Builder.Default
  @JsonProperty("most_common_dates")
  private List<String> mostCommonDates = new ArrayList<>();
}
