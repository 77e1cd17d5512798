package com.loadforecast.features;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of a holiday reference file: a date and the holiday (or region label) it belongs to.
 */
@JsonPropertyOrder({"date", "name"})
public record HolidayRecord(@JsonProperty("date") String date, @JsonProperty("name") String name) {}
