package com.loadforecast.model;

import com.loadforecast.table.TimeSeriesTable;

public record EvalSet(String name, TimeSeriesTable features, double[] target) {}
