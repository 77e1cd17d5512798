package com.loadforecast.exception;

/**
 * Raised when a split subset does not hold the target in its first column and the
 * horizon in its last one. Tuning and serving abort on it; it is never retried.
 */
public class ColumnOrderException extends LoadForecastException {
    public ColumnOrderException(String subset, String firstColumn, String lastColumn) {
        super("COLUMN_ORDER_VIOLATION",
              "Column order in " + subset + " data not as expected (first='" + firstColumn
                  + "', last='" + lastColumn + "'), could not train a model!");
    }
}
