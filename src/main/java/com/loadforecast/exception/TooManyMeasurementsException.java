package com.loadforecast.exception;

public class TooManyMeasurementsException extends LoadForecastException {
    public TooManyMeasurementsException(int size, int max) {
        super("TOO_MANY_MEASUREMENTS",
              "Request holds " + size + " measurements, the maximum is " + max + ".");
    }
}
