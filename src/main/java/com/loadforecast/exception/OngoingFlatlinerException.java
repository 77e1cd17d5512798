package com.loadforecast.exception;

public class OngoingFlatlinerException extends LoadForecastException {
    public OngoingFlatlinerException(long pid, int thresholdMinutes) {
        super("INPUT_DATA_ONGOING_FLATLINER",
              "All recent load measurements of job " + pid + " are constant for at least "
                  + thresholdMinutes + " minutes.");
    }
}
