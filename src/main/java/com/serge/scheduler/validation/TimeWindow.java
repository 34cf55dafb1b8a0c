package com.serge.scheduler.validation;

/** An input carrying a raw start/end pair. */
public interface TimeWindow {
    String getStartTime();

    String getEndTime();
}
