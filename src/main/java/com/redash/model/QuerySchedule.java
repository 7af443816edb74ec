package com.redash.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * When a query is refreshed automatically.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class QuerySchedule {

    /**
     * Refresh interval in seconds. Daily schedules use a multiple of 86400 and weekly
     * schedules a multiple of 604800; the service enforces this, not this client.
     */
    private int interval;

    /**
     * Time of day ({@code HH:mm}) for daily and weekly schedules.
     */
    private String time;

    /**
     * Day of week for weekly schedules.
     */
    @JsonProperty("day_of_week")
    private String dayOfWeek;

    /**
     * The schedule is active until this date.
     */
    private String until;
}
