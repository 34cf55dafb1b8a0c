package com.serge.scheduler.input;

import com.serge.scheduler.store.EventFilter;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.IsoDateTime;
import com.serge.scheduler.validation.ObjectIdString;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventFilterInput {
    @ObjectIdString(message = "Invalid createdById")
    private String createdById;

    @IsoDateTime(message = "Invalid dateFrom")
    private String dateFrom;

    @IsoDateTime(message = "Invalid dateTo")
    private String dateTo;

    public EventFilter toFilter() {
        return EventFilter.builder()
                .createdById(createdById)
                .dateFrom(DateTimes.parseInstant(dateFrom).orElse(null))
                .dateTo(DateTimes.parseInstant(dateTo).orElse(null))
                .build();
    }
}
