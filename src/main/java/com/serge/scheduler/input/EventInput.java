package com.serge.scheduler.input;

import com.serge.scheduler.store.EventDraft;
import com.serge.scheduler.util.DateTimes;
import com.serge.scheduler.validation.IsoDateTime;
import com.serge.scheduler.validation.Patterns;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventInput {
    @NotBlank(message = Patterns.TITLE_REQUIRED)
    private String title;

    private String description;

    @NotNull(message = "Invalid date format")
    @IsoDateTime(message = "Invalid date format")
    private String date;

    @NotNull(message = "Price is required")
    @PositiveOrZero(message = "Price must be non-negative")
    private Double price;

    public EventDraft toDraft() {
        return EventDraft.builder()
                .title(title.trim())
                .description(description == null ? "" : description)
                .date(DateTimes.parseInstant(date).orElseThrow())
                .price(price)
                .build();
    }
}
