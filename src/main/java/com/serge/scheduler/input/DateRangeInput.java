package com.serge.scheduler.input;

import com.serge.scheduler.validation.IsoDateTime;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DateRangeInput {
    @NotNull(message = "Invalid startDate")
    @IsoDateTime(message = "Invalid startDate")
    private String startDate;

    @NotNull(message = "Invalid endDate")
    @IsoDateTime(message = "Invalid endDate")
    private String endDate;
}
