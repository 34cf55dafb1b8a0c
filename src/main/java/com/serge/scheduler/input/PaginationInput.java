package com.serge.scheduler.input;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaginationInput {
    @Min(value = 1, message = "limit must be between 1 and 100")
    @Max(value = 100, message = "limit must be between 1 and 100")
    private Integer limit = 10;

    @Min(value = 0, message = "offset must not be negative")
    private Integer offset = 0;
}
