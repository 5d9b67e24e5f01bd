package com.relaygate.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class BenchmarkRequest {

    @Min(value = 1, message = "At least one iteration is required")
    @Max(value = 20, message = "At most 20 iterations are allowed")
    private Integer iterations = 3;

    private Boolean optimizePriorities = false;
}
