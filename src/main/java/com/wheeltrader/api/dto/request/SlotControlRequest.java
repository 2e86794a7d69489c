package com.wheeltrader.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.Data;

/** Optional body for the pause, resume and close slot endpoints. */
@Data
public class SlotControlRequest {

    /** Free text recorded in the decision log with the control change. */
    @Size(max = 200)
    private String reason;
}
