package com.fieldops.scheduling.model;

import com.fieldops.scheduling.domain.AdaptationPreferences;
import com.fieldops.scheduling.domain.DisruptionEvent;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AdaptRequest {

    @NotNull
    private DisruptionEvent disruption;

    /** Null means the documented defaults. */
    private AdaptationPreferences preferences;
}
