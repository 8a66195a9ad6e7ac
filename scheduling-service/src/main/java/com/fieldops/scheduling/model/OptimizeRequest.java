package com.fieldops.scheduling.model;

import com.fieldops.scheduling.domain.ConstraintSet;
import com.fieldops.scheduling.domain.Job;
import com.fieldops.scheduling.domain.OptimizationOptions;
import com.fieldops.scheduling.domain.Technician;
import com.fieldops.scheduling.domain.TimeWindow;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class OptimizeRequest {

    @NotNull
    private List<Job> jobs;

    @NotEmpty
    private List<Technician> technicians;

    @NotNull
    private TimeWindow timeWindow;

    private ConstraintSet constraints;

    private OptimizationOptions options;
}
