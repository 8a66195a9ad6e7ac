package com.fieldops.scheduling.travel;

import com.fieldops.scheduling.domain.GeoPoint;
import lombok.Value;

@Value(staticConstructor = "of")
public class TravelLeg {

    GeoPoint origin;
    GeoPoint destination;
}
