package com.guno.orderpipeline.aggregation;

import lombok.Value;

@Value(staticConstructor = "of")
public class GeoKey {
    String city;
    String state;
}
