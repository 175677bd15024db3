package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LicenseInfo {
    String name;
    String url; // may be null
}
