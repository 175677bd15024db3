package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RoadmapItem {
    Priority priority;
    String title;
    String description;
    List<String> actionItems;
}
