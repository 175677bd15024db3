package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RepositoryIdentifier {
    String owner;
    String repository;

    @Override
    public String toString() {
        return owner + "/" + repository;
    }
}
