package com.unievents.event.domain.model.payload;

public enum FundingSource {
    EXTERNAL,
    UNIVERSITY
}
