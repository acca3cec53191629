package com.gillianbc.wealthsim.model;

public enum AssetType {
    CASH,
    ISA,
    GIA,
    PENSION
}
