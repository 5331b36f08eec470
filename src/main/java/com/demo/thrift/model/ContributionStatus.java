package com.demo.thrift.model;

public enum ContributionStatus {
    PAID, DEFAULTED, COVERED_BY_INSURANCE
}
