package com.demo.thrift.model;

public enum GroupModel {
    /** Pot rotates to one member per cycle. */
    ROTATIONAL,
    /** Contributions stay locked until maturity, then return with yield. */
    FIXED_SAVINGS,
    /** Pool is drawn against through insurance claims. */
    EMERGENCY_LIQUIDITY
}
