package com.ospicorp.pricelogger.interval;

public record IntervalKey(long settlementTs, String regionId) {}
