package com.fairway.revenue.signal;

@FunctionalInterface
public interface RevenueSignalListener {

    void onSignals(RevenueSignals signals);
}
