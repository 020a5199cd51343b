package com.deliverzler.triptracking.client;

@FunctionalInterface
public interface ConnectivityChecker {

    boolean isOnline();
}
