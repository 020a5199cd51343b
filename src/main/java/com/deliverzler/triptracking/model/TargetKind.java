package com.deliverzler.triptracking.model;

public enum TargetKind {
    LOADING,
    UNLOADING
}
