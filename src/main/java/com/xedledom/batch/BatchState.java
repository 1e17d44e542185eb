package com.xedledom.batch;

public enum BatchState {
    IDLE,
    LOADING,
    PROCESSING,
    SAVING,
    DONE
}
