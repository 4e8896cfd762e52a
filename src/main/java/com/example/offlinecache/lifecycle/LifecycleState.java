package com.example.offlinecache.lifecycle;

public enum LifecycleState {
    NEW,
    INSTALLING,
    INSTALLED,
    ACTIVATING,
    ACTIVE
}
