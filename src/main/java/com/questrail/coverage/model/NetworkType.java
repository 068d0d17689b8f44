package com.questrail.coverage.model;

public enum NetworkType {
    WIFI,
    CELLULAR
}
