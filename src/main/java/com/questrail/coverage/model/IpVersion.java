package com.questrail.coverage.model;

/**
 * Address family the ping server should be reached over.
 */
public enum IpVersion {
    V4,
    V6;

    /**
     * Maps the control server's {@code ip_version} field; anything other than 6
     * is treated as IPv4.
     */
    public static IpVersion fromWire(Integer value) {
        return value != null && value == 6 ? V6 : V4;
    }
}
