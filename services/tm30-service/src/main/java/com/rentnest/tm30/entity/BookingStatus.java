package com.rentnest.tm30.entity;

/**
 * Lifecycle status of a rental booking
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED
}
