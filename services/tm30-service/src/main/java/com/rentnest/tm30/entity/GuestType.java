package com.rentnest.tm30.entity;

/**
 * Role of a guest within a booking
 */
public enum GuestType {
    /**
     * Guest number 1, the person who made the booking
     */
    PRIMARY,

    ADDITIONAL;

    public static GuestType forGuestNumber(int guestNumber) {
        return guestNumber == 1 ? PRIMARY : ADDITIONAL;
    }
}
