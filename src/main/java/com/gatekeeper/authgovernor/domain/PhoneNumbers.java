package com.gatekeeper.authgovernor.domain;

public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /** Masks all but the last four digits, for log output. */
    public static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.length() <= 4) {
            return "****";
        }
        return "*".repeat(phoneNumber.length() - 4) + phoneNumber.substring(phoneNumber.length() - 4);
    }
}
