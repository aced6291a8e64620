package com.gatekeeper.authgovernor.domain;

/**
 * Kind of authentication try being recorded against a phone number.
 */
public enum AttemptType {
    LOGIN,
    PASSWORD_RESET
}
