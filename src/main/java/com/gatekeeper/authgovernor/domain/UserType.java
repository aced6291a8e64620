package com.gatekeeper.authgovernor.domain;

public enum UserType {
    STUDENT,
    TEACHER,
    PARENT,
    STAFF
}
