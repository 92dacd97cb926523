package com.campus.portal.entity;

public enum Role {
    STUDENT,
    TEACHER,
    ADMIN
}
