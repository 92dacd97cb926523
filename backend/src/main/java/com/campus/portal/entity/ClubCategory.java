package com.campus.portal.entity;

public enum ClubCategory {
    TECHNICAL,
    CULTURAL,
    SPORTS,
    ACADEMIC,
    SOCIAL,
    ARTS,
    MUSIC,
    DANCE,
    DRAMA,
    PHOTOGRAPHY,
    LITERATURE,
    DEBATE,
    ENTREPRENEURSHIP,
    VOLUNTEER,
    ENVIRONMENTAL
}
