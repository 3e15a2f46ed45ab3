package com.ecvi.riskengine.verify.model;

public enum SourceCategory {
    DNS,
    REGISTRATION,
    CONTACT,
    ADDRESS
}
