package com.ecvi.riskengine.verify.scoring;

/** How a reported value is normalized before two sources are compared. */
public enum FieldKind {
    NAME,
    IDENTIFIER,
    DOMAIN,
    JURISDICTION
}
