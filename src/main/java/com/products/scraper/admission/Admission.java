package com.products.scraper.admission;

/**
 * Decision of the {@link AdmissionGate}.
 */
public enum Admission {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
