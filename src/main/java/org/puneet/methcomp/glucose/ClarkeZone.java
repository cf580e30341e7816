package org.puneet.methcomp.glucose;

/**
 * Clarke error grid zones, from clinically accurate (A) to erroneous
 * treatment (E).
 */
public enum ClarkeZone {
    A("Clinically accurate"),
    B("Benign error"),
    C("Overcorrection"),
    D("Failure to detect"),
    E("Erroneous treatment");

    private final String description;

    ClarkeZone(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
