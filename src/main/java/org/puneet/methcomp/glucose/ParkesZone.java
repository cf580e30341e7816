package org.puneet.methcomp.glucose;

/**
 * Parkes consensus error grid zones, graded by the effect a reading would
 * have on clinical action.
 */
public enum ParkesZone {
    A("No effect on clinical action"),
    B("Altered clinical action, little or no effect on outcome"),
    C("Altered clinical action, likely to affect outcome"),
    D("Altered clinical action, significant medical risk"),
    E("Altered clinical action, dangerous consequences");

    private final String description;

    ParkesZone(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
