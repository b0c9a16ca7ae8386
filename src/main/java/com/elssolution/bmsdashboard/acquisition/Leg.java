package com.elssolution.bmsdashboard.acquisition;

/** The independent fetch-decode-aggregate pipelines of one poll cycle. */
public enum Leg {
    MAIN_PANEL("main panel"),
    CELL_VOLTAGE("cell voltage"),
    CELL_TEMPERATURE("cell temperature");

    private final String label;

    Leg(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
