package com.rentnest.tm30.domain;

/**
 * Who asked for a filing batch
 */
public enum DispatchTrigger {
    /**
     * An operator through the submit endpoint
     */
    MANUAL("manual"),

    /**
     * The daily submission job
     */
    SCHEDULER("cron-daily");

    private final String wireName;

    DispatchTrigger(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
