package com.chalanbook.billing.model;

import java.math.BigDecimal;

/**
 * Entry in the item master: a known item name and the rate last used for it.
 */
public class MasterItem {

    private final long id;
    private final String name;
    private final BigDecimal defaultRate;

    public MasterItem(long id, String name, BigDecimal defaultRate) {
        this.id = id;
        this.name = name;
        this.defaultRate = defaultRate;
    }

    public long getId() { return id; }
    public String getName() { return name; }
    public BigDecimal getDefaultRate() { return defaultRate; }

    @Override
    public String toString() {
        return name;
    }
}
