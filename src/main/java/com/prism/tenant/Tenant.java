package com.prism.tenant;

import java.util.Objects;

/**
 * Tenant entry returned by the tenant directory.
 */
public class Tenant {

    private final long id;
    private final String name;

    public Tenant(long id, String name) {
        this.id = id;
        this.name = name;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Tenant tenant = (Tenant) o;
        return id == tenant.id && Objects.equals(name, tenant.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "Tenant{id=" + id + ", name='" + name + "'}";
    }
}
