package com.icodici.names.events;

import com.icodici.names.Address;
import com.icodici.names.Decimal;

import java.time.ZonedDateTime;

public class NamespaceDeployed {

    private final String label;
    private final String name;
    private final String symbol;
    private final Address registry;
    private final Address owner;
    private final Decimal fee;
    private final ZonedDateTime deployedAt;

    public NamespaceDeployed(String label, String name, String symbol, Address registry, Address owner, Decimal fee,
                             ZonedDateTime deployedAt) {
        this.label = label;
        this.name = name;
        this.symbol = symbol;
        this.registry = registry;
        this.owner = owner;
        this.fee = fee;
        this.deployedAt = deployedAt;
    }

    public String getLabel() {
        return label;
    }

    public String getName() {
        return name;
    }

    public String getSymbol() {
        return symbol;
    }

    public Address getRegistry() {
        return registry;
    }

    public Address getOwner() {
        return owner;
    }

    public Decimal getFee() {
        return fee;
    }

    public ZonedDateTime getDeployedAt() {
        return deployedAt;
    }

    @Override
    public String toString() {
        return "NamespaceDeployed(" + label + " -> " + registry + ")";
    }
}
