package fr.lapetina.provisioner.domain.model;

import fr.lapetina.provisioner.domain.inventory.AddressLiterals;

import java.util.Objects;

/**
 * One host to provision, as read from the inventory.
 * Immutable and thread-safe.
 */
public record InventoryRecord(String hostname, String address) {

    public InventoryRecord {
        Objects.requireNonNull(hostname, "Hostname is required");
        Objects.requireNonNull(address, "Address is required");
        hostname = hostname.strip();
        address = address.strip();
        if (hostname.isEmpty()) {
            throw new IllegalArgumentException("Hostname must not be blank");
        }
        if (!AddressLiterals.isValid(address)) {
            throw new IllegalArgumentException("Not an IPv4 or IPv6 literal: " + address);
        }
    }

    public static InventoryRecord of(String hostname, String address) {
        return new InventoryRecord(hostname, address);
    }

    @Override
    public String toString() {
        return hostname + "(" + address + ")";
    }
}
