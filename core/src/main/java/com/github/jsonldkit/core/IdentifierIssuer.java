package com.github.jsonldkit.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Issues blank node identifiers of the form prefix + counter, remembering
 * which old identifier each one was issued for and in what order.
 */
public class IdentifierIssuer implements Cloneable {

    private final String prefix;
    private int counter;
    private Map<String, String> existing;
    private List<String> existingOrder;

    public IdentifierIssuer(String prefix) {
        this.prefix = prefix;
        this.counter = 0;
        this.existing = new LinkedHashMap<String, String>();
        this.existingOrder = new ArrayList<String>();
    }

    /**
     * Gets the identifier issued for the given old identifier, issuing a new
     * one if none was issued yet.
     *
     * @param oldId
     *            the old identifier, or null to just generate a fresh one
     * @return the new identifier
     */
    public String getId(String oldId) {
        if (oldId != null && existing.containsKey(oldId)) {
            return existing.get(oldId);
        }

        final String id = prefix + counter;
        counter++;

        if (oldId != null) {
            existing.put(oldId, id);
            existingOrder.add(oldId);
        }
        return id;
    }

    public String getId() {
        return getId(null);
    }

    public boolean hasId(String oldId) {
        return existing.containsKey(oldId);
    }

    /**
     * @return the old identifiers in the order they were issued for
     */
    public List<String> getOrder() {
        return existingOrder;
    }

    public String getPrefix() {
        return prefix;
    }

    public Map<String, String> getExisting() {
        return existing;
    }

    @Override
    public IdentifierIssuer clone() {
        try {
            final IdentifierIssuer copy = (IdentifierIssuer) super.clone();
            copy.existing = new LinkedHashMap<String, String>(existing);
            copy.existingOrder = new ArrayList<String>(existingOrder);
            return copy;
        } catch (final CloneNotSupportedException e) {
            throw new IllegalStateException(e);
        }
    }
}
