package com.github.jsonldkit.core;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class IdentifierIssuerTest {

    @Test
    public void issuesSequentialIdentifiers() {
        final IdentifierIssuer issuer = new IdentifierIssuer("_:b");
        assertEquals("_:b0", issuer.getId("_:x"));
        assertEquals("_:b1", issuer.getId("_:y"));
        assertEquals("_:b0", issuer.getId("_:x"));
        assertEquals("_:b2", issuer.getId());
        assertEquals(Arrays.asList("_:x", "_:y"), issuer.getOrder());
        assertTrue(issuer.hasId("_:y"));
        assertFalse(issuer.hasId("_:z"));
    }

    @Test
    public void clonesAreIndependent() {
        final IdentifierIssuer issuer = new IdentifierIssuer("_:c14n");
        issuer.getId("_:x");
        final IdentifierIssuer copy = issuer.clone();
        assertEquals("_:c14n1", copy.getId("_:y"));
        assertFalse(issuer.hasId("_:y"));
        assertEquals("_:c14n1", issuer.getId("_:z"));
        assertEquals("_:c14n", copy.getPrefix());
    }
}
