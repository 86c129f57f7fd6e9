package com.pulsenms.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertThrows;

import static org.junit.jupiter.api.Assertions.assertTrue;

class OidTemplateTest
{

    @Test
    void placeholderIsReplacedByIndex()
    {
        var template = new OidTemplate("1.3.6.1.2.1.2.2.1.10.{index}", false);

        assertTrue(template.requiresIndex());

        assertEquals("1.3.6.1.2.1.2.2.1.10.3", template.resolve(3));

        assertEquals("1.3.6.1.2.1.2.2.1.10.0", template.resolve(0));
    }

    @Test
    void templateWithoutPlaceholderIgnoresIndex()
    {
        var template = new OidTemplate(" 1.3.6.1.2.1.1.3.0 ", false);

        assertFalse(template.requiresIndex());

        assertEquals("1.3.6.1.2.1.1.3.0", template.resolve(null));

        assertEquals("1.3.6.1.2.1.1.3.0", template.resolve(7));
    }

    @Test
    void missingOrNegativeIndexIsRejected()
    {
        var template = new OidTemplate("1.3.6.1.2.1.31.1.1.1.6.{index}", true);

        assertThrows(IllegalArgumentException.class, () -> template.resolve(null));

        assertThrows(IllegalArgumentException.class, () -> template.resolve(-1));
    }

    @Test
    void malformedTemplatesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new OidTemplate("1.3.6.x", false));

        assertThrows(IllegalArgumentException.class, () -> new OidTemplate("1.3.{index}.{index}", true));

        assertThrows(IllegalArgumentException.class, () -> new OidTemplate(null, false));
    }
}
