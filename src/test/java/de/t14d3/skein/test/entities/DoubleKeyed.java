package de.t14d3.skein.test.entities;

import de.t14d3.skein.annotations.Entity;
import de.t14d3.skein.annotations.Id;

/**
 * Declares two primary keys, which the object model rejects.
 */
@Entity
public class DoubleKeyed {
    @Id
    private long first;

    @Id
    private long second;
}
