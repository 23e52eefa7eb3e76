package de.t14d3.skein.test.entities;

import de.t14d3.skein.annotations.Entity;
import de.t14d3.skein.annotations.Indexed;

/**
 * Requests an index on a type that cannot be indexed.
 */
@Entity
public class Measurement {
    @Indexed
    private double value;
}
