package de.t14d3.skein.test.entities;

import de.t14d3.skein.annotations.Entity;
import de.t14d3.skein.annotations.Id;

@Entity
public class Person {
    @Id
    private long id;

    private String name;

    public Person() {}

    public Person(long id, String name) {
        this.id = id;
        this.name = name;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
