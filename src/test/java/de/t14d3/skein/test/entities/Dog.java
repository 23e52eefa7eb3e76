package de.t14d3.skein.test.entities;

import de.t14d3.skein.annotations.Column;
import de.t14d3.skein.annotations.Entity;

@Entity
public class Dog {
    @Column(required = true)
    private String name;

    private int age;

    private Person owner;

    public Dog() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getAge() { return age; }
    public void setAge(int age) { this.age = age; }

    public Person getOwner() { return owner; }
    public void setOwner(Person owner) { this.owner = owner; }
}
