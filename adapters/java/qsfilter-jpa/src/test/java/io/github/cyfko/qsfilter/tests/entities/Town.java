package io.github.cyfko.qsfilter.tests.entities;

import jakarta.persistence.*;

@Entity
@Table(name = "town")
public class Town {

    @Id
    private Integer id;

    private String name;

    protected Town() {
    }

    public Town(Integer id, String name) {
        this.id = id;
        this.name = name;
    }

    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
