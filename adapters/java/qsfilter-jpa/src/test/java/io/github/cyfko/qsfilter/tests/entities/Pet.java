package io.github.cyfko.qsfilter.tests.entities;

import jakarta.persistence.*;

@Entity
@Table(name = "pet")
public class Pet {

    @Id
    private Integer petId;

    private String petName;

    @ManyToOne
    @JoinColumn(name = "owner_id")
    private User owner;

    protected Pet() {
    }

    public Pet(Integer petId, String petName, User owner) {
        this.petId = petId;
        this.petName = petName;
        this.owner = owner;
    }

    public Integer getPetId() {
        return petId;
    }

    public String getPetName() {
        return petName;
    }

    public User getOwner() {
        return owner;
    }
}
