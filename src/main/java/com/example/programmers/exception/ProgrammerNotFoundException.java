package com.example.programmers.exception;

public class ProgrammerNotFoundException extends RuntimeException {
    private final Long id;

    public ProgrammerNotFoundException(Long id) {
        super("Programmer not found: " + id);
        this.id = id;
    }

    public Long getId() {
        return id;
    }
}
