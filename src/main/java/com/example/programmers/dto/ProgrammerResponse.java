package com.example.programmers.dto;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ProgrammerResponse {
    private Long id;
    private String name;
    private Integer age;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
