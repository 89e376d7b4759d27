package com.example.programmers.repository;

import com.example.programmers.entity.Programmer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProgrammerRepository extends JpaRepository<Programmer, Long> {
    List<Programmer> findAllByOrderByIdAsc();
}
