package com.example.programmers.service;

import com.example.programmers.dto.ProgrammerForm;
import com.example.programmers.entity.Programmer;
import com.example.programmers.exception.ProgrammerNotFoundException;
import com.example.programmers.repository.ProgrammerRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * CRUD operations on {@link Programmer}. Input arrives already validated by the controller;
 * this class converts it, hashes passwords and stamps timestamps.
 */
@Service
@RequiredArgsConstructor
public class ProgrammerService {
    private static final Logger logger = LoggerFactory.getLogger(ProgrammerService.class);

    private final ProgrammerRepository programmerRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional(readOnly = true)
    public List<Programmer> findAll() {
        return programmerRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Programmer findById(Long id) {
        return programmerRepository.findById(id)
            .orElseThrow(() -> new ProgrammerNotFoundException(id));
    }

    @Transactional
    public Programmer create(ProgrammerForm form) {
        if (!form.hasPassword()) {
            throw new IllegalArgumentException("Password is required to create a programmer");
        }
        Programmer programmer = new Programmer();
        applyAttributes(programmer, form);
        programmer.setPasswordDigest(passwordEncoder.encode(form.getPassword()));

        LocalDateTime now = currentTimestamp();
        programmer.setCreatedAt(now);
        programmer.setUpdatedAt(now);

        Programmer saved = programmerRepository.save(programmer);
        logger.info("Programmer created: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public Programmer update(Long id, ProgrammerForm form) {
        Programmer programmer = findById(id);
        applyAttributes(programmer, form);
        if (form.hasPassword()) {
            programmer.setPasswordDigest(passwordEncoder.encode(form.getPassword()));
            logger.debug("Password digest replaced for programmer id={}", id);
        }
        programmer.setUpdatedAt(currentTimestamp());

        Programmer saved = programmerRepository.save(programmer);
        logger.info("Programmer updated: id={}", saved.getId());
        return saved;
    }

    @Transactional
    public void delete(Long id) {
        Programmer programmer = findById(id);
        programmerRepository.delete(programmer);
        logger.info("Programmer deleted: id={}", id);
    }

    // Columns keep microseconds, so responses must not carry more
    private static LocalDateTime currentTimestamp() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MICROS);
    }

    private void applyAttributes(Programmer programmer, ProgrammerForm form) {
        programmer.setName(form.getName());
        programmer.setAge(Integer.valueOf(form.getAge().trim()));
    }
}
