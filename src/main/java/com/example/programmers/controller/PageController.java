package com.example.programmers.controller;

import com.example.programmers.config.ClientProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Renders the page that hosts the Angular client. The client routes are listed so a reload or
 * bookmark on any of them gets the same page, after which the client router takes over.
 */
@Slf4j
@Controller
public class PageController {
    static final String VIEW = "index";

    private final ClientProperties clientProperties;

    public PageController(ClientProperties clientProperties) {
        this.clientProperties = clientProperties;
    }

    @GetMapping({"/", "/programmers", "/programmers/new", "/programmers/{id}", "/programmers/{id}/edit"})
    public String page(Model model) {
        log.debug("Rendering client page with {} scripts", clientProperties.getScripts().size());
        model.addAttribute("title", clientProperties.getTitle());
        model.addAttribute("scripts", clientProperties.getScripts());
        return VIEW;
    }
}
