package com.example.programmers.dto;

/**
 * Validation group for constraints that only apply when a programmer is created.
 */
public interface OnCreate {
}
