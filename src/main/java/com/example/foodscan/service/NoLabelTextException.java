package com.example.foodscan.service;

/**
 * Raised when a capture yields no readable text, so the caller can ask the user to rescan.
 */
public class NoLabelTextException extends RuntimeException {

    public NoLabelTextException(String message) {
        super(message);
    }
}
