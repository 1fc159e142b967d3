package com.example.clubservice.dto;

/**
 * Simple acknowledgement body.
 */
public record MessageResponse(String message) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
