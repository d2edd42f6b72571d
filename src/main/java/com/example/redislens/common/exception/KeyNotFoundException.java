package com.example.redislens.common.exception;

import lombok.Getter;

@Getter
public class KeyNotFoundException extends RuntimeException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key '" + key + "' not found");
        this.key = key;
    }
}
