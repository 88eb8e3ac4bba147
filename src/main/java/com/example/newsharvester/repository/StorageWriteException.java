package com.example.newsharvester.repository;

import java.io.IOException;

public class StorageWriteException extends IOException {
    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
