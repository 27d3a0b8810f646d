package com.example.quorum.memory;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

final class NotFound {

    private NotFound() {
    }

    static ResponseStatusException of(String kind, String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, kind + " not found: " + id);
    }
}
