package com.shlokmestry.flowlimit.api;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.shlokmestry.flowlimit.paths.Path;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PathNotFoundException extends RuntimeException {
    public PathNotFoundException(Path path) {
        super("Path not found: " + path);
    }
}
