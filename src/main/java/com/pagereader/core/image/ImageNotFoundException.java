package com.pagereader.core.image;

import java.nio.file.Path;

public class ImageNotFoundException extends RuntimeException {
    private final Path path;

    public ImageNotFoundException(Path path) {
        super("Image not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
