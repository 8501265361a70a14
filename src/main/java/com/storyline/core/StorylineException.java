package com.storyline.core;

/**
 * Base type of every error raised while parsing or resolving narrative text.
 */
public class StorylineException extends RuntimeException {

    public StorylineException(String message) {
        super(message);
    }

    public StorylineException(String message, Throwable cause) {
        super(message, cause);
    }
}
