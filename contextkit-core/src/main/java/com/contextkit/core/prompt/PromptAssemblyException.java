package com.contextkit.core.prompt;

/**
 * A prompt build failed as a whole; no partial prompt is produced.
 */
public class PromptAssemblyException extends RuntimeException {

    public PromptAssemblyException(String message) {
        super(message);
    }

    public PromptAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
