package com.kiln.pipeline.contract;

/**
 * Thrown while interpreting a link contract: unknown condition syntax, an artifact reference without an id,
 * or a malformed coherence policy. Loaders wrap it with the location of the offending document.
 */
public class InvalidContractException extends RuntimeException {

    public InvalidContractException(String message) {
        super(message);
    }
}
