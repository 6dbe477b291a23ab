package com.mira.mediavault.exception;

/**
 * The caller lacks the role the operation requires: owner-only operations
 * attempted by someone else, or non-participants touching a media item.
 */
public class UnauthorizedActionException extends RuntimeException {

    public UnauthorizedActionException(String message) {
        super(message);
    }
}
