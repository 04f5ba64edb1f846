package com.community.leaderboard.service;

/**
 * Thrown when a build is requested while another one is still running.
 */
public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message) {
        super(message);
    }
}
