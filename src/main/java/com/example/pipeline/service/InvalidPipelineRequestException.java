package com.example.pipeline.service;

/** Caller-fixable input problem: unknown status, missing actor, bad threshold. Never retried. */
public class InvalidPipelineRequestException extends IllegalArgumentException {

    public InvalidPipelineRequestException(String message) {
        super(message);
    }
}
