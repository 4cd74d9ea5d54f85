package com.example.datalifecycle.service;

import lombok.Getter;

public class ComplianceException extends RuntimeException {

    public enum Code {
        JOB_NOT_FOUND,
        JOB_ALREADY_RUNNING,
        DUPLICATE_JOB
    }

    @Getter
    private final Code code;

    private ComplianceException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static ComplianceException jobNotFound(String jobName) {
        return new ComplianceException(Code.JOB_NOT_FOUND,
                "Job " + jobName + " is not registered");
    }

    public static ComplianceException jobAlreadyRunning(String jobName) {
        return new ComplianceException(Code.JOB_ALREADY_RUNNING,
                "Job " + jobName + " is already running");
    }

    public static ComplianceException duplicateJob(String jobName) {
        return new ComplianceException(Code.DUPLICATE_JOB,
                "Job with name " + jobName + " is already registered");
    }
}
