package io.cronkit4j.core;

import java.util.NoSuchElementException;

public class JobNotFoundException extends NoSuchElementException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No job found for id: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
