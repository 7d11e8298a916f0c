package com.example.doisync.web.dto;

import java.util.List;

public class JobSubmission {
    private String jobId;
    private int doiCount;
    private List<String> warnings;

    public JobSubmission() {}

    public JobSubmission(String jobId, int doiCount, List<String> warnings) {
        this.jobId = jobId;
        this.doiCount = doiCount;
        this.warnings = warnings;
    }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public int getDoiCount() { return doiCount; }
    public void setDoiCount(int doiCount) { this.doiCount = doiCount; }
    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
}
