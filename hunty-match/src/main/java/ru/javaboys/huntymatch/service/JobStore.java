package ru.javaboys.huntymatch.service;

import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.JobMatchEntity;
import ru.javaboys.huntymatch.entity.Resume;

import java.util.List;
import java.util.Optional;

/**
 * CRUD boundary for jobs, résumés and persisted matches.
 */
public interface JobStore {

    List<Job> getAllJobs();

    Optional<Job> getJobById(long id);

    long countJobs();

    Job createJob(Job job);

    void updateJobEmbedding(long jobId, float[] embedding);

    Resume createResume(Resume resume);

    Optional<Resume> getResumeById(long id);

    /**
     * Appends a match record. Calling it twice for the same pair stores two records.
     */
    JobMatchEntity createJobMatch(JobMatchEntity match);

    List<JobMatchEntity> getJobMatchesByResumeId(long resumeId);
}
