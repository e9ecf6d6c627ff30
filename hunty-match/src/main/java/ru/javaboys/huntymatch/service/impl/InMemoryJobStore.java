package ru.javaboys.huntymatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.JobMatchEntity;
import ru.javaboys.huntymatch.entity.Resume;
import ru.javaboys.huntymatch.exception.InvalidInputException;
import ru.javaboys.huntymatch.service.JobStore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local store. Ids are assigned from per-type sequences when the incoming id is 0.
 */
@Slf4j
@Component
public class InMemoryJobStore implements JobStore {

    private final Map<Long, Job> jobs = new ConcurrentSkipListMap<>();
    private final Map<Long, Resume> resumes = new ConcurrentHashMap<>();
    private final Map<Long, JobMatchEntity> matches = new ConcurrentSkipListMap<>();

    private final AtomicLong jobSeq = new AtomicLong();
    private final AtomicLong resumeSeq = new AtomicLong();
    private final AtomicLong matchSeq = new AtomicLong();

    @Override
    public List<Job> getAllJobs() {
        return List.copyOf(jobs.values());
    }

    @Override
    public Optional<Job> getJobById(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public long countJobs() {
        return jobs.size();
    }

    @Override
    public Job createJob(Job job) {
        Job stored = job.getId() > 0 ? job : job.toBuilder().id(jobSeq.incrementAndGet()).build();
        jobSeq.accumulateAndGet(stored.getId(), Math::max);
        jobs.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public void updateJobEmbedding(long jobId, float[] embedding) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new InvalidInputException("Job not found: " + jobId);
        }
        job.attachEmbedding(embedding);
    }

    @Override
    public Resume createResume(Resume resume) {
        Resume stored = resume.getId() > 0 ? resume : resume.toBuilder().id(resumeSeq.incrementAndGet()).build();
        resumeSeq.accumulateAndGet(stored.getId(), Math::max);
        resumes.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<Resume> getResumeById(long id) {
        return Optional.ofNullable(resumes.get(id));
    }

    @Override
    public JobMatchEntity createJobMatch(JobMatchEntity match) {
        long id = matchSeq.incrementAndGet();
        JobMatchEntity stored = match.toBuilder()
                .id(id)
                .createdAt(match.getCreatedAt() != null ? match.getCreatedAt() : LocalDateTime.now())
                .build();
        matches.put(id, stored);
        return stored;
    }

    @Override
    public List<JobMatchEntity> getJobMatchesByResumeId(long resumeId) {
        List<JobMatchEntity> out = new ArrayList<>();
        for (JobMatchEntity m : matches.values()) {
            if (m.getResumeId() == resumeId) out.add(m);
        }
        out.sort(Comparator.comparing(JobMatchEntity::getId));
        return out;
    }
}
