package ru.javaboys.huntymatch.dto;

import ru.javaboys.huntymatch.entity.Job;

public record RetrievedCandidate(Job job, double similarity) {
}
