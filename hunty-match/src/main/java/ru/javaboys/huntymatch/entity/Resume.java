package ru.javaboys.huntymatch.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.time.LocalDateTime;

@Getter
@ToString(exclude = {"originalText", "embedding"})
public class Resume {

    private final long id;
    private final String fileName;
    private final String originalText;
    @Nullable
    private final ResumeProfile profile;
    private final LocalDateTime uploadedAt;

    @Nullable
    private volatile float[] embedding;

    @Builder(toBuilder = true)
    public Resume(long id,
                  @Nullable String fileName,
                  @Nullable String originalText,
                  @Nullable ResumeProfile profile,
                  @Nullable LocalDateTime uploadedAt,
                  @Nullable float[] embedding) {
        this.id = id;
        this.fileName = StringUtils.defaultString(fileName);
        this.originalText = StringUtils.defaultString(originalText);
        this.profile = profile;
        this.uploadedAt = uploadedAt == null ? LocalDateTime.now() : uploadedAt;
        this.embedding = embedding;
    }

    public void attachEmbedding(float[] embedding) {
        this.embedding = embedding;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}
