package com.medicaledu.backend.modules.courses.domain;

import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "course_material")
public class CourseMaterial extends AbstractTimestampedEntity {

    public static final int TITLE_MAX_LENGTH = 200;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "file_url", nullable = false, length = 2048)
    private Url fileUrl;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Column(name = "content_type", length = 100)
    private String contentType;

    @Column(name = "file_size_bytes", nullable = false)
    private long fileSizeBytes;

    @Column(name = "sort_index", nullable = false)
    private int sortIndex;

    @Column(name = "is_free", nullable = false)
    private boolean free;

    @Column(name = "is_required", nullable = false)
    private boolean required;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    protected CourseMaterial() {
    }

    static CourseMaterial create(Course course, CourseMaterialDraft draft, int sortIndex) {
        if (draft.title() == null || draft.title().isBlank()) {
            throw new IllegalArgumentException("Material title is required.");
        }
        if (draft.title().length() > TITLE_MAX_LENGTH) {
            throw new IllegalArgumentException("Material title must not exceed " + TITLE_MAX_LENGTH + " characters.");
        }
        if (draft.fileUrl() == null) {
            throw new IllegalArgumentException("Material file URL is required.");
        }
        if (draft.fileSizeBytes() < 0) {
            throw new IllegalArgumentException("File size cannot be negative.");
        }
        if (draft.durationMinutes() != null && draft.durationMinutes() < 0) {
            throw new IllegalArgumentException("Material duration cannot be negative.");
        }
        CourseMaterial material = new CourseMaterial();
        material.id = UUID.randomUUID();
        material.course = course;
        material.title = draft.title().trim();
        material.description = draft.description();
        material.fileUrl = draft.fileUrl();
        material.fileName = draft.fileName();
        material.contentType = draft.contentType();
        material.fileSizeBytes = draft.fileSizeBytes();
        material.changeSortIndex(sortIndex);
        material.free = draft.free();
        material.required = draft.required();
        material.durationMinutes = draft.durationMinutes();
        return material;
    }

    void changeSortIndex(int sortIndex) {
        if (sortIndex < 0) {
            throw new IllegalArgumentException("Sort index cannot be negative.");
        }
        this.sortIndex = sortIndex;
    }

    public UUID getId() {
        return id;
    }

    public Course getCourse() {
        return course;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Url getFileUrl() {
        return fileUrl;
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    public long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public int getSortIndex() {
        return sortIndex;
    }

    public boolean isFree() {
        return free;
    }

    public boolean isRequired() {
        return required;
    }

    public Integer getDurationMinutes() {
        return durationMinutes;
    }
}
