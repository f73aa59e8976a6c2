package com.medicaledu.backend.modules.courses.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "course")
public class Course extends AbstractAggregateEntity {

    public static final int TITLE_MAX_LENGTH = 200;
    public static final int DESCRIPTION_MAX_LENGTH = 2000;
    public static final int MIN_DURATION_MINUTES = 1;
    public static final int MAX_DURATION_MINUTES = 1440;
    public static final int MIN_STUDENTS = 1;
    public static final int MAX_STUDENTS = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "instructor_id", nullable = false, columnDefinition = "uuid")
    private UUID instructorId;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "description", length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "price_amount", nullable = false, precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "price_currency", nullable = false, length = 3))
    })
    private Money price;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "max_students", nullable = false)
    private int maxStudents;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private CourseCategory category = CourseCategory.OTHER;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty_level", nullable = false, length = 16)
    private DifficultyLevel difficultyLevel = DifficultyLevel.BEGINNER;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb")
    private List<String> tags = new ArrayList<>();

    @Column(name = "thumbnail_url", length = 2048)
    private Url thumbnailUrl;

    @Column(name = "video_url", length = 2048)
    private Url videoUrl;

    @Column(name = "published", nullable = false)
    private boolean published;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @OneToMany(mappedBy = "course", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sortIndex ASC")
    private List<CourseMaterial> materials = new ArrayList<>();

    protected Course() {
    }

    public static Course create(
            UUID instructorId,
            String title,
            String description,
            Money price,
            int durationMinutes,
            int maxStudents,
            CourseCategory category,
            DifficultyLevel difficultyLevel,
            List<String> tags,
            Url thumbnailUrl,
            Url videoUrl,
            OffsetDateTime now
    ) {
        if (instructorId == null) {
            throw new IllegalArgumentException("Instructor is required.");
        }
        Course course = new Course();
        course.id = UUID.randomUUID();
        course.instructorId = instructorId;
        course.title = requireTitle(title);
        course.description = checkDescription(description);
        course.price = requirePrice(price);
        course.durationMinutes = requireDuration(durationMinutes);
        course.maxStudents = requireMaxStudents(maxStudents);
        course.category = category != null ? category : CourseCategory.OTHER;
        course.difficultyLevel = difficultyLevel != null ? difficultyLevel : DifficultyLevel.BEGINNER;
        course.tags = normalizeTags(tags);
        course.thumbnailUrl = thumbnailUrl;
        course.videoUrl = videoUrl;
        course.registerEvent(new CourseEvents.Created(course.id, now, instructorId, course.title));
        return course;
    }

    /**
     * Applies the non-null values. Records a single update event.
     */
    public void updateDetails(
            String title,
            String description,
            Integer durationMinutes,
            Integer maxStudents,
            CourseCategory category,
            DifficultyLevel difficultyLevel,
            List<String> tags,
            Url thumbnailUrl,
            Url videoUrl,
            OffsetDateTime now
    ) {
        if (title != null) {
            this.title = requireTitle(title);
        }
        if (description != null) {
            this.description = checkDescription(description);
        }
        if (durationMinutes != null) {
            this.durationMinutes = requireDuration(durationMinutes);
        }
        if (maxStudents != null) {
            this.maxStudents = requireMaxStudents(maxStudents);
        }
        if (category != null) {
            this.category = category;
        }
        if (difficultyLevel != null) {
            this.difficultyLevel = difficultyLevel;
        }
        if (tags != null) {
            this.tags = normalizeTags(tags);
        }
        if (thumbnailUrl != null) {
            this.thumbnailUrl = thumbnailUrl;
        }
        if (videoUrl != null) {
            this.videoUrl = videoUrl;
        }
        registerEvent(new CourseEvents.Updated(id, now));
    }

    public void updatePrice(Money newPrice, OffsetDateTime now) {
        this.price = requirePrice(newPrice);
        registerEvent(new CourseEvents.Updated(id, now));
    }

    public boolean isActive() {
        return deletedAt == null;
    }

    public void publish(OffsetDateTime now) {
        if (published) {
            throw new IllegalStateException("Course is already published.");
        }
        if (!isActive()) {
            throw new IllegalStateException("Inactive courses cannot be published.");
        }
        if (materials.isEmpty()) {
            throw new IllegalStateException("A course needs at least one material before it can be published.");
        }
        this.published = true;
        this.publishedAt = now;
        registerEvent(new CourseEvents.Published(id, now, instructorId, title));
    }

    public void unpublish(OffsetDateTime now) {
        if (!published) {
            throw new IllegalStateException("Course is not published.");
        }
        this.published = false;
        registerEvent(new CourseEvents.Unpublished(id, now));
    }

    public void deactivate(OffsetDateTime now) {
        if (!isActive()) {
            throw new IllegalStateException("Course is already inactive.");
        }
        if (published) {
            unpublish(now);
        }
        this.deletedAt = now;
        registerEvent(new CourseEvents.Deactivated(id, now));
    }

    public void activate(OffsetDateTime now) {
        if (isActive()) {
            throw new IllegalStateException("Course is already active.");
        }
        this.deletedAt = null;
        registerEvent(new CourseEvents.Activated(id, now));
    }

    public CourseMaterial addMaterial(CourseMaterialDraft draft, OffsetDateTime now) {
        int sortIndex = draft.sortIndex() != null ? draft.sortIndex() : nextSortIndex();
        CourseMaterial material = CourseMaterial.create(this, draft, sortIndex);
        materials.add(material);
        materials.sort(Comparator.comparingInt(CourseMaterial::getSortIndex));
        registerEvent(new CourseEvents.MaterialAdded(id, now, material.getId(), material.getTitle()));
        return material;
    }

    public void removeMaterial(UUID materialId, OffsetDateTime now) {
        CourseMaterial material = findMaterial(materialId);
        if (material == null) {
            throw new IllegalArgumentException("Material not found: " + materialId);
        }
        materials.remove(material);
        for (int i = 0; i < materials.size(); i++) {
            materials.get(i).changeSortIndex(i);
        }
        registerEvent(new CourseEvents.MaterialRemoved(id, now, materialId));
    }

    /**
     * @param orderedIds every current material id exactly once, in the new order
     */
    public void reorderMaterials(List<UUID> orderedIds, OffsetDateTime now) {
        if (orderedIds == null || orderedIds.size() != materials.size()) {
            throw new IllegalArgumentException("Reorder must list every material exactly once.");
        }
        Set<UUID> unique = new HashSet<>(orderedIds);
        Map<UUID, CourseMaterial> byId = materials.stream()
                .collect(Collectors.toMap(CourseMaterial::getId, Function.identity()));
        if (unique.size() != orderedIds.size() || !byId.keySet().equals(unique)) {
            throw new IllegalArgumentException("Reorder must list every material exactly once.");
        }
        for (int i = 0; i < orderedIds.size(); i++) {
            byId.get(orderedIds.get(i)).changeSortIndex(i);
        }
        materials.sort(Comparator.comparingInt(CourseMaterial::getSortIndex));
        registerEvent(new CourseEvents.MaterialsReordered(id, now, List.copyOf(orderedIds)));
    }

    public void replaceMaterials(List<CourseMaterialDraft> drafts, OffsetDateTime now) {
        for (CourseMaterial existing : List.copyOf(materials)) {
            removeMaterial(existing.getId(), now);
        }
        for (CourseMaterialDraft draft : drafts) {
            addMaterial(draft, now);
        }
    }

    public CourseMaterial findMaterial(UUID materialId) {
        return materials.stream()
                .filter(material -> material.getId().equals(materialId))
                .findFirst()
                .orElse(null);
    }

    private int nextSortIndex() {
        return materials.stream().mapToInt(CourseMaterial::getSortIndex).max().orElse(-1) + 1;
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title is required.");
        }
        String trimmed = title.trim();
        if (trimmed.length() > TITLE_MAX_LENGTH) {
            throw new IllegalArgumentException("Title must not exceed " + TITLE_MAX_LENGTH + " characters.");
        }
        return trimmed;
    }

    private static String checkDescription(String description) {
        if (description != null && description.length() > DESCRIPTION_MAX_LENGTH) {
            throw new IllegalArgumentException("Description must not exceed " + DESCRIPTION_MAX_LENGTH + " characters.");
        }
        return description;
    }

    private static Money requirePrice(Money price) {
        if (price == null) {
            throw new IllegalArgumentException("Price is required.");
        }
        return price;
    }

    private static int requireDuration(int durationMinutes) {
        if (durationMinutes < MIN_DURATION_MINUTES || durationMinutes > MAX_DURATION_MINUTES) {
            throw new IllegalArgumentException("Duration must be between " + MIN_DURATION_MINUTES + " and "
                    + MAX_DURATION_MINUTES + " minutes.");
        }
        return durationMinutes;
    }

    private static int requireMaxStudents(int maxStudents) {
        if (maxStudents < MIN_STUDENTS || maxStudents > MAX_STUDENTS) {
            throw new IllegalArgumentException("Max students must be between " + MIN_STUDENTS + " and " + MAX_STUDENTS + ".");
        }
        return maxStudents;
    }

    private static List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return new ArrayList<>();
        }
        return tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getInstructorId() {
        return instructorId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Money getPrice() {
        return price;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public int getMaxStudents() {
        return maxStudents;
    }

    public CourseCategory getCategory() {
        return category;
    }

    public DifficultyLevel getDifficultyLevel() {
        return difficultyLevel;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public Url getThumbnailUrl() {
        return thumbnailUrl;
    }

    public Url getVideoUrl() {
        return videoUrl;
    }

    public boolean isPublished() {
        return published;
    }

    public OffsetDateTime getPublishedAt() {
        return publishedAt;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public List<CourseMaterial> getMaterials() {
        return Collections.unmodifiableList(materials);
    }
}
