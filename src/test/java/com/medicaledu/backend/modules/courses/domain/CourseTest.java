package com.medicaledu.backend.modules.courses.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.Url;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CourseTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Test
    @DisplayName("publishing needs at least one material")
    void publishRequiresMaterial() {
        Course course = course();

        assertThatThrownBy(() -> course.publish(NOW)).isInstanceOf(IllegalStateException.class);

        course.addMaterial(draft("Lecture 1", null), NOW);
        course.publish(NOW);

        assertThat(course.isPublished()).isTrue();
        assertThat(course.getPublishedAt()).isEqualTo(NOW);
        assertThat(course.getDomainEvents()).anyMatch(event -> event instanceof CourseEvents.Published);
    }

    @Test
    @DisplayName("deactivating a published course unpublishes it first")
    void deactivateUnpublishes() {
        Course course = course();
        course.addMaterial(draft("Lecture 1", null), NOW);
        course.publish(NOW);

        course.deactivate(NOW);

        assertThat(course.isActive()).isFalse();
        assertThat(course.isPublished()).isFalse();
        assertThatThrownBy(() -> course.publish(NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void materialsAreAppendedAndReordered() {
        Course course = course();
        CourseMaterial first = course.addMaterial(draft("Intro", null), NOW);
        CourseMaterial second = course.addMaterial(draft("Cases", null), NOW);
        assertThat(second.getSortIndex()).isEqualTo(first.getSortIndex() + 1);

        course.reorderMaterials(List.of(second.getId(), first.getId()), NOW);

        assertThat(course.getMaterials()).extracting(CourseMaterial::getTitle).containsExactly("Cases", "Intro");
        assertThatThrownBy(() -> course.reorderMaterials(List.of(first.getId()), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removingMaterialCompactsSortIndexes() {
        Course course = course();
        CourseMaterial first = course.addMaterial(draft("A", null), NOW);
        course.addMaterial(draft("B", null), NOW);
        course.addMaterial(draft("C", null), NOW);

        course.removeMaterial(first.getId(), NOW);

        assertThat(course.getMaterials()).extracting(CourseMaterial::getSortIndex).containsExactly(0, 1);
        assertThatThrownBy(() -> course.removeMaterial(UUID.randomUUID(), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("title, duration and class size are bounded")
    void creationGuards() {
        Money price = Money.of(BigDecimal.TEN, Currency.USD);
        UUID instructorId = UUID.randomUUID();

        assertThatThrownBy(() -> Course.create(instructorId, " ", null, price, 60, 10,
                null, null, null, null, null, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Course.create(instructorId, "Title", null, price, 0, 10,
                null, null, null, null, null, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Course.create(instructorId, "Title", null, price, 60, 1001,
                null, null, null, null, null, NOW)).isInstanceOf(IllegalArgumentException.class);

        Course defaults = Course.create(instructorId, "Title", null, price, 60, 10, null, null, null, null, null, NOW);
        assertThat(defaults.getCategory()).isEqualTo(CourseCategory.OTHER);
        assertThat(defaults.getDifficultyLevel()).isEqualTo(DifficultyLevel.BEGINNER);
    }

    private static Course course() {
        return Course.create(UUID.randomUUID(), "Cardiac Auscultation", "Heart sounds for clinicians",
                Money.of(new BigDecimal("149.00"), Currency.USD), 90, 20, CourseCategory.CLINICAL_SKILLS,
                DifficultyLevel.INTERMEDIATE, List.of("cardiology"), null, null, NOW);
    }

    private static CourseMaterialDraft draft(String title, Integer sortIndex) {
        return new CourseMaterialDraft(title, null, Url.of("https://cdn.example.com/" + title.replace(' ', '-')),
                null, "video/mp4", 1024, sortIndex, false, true, 15);
    }
}
